/*
 * Copyright (c) 2015. Arnon Moscona
 *
 *     This program is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU Lesser General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     This program is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.iqbars.adapters.iqfeed;

/**
 * An error reported by IQFeed itself in response to a request ("E" in the second field), e.g.
 * "Too many simultaneous requests." or "Invalid symbol.". The literal error is carried through as received.
 * Whether to retry is the caller's decision; isRetriable() reports whether the error is known to be transient.
 */
public class IQFeedError extends Exception {
    private static final String[] TRANSIENT_ERRORS = {
            "Could not connect to History socket",
            "Unknown Server Error",
            "Socket Error: 10054 (WSAECONNRESET)", // connection reset by peer
            "Too many simultaneous requests"
    };

    private String literalError;
    private boolean isRetriable = true;

    public IQFeedError(String literalError, String message, boolean isRetriable) {
        super(message);
        this.literalError = literalError;
        this.isRetriable = isRetriable;
    }

    public IQFeedError(String literalError) {
        this(literalError, "IQFeed reported an error: '" + literalError + "'", canRetry(literalError));
    }

    public String getLiteralError() {
        return literalError;
    }

    public boolean isRetriable() {
        return isRetriable;
    }

    public static boolean canRetry(String literalError) {
        if (literalError == null) {
            return false;
        }
        for (String error : TRANSIENT_ERRORS) {
            if (literalError.contains(error)) {
                return true;
            }
        }
        return false;
    }
}
