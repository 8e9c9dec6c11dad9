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

package com.iqbars.adapters.iqfeed.lookup;

import com.iqbars.adapters.iqfeed.IQFeedError;
import com.iqbars.adapters.iqfeed.NoDataError;
import com.iqbars.exceptions.InvalidStateException;
import com.iqbars.exceptions.MalformedFieldException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The state of one outstanding lookup: the records accumulated so far and a one-shot completion that the
 * requesting thread waits on. Records are only added by the connection's reader thread. Completion (normal or
 * exceptional) happens at most once, later attempts are ignored.
 */
public class PendingLookupRequest<T> {
    private final String ticker;
    private final ILookupLineParser<T> parser;
    private final ArrayList<T> records;
    private final CompletableFuture<List<T>> completion;

    public PendingLookupRequest(String ticker, ILookupLineParser<T> parser) {
        this.ticker = ticker;
        this.parser = parser;
        records = new ArrayList<>();
        completion = new CompletableFuture<>();
    }

    public String getTicker() {
        return ticker;
    }

    public boolean isDone() {
        return completion.isDone();
    }

    /**
     * Parses and accumulates one data line
     * @param fields the fields with field 0 already holding the ticker
     * @throws MalformedFieldException if the parser rejects the line. Nothing is accumulated in that case.
     */
    public void add(String[] fields) throws MalformedFieldException {
        records.add(parser.parse(fields));
    }

    public int size() {
        return records.size();
    }

    /**
     * Completes normally with whatever was accumulated
     * @return true if this call completed the request
     */
    public boolean complete() {
        return completion.complete(Collections.unmodifiableList(new ArrayList<>(records)));
    }

    /**
     * @return true if this call completed the request
     */
    public boolean fail(Exception e) {
        return completion.completeExceptionally(e);
    }

    /**
     * Blocks until the request completes or the timeout expires
     * @return the accumulated records, in arrival order
     * @throws NoDataError if the server said there is no data
     * @throws IQFeedError if the server reported an error
     * @throws InvalidStateException if the connection stopped reading, or the wait was interrupted
     * @throws TimeoutException if the request did not complete in time
     */
    public List<T> await(long timeout, TimeUnit unit) throws NoDataError, IQFeedError, InvalidStateException, TimeoutException {
        try {
            return completion.get(timeout, unit);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InvalidStateException("Interrupted while waiting for the lookup of " + ticker, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof NoDataError) {
                throw (NoDataError) cause;
            }
            if (cause instanceof IQFeedError) {
                throw (IQFeedError) cause;
            }
            if (cause instanceof InvalidStateException) {
                throw (InvalidStateException) cause;
            }
            throw new InvalidStateException("Lookup of " + ticker + " failed: " + cause, cause);
        }
    }
}
