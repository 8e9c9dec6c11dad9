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

package com.iqbars.exceptions;

/**
 * A single IQFeed line (or one of its fields) could not be converted into the record it should represent.
 * The damage is limited to that line: readers log it and move on.
 */
public class MalformedFieldException extends InvalidArgumentException {
    public MalformedFieldException(String message) {
        super(message);
    }

    public MalformedFieldException(String message, Throwable cause) {
        super(message, cause);
    }
}
