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

import com.iqbars.exceptions.MalformedFieldException;

/**
 * Turns one data line of a lookup response into a typed record. By the time the parser sees the fields, the
 * request id in field 0 was already replaced with the ticker the request was made for.
 */
@FunctionalInterface
public interface ILookupLineParser<T> {
    public T parse(String[] fields) throws MalformedFieldException;
}
