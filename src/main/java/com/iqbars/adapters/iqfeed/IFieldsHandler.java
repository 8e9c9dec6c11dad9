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
 * A hook offered every inbound line that is not a system message, before the line is matched against the
 * outstanding requests. Push style messages (which carry no request id) are recognized here.
 */
public interface IFieldsHandler {
    /**
     * @param fields the fields of one line, trailing empty fields removed
     * @return HANDLED if the line was consumed and needs no further processing
     */
    public HandlerResult handleFields(String[] fields);
}
