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

package com.iqbars.elements;

/**
 * The unit in which a bar interval length is expressed. The code is the literal IQFeed expects in bar requests.
 */
public enum IntervalType {
    SECONDS("s"),
    VOLUME("v"),
    TICKS("t");

    private final String code;

    IntervalType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
