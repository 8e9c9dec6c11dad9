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

package com.iqbars;

import com.iqbars.exceptions.InvalidArgumentException;
import com.iqbars.exceptions.InvalidStateException;

/**
 * Components that are created with a default constructor and then configured.
 */
public interface IConfigInitializable<C> {
    /**
     * A method which when called on an instance produced by a default constructor, would either make this instance
     * fully functional, or would result in an exception indicating that the instance should be thrown away.
     *
     * @param config the configuration to work with.
     * @throws InvalidArgumentException if any of the relevant configuration entries is wrong
     * @throws InvalidStateException if after trying everything else, was still in an invalid state.
     */
    public void init(C config) throws InvalidArgumentException, InvalidStateException;
}
