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

import com.iqbars.elements.Bar;

/**
 * Receives bars pushed on a bar connection. Called on the connection's reader thread, so implementations
 * should return quickly. Exceptions are logged by the connection and do not stop delivery to other observers.
 */
@FunctionalInterface
public interface IBarObserver {
    public void onBar(Bar bar) throws Exception;
}
