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

package com.iqbars.events;

import com.iqbars.adapters.iqfeed.ConnectionState;

/**
 * Published whenever an IQFeed connection's read loop starts or stops.
 */
public class ConnectionStateChangedEvent {
    public static enum Reason {
        CONNECTED,
        DISCONNECTED,   // stopped on request
        IDLE_TIMEOUT,   // nothing received within the idle timeout under TERMINATE_ON_IDLE
        END_OF_STREAM,  // the remote side closed the socket
        READ_ERROR
    }

    private final String connectionName;
    private final ConnectionState previousState;
    private final ConnectionState newState;
    private final Reason reason;

    public ConnectionStateChangedEvent(String connectionName, ConnectionState previousState, ConnectionState newState, Reason reason) {
        this.connectionName = connectionName;
        this.previousState = previousState;
        this.newState = newState;
        this.reason = reason;
    }

    public String getConnectionName() {
        return connectionName;
    }

    public ConnectionState getPreviousState() {
        return previousState;
    }

    public ConnectionState getNewState() {
        return newState;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return connectionName + ": " + previousState + " -> " + newState + " (" + reason + ")";
    }
}
