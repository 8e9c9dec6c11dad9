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

package com.iqbars.threads;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * A daemon thread for long running server side work (socket readers, client sessions).
 * Anything the code lets escape is logged rather than left to the default uncaught exception handler.
 */
public class ServerThread extends Thread {
    private static final Log log = LogFactory.getLog(ServerThread.class);

    public ServerThread(Runnable code, String name) {
        super(guarded(code, name), "iqbars - " + name);
        setDaemon(true);
    }

    private static Runnable guarded(Runnable code, String name) {
        return () -> {
            try {
                code.run();
            } catch (RuntimeException e) {
                log.error("Unexpected exception in thread '" + name + "'", e);
            }
        };
    }
}
