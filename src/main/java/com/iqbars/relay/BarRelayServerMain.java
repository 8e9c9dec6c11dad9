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

package com.iqbars.relay;

import com.iqbars.adapters.iqfeed.IqFeedConfig;
import com.iqbars.exceptions.InvalidArgumentException;
import com.iqbars.exceptions.InvalidStateException;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.io.File;

/**
 * Runs the bar relay until the process is stopped.
 * Usage: BarRelayServerMain [config.properties]. Without an argument the bundled iqbars.properties is used.
 */
public class BarRelayServerMain {
    private static final Log log = LogFactory.getLog(BarRelayServerMain.class);

    public static void main(String[] args) {
        try {
            IqFeedConfig config = args.length > 0 ? IqFeedConfig.load(new File(args[0])) : IqFeedConfig.load();
            BarRelayServer server = new BarRelayServer(config, new BarRelayJob(config));
            server.start();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                try {
                    server.stop();
                } catch (InvalidStateException e) {
                    log.warn("Error during shutdown: " + e.getMessage());
                }
            }, "relay shutdown"));
            server.join();
        } catch (InvalidArgumentException | InvalidStateException e) {
            log.fatal("Could not start the IQFeed bar relay: " + e.getMessage(), e);
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Interrupted. Exiting.");
        }
    }
}
