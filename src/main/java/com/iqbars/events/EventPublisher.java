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

import net.engio.mbassy.bus.MBassador;
import net.engio.mbassy.bus.error.IPublicationErrorHandler;
import net.engio.mbassy.bus.error.PublicationError;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * The event bus shared by the components of one process. A thin wrapper over MBassador: listeners are plain
 * objects with {@code @Handler} methods. Note that MBassador holds listeners through weak references, so a
 * subscriber must be strongly referenced elsewhere for as long as it wants events.
 */
public class EventPublisher {
    private static final Log log = LogFactory.getLog(EventPublisher.class);

    private final MBassador<Object> bus;

    public EventPublisher() {
        bus = new MBassador<>(new LoggingErrorHandler());
    }

    public void subscribe(Object listener) {
        bus.subscribe(listener);
    }

    public boolean unsubscribe(Object listener) {
        return bus.unsubscribe(listener);
    }

    /**
     * Delivers the event to all handlers before returning (for synchronous handlers)
     */
    public void publish(Object event) {
        bus.publish(event);
    }

    public void shutdown() {
        bus.shutdown();
    }

    /**
     * Handler failures end up here. They are logged and never propagate to the publisher.
     */
    private static class LoggingErrorHandler implements IPublicationErrorHandler {
        @Override
        public void handleError(PublicationError error) {
            log.error("Error while delivering event: " + error.getMessage(), error.getCause());
        }
    }
}
