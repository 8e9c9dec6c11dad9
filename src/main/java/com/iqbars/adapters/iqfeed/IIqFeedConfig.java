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

import com.iqbars.events.EventPublisher;
import com.iqbars.exceptions.InvalidArgumentException;
import com.iqbars.exceptions.InvalidStateException;

import java.util.Map;

/**
 * Configuration data for IQFeed connections and the bar relay
 */
public interface IIqFeedConfig {
    public static final String CONNECTION = "connection";
    public static final String HISTORY = "history";
    public static final String RELAY = "relay";

    /**
     * A convenience service method that returns the component specific configuration info
     * @param component the name of the component
     * @return the entries for the component, or null if there are none
     */
    public Map<String, String> getComponentConfigFor(String component);

    public Map<String, Map<String, String>> getComponentConfig();

    public String simpleComponentConfigEntryWithOverride(String componentNode, String key, String overrideProperty) throws InvalidArgumentException, InvalidStateException;

    public String simpleComponentConfigEntryWithOverride(String componentNode, String key) throws InvalidArgumentException, InvalidStateException;

    /**
     * Same as simpleComponentConfigEntryWithOverride(componentNode, key) but parsed as an integer
     * @param defaultValue used when the entry is missing or blank
     */
    public int intComponentConfigEntryWithOverride(String componentNode, String key, int defaultValue) throws InvalidArgumentException, InvalidStateException;

    public EventPublisher getEventPublisher();
}
