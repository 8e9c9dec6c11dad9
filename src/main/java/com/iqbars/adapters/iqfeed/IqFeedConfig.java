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
import org.apache.commons.beanutils.BeanMap;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class IqFeedConfig implements IIqFeedConfig {
    public static final String DEFAULT_RESOURCE = "/iqbars.properties";

    private static final Pattern INTERPOLATION_PATTERN = Pattern.compile("(.*)#([a-zA-Z]+)\\{(.*)\\}(.*)");

    /**
     * Configuration parameters for components, keyed by component name
     */
    private Map<String, Map<String, String>> componentConfig;

    private UserOverrides userOverrides;
    private EventPublisher eventPublisher;

    public IqFeedConfig() {
        componentConfig = new HashMap<>();
        eventPublisher = new EventPublisher();
    }

    /**
     * Loads the configuration bundled with the application
     */
    public static IqFeedConfig load() throws InvalidStateException {
        try (InputStream in = IqFeedConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new InvalidStateException("Configuration resource " + DEFAULT_RESOURCE + " is missing from the classpath");
            }
            return load(in);
        } catch (IOException e) {
            throw new InvalidStateException("Error while reading configuration resource " + DEFAULT_RESOURCE + ": " + e, e);
        }
    }

    public static IqFeedConfig load(File file) throws InvalidStateException {
        try (InputStream in = FileUtils.openInputStream(file)) {
            return load(in);
        } catch (IOException e) {
            throw new InvalidStateException("Error while reading configuration file " + file + ": " + e, e);
        }
    }

    /**
     * Reads "component.key=value" properties into the component configuration
     */
    public static IqFeedConfig load(InputStream in) throws IOException {
        Properties properties = new Properties();
        properties.load(IOUtils.toBufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)));

        IqFeedConfig config = new IqFeedConfig();
        for (String name : properties.stringPropertyNames()) {
            String component = StringUtils.substringBefore(name, ".");
            String key = StringUtils.substringAfter(name, ".");
            if (StringUtils.isAnyBlank(component, key)) {
                continue; // not a component entry
            }
            config.setComponentConfigEntry(component, key, properties.getProperty(name).trim());
        }
        return config;
    }

    @Override
    public Map<String, String> getComponentConfigFor(String component) {
        return componentConfig.get(component);
    }

    @Override
    public Map<String, Map<String, String>> getComponentConfig() {
        return componentConfig;
    }

    public void setComponentConfigEntry(String component, String key, String value) {
        componentConfig.computeIfAbsent(component, c -> new HashMap<>()).put(key, value);
    }

    /**
     * A utility methods to make it easier for components to configure themselves using the componentConfig
     * configuration and user overrides.
     * @param componentNode the key in the componentConfig for this component
     * @param key the key in the component node for the configuration item
     * @param overrideProperty the property name in the UserOverrides class. May be null.
     * @return the value, with the override applied if the override exists and is not blank, and then interpolated.
     *         Null if there is no such entry at all.
     * @throws InvalidArgumentException
     */
    @Override
    public String simpleComponentConfigEntryWithOverride(String componentNode, String key, String overrideProperty) throws InvalidArgumentException, InvalidStateException {
        String retval = null;
        Map<String, String> component = getComponentConfigFor(componentNode);
        if (component != null) {
            retval = component.get(key);
        }
        if (userOverrides != null && overrideProperty != null) {
            BeanMap overrides = new BeanMap(userOverrides);
            if (overrides.containsKey(overrideProperty)) {
                Object value = overrides.get(overrideProperty);
                String overrideValue = (value == null) ? null : value.toString();
                if (!StringUtils.isBlank(overrideValue)) {
                    retval = overrideValue;
                }
            }
        }
        return retval == null ? null : interpolate(retval);
    }

    @Override
    public String simpleComponentConfigEntryWithOverride(String componentNode, String key) throws InvalidArgumentException, InvalidStateException {
        return simpleComponentConfigEntryWithOverride(componentNode, key, key);
    }

    @Override
    public int intComponentConfigEntryWithOverride(String componentNode, String key, int defaultValue) throws InvalidArgumentException, InvalidStateException {
        String value = simpleComponentConfigEntryWithOverride(componentNode, key);
        if (StringUtils.isBlank(value)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("Configuration entry " + componentNode + "." + key + " must be an integer but was '" + value + "'", e);
        }
    }

    /**
     * Interpolates strings used in configuration like: "#Env{IQFEED_PORT_LOOKUP:9100}".
     * The key pattern is #type{value} - the type being a supported type of interpolation and the value is the argument
     * for this interpolation.
     * <br/>Supported types:
     * <ul>
     * <li>SystemProperty - a value from the java system properties</li>
     * <li>Env - an environment variable. "NAME:default" supplies a default for an unset variable</li>
     * </ul>
     * @param arg the string to interpolate
     * @return a new string with all the possible interpolation expanded and the original "macro" parts removed
     * @throws InvalidArgumentException is you try to use an interpolation type that is not supported, or refer to
     *         something that does not exist
     * @throws InvalidStateException if the interpolation does not converge
     */
    public String interpolate(String arg) throws InvalidArgumentException, InvalidStateException {
        String retval = arg;
        Matcher matcher = INTERPOLATION_PATTERN.matcher(arg);
        int maxIterations = 100;

        while (matcher.matches()) {
            String interpolationType = matcher.group(2);
            String argument = matcher.group(3);
            String value;
            if (interpolationType.equals("SystemProperty")) {
                value = System.getProperty(argument);
                if (value == null) {
                    throw new InvalidArgumentException("IqFeedConfig.interpolate(): System property \"" + argument + "\" does not exist when interpolating \"" + arg + "\"");
                }
            } else if (interpolationType.equals("Env")) {
                String name = StringUtils.substringBefore(argument, ":");
                value = getEnvironmentVariable(name);
                if (StringUtils.isEmpty(value) && argument.contains(":")) {
                    value = StringUtils.substringAfter(argument, ":");
                }
                if (value == null) {
                    throw new InvalidArgumentException("IqFeedConfig.interpolate(): Environment variable \"" + name + "\" is not set when interpolating \"" + arg + "\"");
                }
            } else {
                throw new InvalidArgumentException("IqFeedConfig.interpolate() does not support interpolation type " + interpolationType + " in the string: \"" + arg + "\"");
            }
            retval = matcher.group(1) + value + matcher.group(4);

            matcher = INTERPOLATION_PATTERN.matcher(retval);
            if (maxIterations-- <= 0) {
                throw new InvalidStateException("IqFeedConfig.interpolate() iterated too many times without resolving \"" + arg + "\"");
            }
        }

        return retval;
    }

    protected String getEnvironmentVariable(String name) {
        return System.getenv(name);
    }

    public UserOverrides getUserOverrides() {
        return userOverrides;
    }

    public void setUserOverrides(UserOverrides userOverrides) {
        this.userOverrides = userOverrides;
    }

    @Override
    public EventPublisher getEventPublisher() {
        return eventPublisher;
    }

    public void setEventPublisher(EventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }
}
