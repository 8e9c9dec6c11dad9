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
 * This class represents the configuration options that can be controlled by the user (command line, deployment
 * environment) and take precedence over the properties based configuration.
 * This is simple bean. Property names match configuration keys: an override for "relay.listenPort" is the
 * listenPort property. Null means "not overridden".
 */
public class UserOverrides {
    private String iqfeedHost;
    private Integer iqfeedLookupPort;
    private String listenHost;
    private Integer listenPort;
    private String protocolVersion;
    private Integer idleReadTimeoutSeconds;
    private Integer requestTimeoutSeconds;

    public String getIqfeedHost() {
        return iqfeedHost;
    }

    public void setIqfeedHost(String iqfeedHost) {
        this.iqfeedHost = iqfeedHost;
    }

    public Integer getIqfeedLookupPort() {
        return iqfeedLookupPort;
    }

    public void setIqfeedLookupPort(Integer iqfeedLookupPort) {
        this.iqfeedLookupPort = iqfeedLookupPort;
    }

    public String getListenHost() {
        return listenHost;
    }

    public void setListenHost(String listenHost) {
        this.listenHost = listenHost;
    }

    public Integer getListenPort() {
        return listenPort;
    }

    public void setListenPort(Integer listenPort) {
        this.listenPort = listenPort;
    }

    public String getProtocolVersion() {
        return protocolVersion;
    }

    public void setProtocolVersion(String protocolVersion) {
        this.protocolVersion = protocolVersion;
    }

    public Integer getIdleReadTimeoutSeconds() {
        return idleReadTimeoutSeconds;
    }

    public void setIdleReadTimeoutSeconds(Integer idleReadTimeoutSeconds) {
        this.idleReadTimeoutSeconds = idleReadTimeoutSeconds;
    }

    public Integer getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public void setRequestTimeoutSeconds(Integer requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }
}
