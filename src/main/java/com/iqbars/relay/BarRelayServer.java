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

import com.iqbars.adapters.iqfeed.IIqFeedConfig;
import com.iqbars.exceptions.InvalidArgumentException;
import com.iqbars.exceptions.InvalidStateException;
import com.iqbars.threads.ServerThread;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;

/**
 * Accepts relay clients and serves each of them on its own thread
 */
public class BarRelayServer {
    public static final String DEFAULT_LISTEN_HOST = "0.0.0.0";
    public static final int DEFAULT_LISTEN_PORT = 9999;
    public static final int DEFAULT_CLIENT_IDLE_SECONDS = 5;

    private static final Log log = LogFactory.getLog(BarRelayServer.class);

    private final BarRelayJob job;
    private final String listenHost;
    private final int listenPort;
    private final int clientIdleSeconds;

    private volatile ServerSocket serverSocket = null;
    private volatile boolean running = false;
    private ServerThread acceptThread = null;

    public BarRelayServer(IIqFeedConfig config, BarRelayJob job) throws InvalidArgumentException, InvalidStateException {
        this.job = job;
        listenHost = StringUtils.defaultIfBlank(config.simpleComponentConfigEntryWithOverride(IIqFeedConfig.RELAY, "listenHost"), DEFAULT_LISTEN_HOST);
        listenPort = config.intComponentConfigEntryWithOverride(IIqFeedConfig.RELAY, "listenPort", DEFAULT_LISTEN_PORT);
        clientIdleSeconds = config.intComponentConfigEntryWithOverride(IIqFeedConfig.RELAY, "clientIdleSeconds", DEFAULT_CLIENT_IDLE_SECONDS);
        if (clientIdleSeconds <= 0) {
            throw new InvalidArgumentException("relay.clientIdleSeconds must be positive but was " + clientIdleSeconds);
        }
    }

    /**
     * Binds the listening socket and starts accepting in the background
     * @throws InvalidStateException if already started or the socket cannot be bound
     */
    public synchronized void start() throws InvalidStateException {
        if (running) {
            throw new InvalidStateException("The relay server is already running");
        }
        try {
            ServerSocket socket = new ServerSocket();
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(listenHost, listenPort));
            serverSocket = socket;
        } catch (IOException e) {
            throw new InvalidStateException("Unable to listen on " + listenHost + ":" + listenPort + ": " + e, e);
        }
        running = true;
        acceptThread = new ServerThread(this::acceptLoop, "relay acceptor");
        acceptThread.start();
        log.info("Running IQFeed bar relay on " + listenHost + ":" + getLocalPort());
    }

    private void acceptLoop() {
        while (running) {
            Socket client;
            try {
                client = serverSocket.accept();
            } catch (IOException e) {
                if (running) {
                    log.error("Error while accepting relay clients: " + e, e);
                    running = false;
                }
                return;
            }

            try {
                BarRelayClientHandler handler = new BarRelayClientHandler(client, job, clientIdleSeconds);
                new ServerThread(handler, "relay client " + client.getRemoteSocketAddress()).start();
            } catch (IOException e) {
                log.error("Could not serve relay client " + client.getRemoteSocketAddress() + ": " + e);
            }
        }
    }

    /**
     * Stops accepting new clients. Clients already being served finish on their own.
     */
    public synchronized void stop() throws InvalidStateException {
        if (!running && serverSocket == null) {
            throw new InvalidStateException("The relay server is not running");
        }
        running = false;
        try {
            serverSocket.close();
        } catch (IOException e) {
            throw new InvalidStateException("Error while closing the relay server socket: " + e, e);
        } finally {
            serverSocket = null;
        }
        log.info("Shutting down IQFeed bar relay");
    }

    public boolean isRunning() {
        return running;
    }

    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return socket == null ? -1 : socket.getLocalPort();
    }

    /**
     * Waits for the acceptor to finish
     */
    public void join() throws InterruptedException {
        ServerThread thread = acceptThread;
        if (thread != null) {
            thread.join();
        }
    }
}
