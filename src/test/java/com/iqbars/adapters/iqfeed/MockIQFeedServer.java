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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * A scripted stand-in for an IQFeed port. Serves one client at a time. Every received line is recorded, and a
 * responder registered for the line's command prefix (the text up to the first comma) decides what to send back.
 * "S,SET PROTOCOL,x" is acknowledged with "S,CURRENT PROTOCOL,x" unless a responder says otherwise.
 */
public class MockIQFeedServer implements AutoCloseable {
    public static final String HOST = "127.0.0.1";

    private final ServerSocket serverSocket;
    private final Thread serverThread;
    private final BlockingQueue<String> received = new LinkedBlockingQueue<>();
    private final Map<String, Function<String[], List<String>>> responders = new ConcurrentHashMap<>();
    private volatile Socket client = null;
    private volatile boolean closed = false;

    public MockIQFeedServer() throws IOException {
        serverSocket = new ServerSocket(0, 50, InetAddress.getByName(HOST));
        respond("S", fields -> "SET PROTOCOL".equals(IQFeedFieldCodec.getField(fields, 1)) ?
                Collections.singletonList("S,CURRENT PROTOCOL," + IQFeedFieldCodec.getField(fields, 2)) :
                Collections.<String>emptyList());
        serverThread = new Thread(this::serve, "mock iqfeed " + serverSocket.getLocalPort());
        serverThread.setDaemon(true);
        serverThread.start();
    }

    public String getHost() {
        return HOST;
    }

    public int getPort() {
        return serverSocket.getLocalPort();
    }

    /**
     * @param command the first field of the lines to respond to, e.g. "HIT"
     * @param responder gets the fields of the received line (split on every comma) and returns the lines to send
     */
    public void respond(String command, Function<String[], List<String>> responder) {
        responders.put(command, responder);
    }

    /**
     * Waits for the next received line starting with the prefix, skipping others
     * @return the line, or null if none arrived in time
     */
    public String awaitLine(String prefix, long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (true) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return null;
            }
            String line = received.poll(remaining, TimeUnit.MILLISECONDS);
            if (line == null) {
                return null;
            }
            if (line.startsWith(prefix)) {
                return line;
            }
        }
    }

    /**
     * Pushes lines to the connected client, terminating each with CRLF
     */
    public void send(String... lines) throws IOException {
        StringBuilder text = new StringBuilder();
        for (String line : lines) {
            text.append(line).append("\r\n");
        }
        sendRaw(text.toString());
    }

    /**
     * Pushes text exactly as given, for splitting a line across writes
     */
    public synchronized void sendRaw(String text) throws IOException {
        Socket socket = client;
        if (socket == null) {
            throw new IOException("No client connected to the mock server");
        }
        OutputStream out = socket.getOutputStream();
        out.write(text.getBytes(LocalSocketConnection.CHARSET));
        out.flush();
    }

    public boolean awaitClient(long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (client == null && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        return client != null;
    }

    /**
     * Hangs up on the current client, which then sees the end of the stream
     */
    public void dropClient() throws IOException {
        Socket socket = client;
        client = null;
        if (socket != null) {
            socket.close();
        }
    }

    private void serve() {
        while (!closed) {
            try (Socket socket = serverSocket.accept()) {
                client = socket;
                BufferedReader reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), LocalSocketConnection.CHARSET));
                String line;
                while ((line = reader.readLine()) != null) {
                    received.add(line);
                    String[] fields = line.split(",", -1);
                    Function<String[], List<String>> responder = responders.get(fields[0]);
                    if (responder != null) {
                        List<String> reply = responder.apply(fields);
                        if (!reply.isEmpty()) {
                            send(reply.toArray(new String[0]));
                        }
                    }
                }
            } catch (IOException e) {
                // client went away or server closed; accept the next one
            } finally {
                client = null;
            }
        }
    }

    @Override
    public void close() throws IOException {
        closed = true;
        dropClient();
        serverSocket.close();
    }
}
