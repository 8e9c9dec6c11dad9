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

import com.iqbars.adapters.iqfeed.LocalSocketConnection;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.io.IOException;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.Collections;
import java.util.List;

import static com.iqbars.adapters.iqfeed.IQFeedFieldCodec.getField;

/**
 * Serves one relay client until it goes away. Answers the connect handshake, turns every bar watch request into a
 * {@link BarRelayJob} and writes the job's lines back. When the client is quiet for a while, a server-connected
 * notice is sent to find out whether it is still there.
 */
public class BarRelayClientHandler implements Runnable {
    public static final String CONNECT = "S,CONNECT";
    public static final String SERVER_CONNECTED = "S,SERVER CONNECTED";
    public static final String WATCH_PREFIX = "BW,";
    public static final String NO_DATA_PREFIX = "n,";

    private static final Log log = LogFactory.getLog(BarRelayClientHandler.class);

    private final LocalSocketConnection connection;
    private final BarRelayJob job;

    public BarRelayClientHandler(Socket client, BarRelayJob job, int idleSeconds) throws IOException {
        this.connection = new LocalSocketConnection("relay client " + client.getRemoteSocketAddress(), client, idleSeconds * 1000);
        this.job = job;
    }

    @Override
    public void run() {
        try {
            while (processMessages()) {
                // keep serving
            }
        } catch (IOException e) {
            log.error("Error occurred while serving " + connection.getRemoteAddress(), e);
        } finally {
            try {
                connection.close();
            } catch (IOException e) {
                log.warn("Error while closing " + connection.getName() + ": " + e);
            }
        }
    }

    /**
     * Handles the next client line, if any
     * @return false once the client is gone
     * @throws IOException on a read failure other than a timeout
     */
    boolean processMessages() throws IOException {
        String line;
        try {
            line = connection.readLine();
        } catch (SocketTimeoutException e) {
            return send(Collections.singletonList(SERVER_CONNECTED)); // still there?
        }
        if (line == null) {
            log.info("Client disconnected: " + connection.getRemoteAddress());
            return false;
        }

        String message = line.trim();
        if (message.isEmpty()) {
            return true;
        }
        log.info(message);

        if (CONNECT.equals(message)) {
            return send(Collections.singletonList(SERVER_CONNECTED));
        }
        if (message.startsWith(WATCH_PREFIX)) {
            String[] fields = StringUtils.splitPreserveAllTokens(message, ',');
            String ticker = getField(fields, 1);
            String date = StringUtils.substringBefore(getField(fields, 3), " ");
            return send(job.processJob(ticker, date));
        }
        return true;
    }

    private boolean send(List<String> lines) {
        for (String line : lines) {
            log.debug("Sending: " + line);
            try {
                connection.write(line);
            } catch (IOException e) {
                log.info("Client disconnected: " + connection.getRemoteAddress());
                return false;
            }
        }
        return true;
    }
}
