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

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bundles the resources of one socket that speaks the IQFeed line protocol: CRLF terminated lines in a single
 * byte encoding. Reads are bounded by the socket read timeout. Only one thread may read; any thread may write.
 */
public class LocalSocketConnection {
    public static final String CRLF = "\r\n";
    public static final Charset CHARSET = StandardCharsets.ISO_8859_1; // the protocol is not UTF-8
    public static final int BUFFER_SIZE = 1024 * 8;

    private static final Log log = LogFactory.getLog(LocalSocketConnection.class);

    private final String name;
    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final byte[] buffer;
    private final ArrayDeque<String> completeLines;
    private String remainder = ""; // carry-over from one read to the next (any tail with no linefeed)
    private final ReentrantLock writeLock;

    /**
     * Connects to a remote endpoint
     * @param name used for logging
     * @param host
     * @param port
     * @param readTimeoutMillis how long a single read may block before SocketTimeoutException
     * @throws IOException if the connection cannot be established
     */
    public LocalSocketConnection(String name, String host, int port, int readTimeoutMillis) throws IOException {
        this(name, openSocket(host, port), readTimeoutMillis);
    }

    /**
     * Wraps an already connected socket (e.g. one returned by ServerSocket.accept())
     */
    public LocalSocketConnection(String name, Socket socket, int readTimeoutMillis) throws IOException {
        this.name = name;
        this.socket = socket;
        try {
            socket.setSoTimeout(readTimeoutMillis);
            socket.setTcpNoDelay(true);
            in = socket.getInputStream();
            out = socket.getOutputStream();
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        buffer = new byte[BUFFER_SIZE];
        completeLines = new ArrayDeque<>();
        writeLock = new ReentrantLock();
    }

    private static Socket openSocket(String host, int port) throws IOException {
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port));
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        return socket;
    }

    /**
     * Writes one line, appending the terminator, and returns once the bytes were handed to the socket
     * @param line the line without terminator
     * @throws IOException
     */
    public void write(String line) throws IOException {
        writeLock.lock();
        try {
            out.write((line + CRLF).getBytes(CHARSET));
            out.flush();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Reads the next complete line. A partial line received before a timeout is kept and completed by later reads.
     * @return the line without its terminator, or null at the end of the stream
     * @throws SocketTimeoutException if no complete line arrived within the read timeout
     * @throws IOException on any other socket problem (including the socket being closed under us)
     */
    public String readLine() throws IOException {
        while (completeLines.isEmpty()) {
            int count = in.read(buffer);
            if (count < 0) {
                if (remainder.isEmpty()) {
                    return null;
                }
                String last = remainder; // unterminated last line
                remainder = "";
                return StringUtils.stripEnd(last, "\r");
            }

            String result = remainder + new String(buffer, 0, count, CHARSET);

            // make sure that the results are made up from whole lines, leaving any left-over to stick on the next read
            int lastLineFeedPosition = result.lastIndexOf('\n');
            if (lastLineFeedPosition == -1) {
                remainder = result;
                continue;
            }
            remainder = result.substring(lastLineFeedPosition + 1);
            for (String line : StringUtils.split(result.substring(0, lastLineFeedPosition), '\n')) {
                completeLines.add(StringUtils.stripEnd(line, "\r"));
            }
        }
        return completeLines.poll();
    }

    public void close() throws IOException {
        log.debug(name + ": closing socket");
        socket.close();
    }

    public String getName() {
        return name;
    }

    public String getRemoteAddress() {
        return String.valueOf(socket.getRemoteSocketAddress());
    }
}
