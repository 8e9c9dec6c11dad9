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

import com.iqbars.IConfigInitializable;
import com.iqbars.adapters.iqfeed.lookup.ILookupLineParser;
import com.iqbars.adapters.iqfeed.lookup.PendingLookupRequest;
import com.iqbars.events.ConnectionStateChangedEvent;
import com.iqbars.events.ConnectionStateChangedEvent.Reason;
import com.iqbars.events.EventPublisher;
import com.iqbars.exceptions.InvalidArgumentException;
import com.iqbars.exceptions.InvalidStateException;
import com.iqbars.exceptions.MalformedFieldException;
import com.iqbars.threads.ConnectionReaderThread;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

import static com.iqbars.adapters.iqfeed.IQFeedFieldCodec.getField;
import static com.iqbars.adapters.iqfeed.IQFeedFieldCodec.splitFields;

/**
 * One TCP connection to an IQFeed service port. Owns the socket, a reader thread that splits the inbound stream
 * into lines and dispatches them, and the table of outstanding lookup requests keyed by request id.
 * <p>
 * Dispatch order for every received line: protocol acknowledgement, server-connected notice, the subclass hook
 * {@link #handleFields(String[])}, then the request table. Anything left is logged at debug level and dropped.
 * <p>
 * Subclasses that need no configuration may skip {@link #init(IIqFeedConfig)}; the defaults match IQFeed 6.1.
 */
public class IQFeedConnection implements IFieldsHandler, IConfigInitializable<IIqFeedConfig> {
    public static final String DEFAULT_PROTOCOL_VERSION = "6.1";
    public static final int DEFAULT_IDLE_READ_TIMEOUT_SECONDS = 4;
    public static final int MAX_REQUEST_ID_JITTER = 100;
    public static final int DISCONNECT_JOIN_TIMEOUT_MILLIS = 5000;

    public static final String SYSTEM_MESSAGE = "S";
    public static final String CURRENT_PROTOCOL = "CURRENT PROTOCOL";
    public static final String SERVER_CONNECTED = "SERVER CONNECTED";
    public static final String END_OF_MESSAGE = "!ENDMSG!";
    public static final String NO_DATA = "!NO_DATA!";
    public static final String ERROR_MARKER = "E";

    private static final int MAX_REQUEST_ID_ATTEMPTS = 10;

    private final Log log = LogFactory.getLog(getClass());

    private final String name;
    private EventPublisher eventPublisher;
    private String protocolVersion = DEFAULT_PROTOCOL_VERSION;
    private int idleReadTimeoutMillis = DEFAULT_IDLE_READ_TIMEOUT_SECONDS * 1000;

    private volatile LocalSocketConnection socketConnection = null;
    private volatile ConnectionReaderThread readerThread = null;
    private volatile ConnectionState state = ConnectionState.NOT_RUNNING;
    private volatile boolean stopRequested = false;
    private volatile TerminationStyle terminationStyle = TerminationStyle.RUN_FOREVER;

    private final Map<String, PendingLookupRequest<?>> pendingRequests;
    private final AtomicLong requestCounter;

    public IQFeedConnection() {
        this(null);
    }

    /**
     * @param name used for the reader thread and in logs. Defaults to the class name.
     */
    public IQFeedConnection(String name) {
        this.name = StringUtils.defaultIfBlank(name, StringUtils.defaultIfBlank(getClass().getSimpleName(), "IQFeedConnection"));
        pendingRequests = new ConcurrentHashMap<>();
        requestCounter = new AtomicLong(0);
    }

    @Override
    public void init(IIqFeedConfig config) throws InvalidArgumentException, InvalidStateException {
        eventPublisher = config.getEventPublisher();

        String version = config.simpleComponentConfigEntryWithOverride(IIqFeedConfig.CONNECTION, "protocolVersion");
        protocolVersion = StringUtils.defaultIfBlank(version, DEFAULT_PROTOCOL_VERSION);

        int idleSeconds = config.intComponentConfigEntryWithOverride(IIqFeedConfig.CONNECTION, "idleReadTimeoutSeconds", DEFAULT_IDLE_READ_TIMEOUT_SECONDS);
        if (idleSeconds <= 0) {
            throw new InvalidArgumentException("connection.idleReadTimeoutSeconds must be positive but was " + idleSeconds);
        }
        idleReadTimeoutMillis = idleSeconds * 1000;
    }

    // ------------------------------------------------------------------------------------------------------------
    // Connection lifecycle
    // ------------------------------------------------------------------------------------------------------------

    /**
     * Opens the socket, announces the protocol version and starts the reader thread
     * @param host
     * @param port
     * @param terminationStyle whether the reader stops on its own after an idle period
     * @throws InvalidStateException if already connected, or if the socket could not be opened or written to
     */
    public synchronized void connect(String host, int port, TerminationStyle terminationStyle) throws InvalidStateException {
        if (socketConnection != null || readerThread != null) {
            throw new InvalidStateException(name + " is already connected. Disconnect first.");
        }

        LocalSocketConnection connection;
        try {
            connection = new LocalSocketConnection(name, host, port, idleReadTimeoutMillis);
        } catch (IOException e) {
            log.error("Unable to connect " + name + " to IQFeed at " + host + ":" + port + ": " + e);
            throw new InvalidStateException("Unable to connect to IQFeed at " + host + ":" + port + ": " + e, e);
        }

        try {
            connection.write(SYSTEM_MESSAGE + ",SET PROTOCOL," + protocolVersion);
        } catch (IOException e) {
            closeQuietlyAfterFailure(connection);
            throw new InvalidStateException("Unable to set the protocol on " + host + ":" + port + ": " + e, e);
        }

        socketConnection = connection;
        this.terminationStyle = terminationStyle;
        stopRequested = false;
        setState(ConnectionState.READING_MESSAGES, Reason.CONNECTED);

        readerThread = new ConnectionReaderThread(this::readLoop, name);
        readerThread.start();
        log.info(name + " connected to IQFeed at " + host + ":" + port + " (" + terminationStyle + ")");
    }

    private void closeQuietlyAfterFailure(LocalSocketConnection connection) {
        try {
            connection.close();
        } catch (IOException e) {
            log.warn("Error while closing " + name + " after a failed connect: " + e);
        }
    }

    /**
     * Stops the reader, tells the server we are leaving and closes the socket. Outstanding requests fail.
     * May be called from an observer running on the reader thread.
     * @throws InvalidStateException if not connected
     */
    public void disconnect() throws InvalidStateException {
        LocalSocketConnection connection;
        Thread reader;
        synchronized (this) {
            if (socketConnection == null || readerThread == null) {
                throw new InvalidStateException(name + " is not connected");
            }
            stopRequested = true;
            connection = socketConnection;
            reader = readerThread;
        }

        try {
            try {
                connection.write(SYSTEM_MESSAGE + ",DISCONNECT");
            } catch (IOException e) {
                log.warn(name + ": could not send the disconnect command (" + e + "). Closing anyway.");
            }
            connection.close();
        } catch (IOException e) {
            throw new InvalidStateException("Error while closing " + name + ": " + e, e);
        } finally {
            if (reader != Thread.currentThread()) {
                try {
                    reader.join(DISCONNECT_JOIN_TIMEOUT_MILLIS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                if (reader.isAlive()) {
                    log.warn(name + ": reader thread did not stop within " + DISCONNECT_JOIN_TIMEOUT_MILLIS + " ms");
                }
            }
            synchronized (this) {
                socketConnection = null;
                readerThread = null;
            }
            log.info(name + " disconnected");
        }
    }

    public ConnectionState getState() {
        return state;
    }

    public boolean isConnected() {
        return socketConnection != null;
    }

    public String getName() {
        return name;
    }

    private void setState(ConnectionState newState, Reason reason) {
        ConnectionState previous = state;
        state = newState;
        if (eventPublisher != null && previous != newState) {
            eventPublisher.publish(new ConnectionStateChangedEvent(name, previous, newState, reason));
        }
    }

    // ------------------------------------------------------------------------------------------------------------
    // Outbound
    // ------------------------------------------------------------------------------------------------------------

    /**
     * Writes one command line (the terminator is appended) and returns once it was flushed
     * @throws InvalidStateException if not connected or the write failed
     */
    public void sendCommand(String command) throws InvalidStateException {
        LocalSocketConnection connection = socketConnection;
        if (connection == null) {
            throw new InvalidStateException(name + " is not connected. Cannot send '" + command + "'");
        }
        try {
            connection.write(command);
        } catch (IOException e) {
            throw new InvalidStateException("Error while sending '" + command + "' on " + name + ": " + e, e);
        }
    }

    /**
     * Makes a request id of the form prefix + ticker + a ten digit number. The number is the request counter plus
     * a random offset of 1 to {@value #MAX_REQUEST_ID_JITTER}. The counter advances by one per call. An id that is
     * currently outstanding on this connection is never handed out: starting at the random offset, the offsets
     * 1 to {@value #MAX_REQUEST_ID_JITTER} are walked in turn, and past them the offset keeps growing until the id
     * is free.
     * @param prefix
     * @param ticker
     * @return the request id
     */
    public String issueRequestId(String prefix, String ticker) {
        long base = requestCounter.getAndIncrement();
        int jitter = ThreadLocalRandom.current().nextInt(1, MAX_REQUEST_ID_JITTER + 1);
        for (long step = 0; ; step++) {
            long offset = step < MAX_REQUEST_ID_JITTER ? 1 + (jitter - 1 + step) % MAX_REQUEST_ID_JITTER : step + 1;
            String requestId = prefix + ticker + StringUtils.leftPad(Long.toString(base + offset), 10, '0');
            if (!pendingRequests.containsKey(requestId)) {
                return requestId;
            }
        }
    }

    public long getRequestCounter() {
        return requestCounter.get();
    }

    /**
     * Issues a request id, registers the request under it, sends the command built for that id and waits for the
     * response to complete. Another caller may register the same id between issuing and registering; the id is then
     * dropped (it was never sent) and a fresh one is issued.
     * @param prefix request id prefix
     * @param ticker substituted for the request id in every data line handed to the parser
     * @param commandForRequestId builds the full command line for an issued request id
     * @param parser turns data lines into records
     * @param timeoutSeconds how long to wait for the end of the response
     * @return the records in arrival order (possibly empty)
     * @throws InvalidStateException if not connected, the connection stopped reading before the response completed,
     * or no free request id could be registered
     * @throws NoDataError if the server has no data for the request
     * @throws IQFeedError if the server reported an error for the request
     * @throws TimeoutException if the response did not complete in time
     */
    protected <T> List<T> awaitRequest(String prefix, String ticker, Function<String, String> commandForRequestId,
                                       ILookupLineParser<T> parser, int timeoutSeconds)
            throws InvalidStateException, NoDataError, IQFeedError, TimeoutException {
        PendingLookupRequest<T> request = new PendingLookupRequest<>(ticker, parser);
        for (int attempt = 1; attempt <= MAX_REQUEST_ID_ATTEMPTS; attempt++) {
            String requestId = issueRequestId(prefix, ticker);
            if (register(requestId, request)) {
                return sendAndAwait(commandForRequestId.apply(requestId), requestId, request, timeoutSeconds);
            }
            log.debug(name + ": request id " + requestId + " was taken before it could be registered. Issuing another.");
        }
        throw new InvalidStateException(name + ": could not register a free request id for " + ticker +
                " after " + MAX_REQUEST_ID_ATTEMPTS + " attempts");
    }

    /**
     * Registers a request under a caller supplied id, sends the command and waits for the response to complete
     * @param command the full command line, which must carry the request id
     * @param ticker substituted for the request id in every data line handed to the parser
     * @param requestId the id the server will echo in field 0 of every response line
     * @param parser turns data lines into records
     * @param timeoutSeconds how long to wait for the end of the response
     * @return the records in arrival order (possibly empty)
     * @throws InvalidArgumentException if the id is already outstanding on this connection
     * @throws InvalidStateException if not connected, or the connection stopped reading before the response completed
     * @throws NoDataError if the server has no data for the request
     * @throws IQFeedError if the server reported an error for the request
     * @throws TimeoutException if the response did not complete in time
     */
    protected <T> List<T> awaitCommand(String command, String ticker, String requestId, ILookupLineParser<T> parser, int timeoutSeconds)
            throws InvalidArgumentException, InvalidStateException, NoDataError, IQFeedError, TimeoutException {
        PendingLookupRequest<T> request = new PendingLookupRequest<>(ticker, parser);
        if (!register(requestId, request)) {
            throw new InvalidArgumentException("Request id " + requestId + " is already outstanding on " + name);
        }
        return sendAndAwait(command, requestId, request, timeoutSeconds);
    }

    /**
     * @return false if another request is already outstanding under the id. That request is left in place.
     */
    boolean register(String requestId, PendingLookupRequest<?> request) {
        return pendingRequests.putIfAbsent(requestId, request) == null;
    }

    private <T> List<T> sendAndAwait(String command, String requestId, PendingLookupRequest<T> request, int timeoutSeconds)
            throws InvalidStateException, NoDataError, IQFeedError, TimeoutException {
        try {
            if (state != ConnectionState.READING_MESSAGES) {
                throw new InvalidStateException(name + " is not reading messages. Cannot send '" + command + "'");
            }
            sendCommand(command);
            return request.await(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn(name + ": request " + requestId + " timed out after " + timeoutSeconds + "s with " + request.size() + " records received");
            throw e;
        } finally {
            pendingRequests.remove(requestId, request);
        }
    }

    int getPendingRequestCount() {
        return pendingRequests.size();
    }

    // ------------------------------------------------------------------------------------------------------------
    // Inbound
    // ------------------------------------------------------------------------------------------------------------

    private void readLoop() {
        Reason reason = Reason.DISCONNECTED;
        LocalSocketConnection connection = socketConnection;
        onReadLoopStarted();
        try {
            while (!stopRequested) {
                String line;
                try {
                    line = connection.readLine();
                } catch (SocketTimeoutException e) {
                    if (terminationStyle == TerminationStyle.TERMINATE_ON_IDLE) {
                        log.info(name + ": no data for " + idleReadTimeoutMillis + " ms. Stopping the reader.");
                        reason = Reason.IDLE_TIMEOUT;
                        return;
                    }
                    continue;
                }

                if (line == null) {
                    if (!stopRequested) {
                        log.info(name + ": the server closed the connection");
                        reason = Reason.END_OF_STREAM;
                    }
                    return;
                }

                String message = line.trim();
                if (message.isEmpty()) {
                    continue;
                }
                try {
                    handleMessage(message);
                } catch (RuntimeException e) {
                    log.error(name + ": unexpected exception while handling '" + message + "'", e);
                }
            }
        } catch (IOException e) {
            if (!stopRequested) {
                log.error(name + ": error while reading from IQFeed: " + e, e);
                reason = Reason.READ_ERROR;
            }
        } finally {
            setState(ConnectionState.NOT_RUNNING, reason);
            failOutstandingRequests(reason);
        }
    }

    /**
     * Called on the reader thread before the first line is read. Subclasses reset per-session state here.
     */
    protected void onReadLoopStarted() {
    }

    private void failOutstandingRequests(Reason reason) {
        for (Map.Entry<String, PendingLookupRequest<?>> entry : pendingRequests.entrySet()) {
            boolean failed = entry.getValue().fail(new InvalidStateException(
                    name + " stopped reading (" + reason + ") while request " + entry.getKey() + " was outstanding"));
            if (failed) {
                log.warn(name + ": failed outstanding request " + entry.getKey() + " (" + reason + ")");
            }
        }
    }

    /**
     * Dispatches one received line (already trimmed, never empty)
     */
    protected void handleMessage(String message) {
        String[] fields = splitFields(message);
        String first = getField(fields, 0);

        if (SYSTEM_MESSAGE.equals(first) && CURRENT_PROTOCOL.equals(getField(fields, 1))) {
            checkProtocol(getField(fields, 2));
            return;
        }
        if (SYSTEM_MESSAGE.equals(first) && SERVER_CONNECTED.equals(getField(fields, 1))) {
            return;
        }
        if (handleFields(fields) == HandlerResult.HANDLED) {
            return;
        }

        PendingLookupRequest<?> request = pendingRequests.get(first);
        if (request != null) {
            processRequestResult(first, fields, request);
        } else {
            log.debug(name + ": unknown message: " + message);
        }
    }

    private void checkProtocol(String version) {
        if (!protocolVersion.equals(version)) {
            log.error(name + ": IQFeed reports protocol " + version + " but " + protocolVersion + " was requested");
        }
    }

    private void processRequestResult(String requestId, String[] fields, PendingLookupRequest<?> request) {
        if (request.isDone()) {
            return; // late lines after completion
        }

        if (END_OF_MESSAGE.equals(getField(fields, 1))) {
            request.complete();
        } else if (NO_DATA.equals(getField(fields, 2))) {
            request.fail(new NoDataError("No data available for " + request.getTicker() + " (request " + requestId + ")"));
        } else if (ERROR_MARKER.equals(getField(fields, 1))) {
            request.fail(new IQFeedError(getField(fields, 2)));
        } else {
            String[] record = fields.clone();
            record[0] = request.getTicker();
            try {
                request.add(record);
            } catch (MalformedFieldException e) {
                log.error(name + ": could not interpret fields " + StringUtils.join(fields, ',') + " for request " + requestId + ": " + e.getMessage());
            }
        }
    }

    /**
     * The hook for stream-specific lines, consulted before the request table
     * @return HANDLED if the line was consumed
     */
    @Override
    public HandlerResult handleFields(String[] fields) {
        return HandlerResult.UNKNOWN_MESSAGE;
    }
}
