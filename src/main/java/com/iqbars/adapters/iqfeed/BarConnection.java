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

import com.iqbars.elements.Bar;
import com.iqbars.elements.IntervalType;
import com.iqbars.exceptions.InvalidArgumentException;
import com.iqbars.exceptions.InvalidStateException;
import com.iqbars.exceptions.MalformedFieldException;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.iqbars.adapters.iqfeed.IQFeedFieldCodec.*;

/**
 * A connection to the IQFeed derivative (bars) port. Watched tickers get their history pushed as BH lines and
 * then live updates as BC lines. Every parsed bar is handed to the registered observers on the reader thread.
 * Live bars identical to the last one delivered for the same ticker are suppressed. History bars never are.
 */
public class BarConnection extends IQFeedConnection {
    public static final String HISTORY_BAR = "BH";
    public static final String LIVE_BAR = "BC";
    public static final String NO_DATA_FOR_TICKER = "n";
    public static final int BAR_FIELD_COUNT = 11;
    public static final int DEFAULT_INTERVAL_LENGTH = 60;

    private static final Log log = LogFactory.getLog(BarConnection.class);

    private final List<IBarObserver> historyBarObservers;
    private final List<IBarObserver> liveBarObservers;
    private final HashMap<String, Bar> lastLiveBar; // only touched by the reader thread

    public BarConnection() {
        this(null);
    }

    public BarConnection(String name) {
        super(name);
        historyBarObservers = new CopyOnWriteArrayList<>();
        liveBarObservers = new CopyOnWriteArrayList<>();
        lastLiveBar = new HashMap<>();
    }

    /**
     * Subscribes to interval bars for a ticker, starting with history from the given time
     * @param ticker
     * @param start the first bar wanted
     * @param intervalLength in units of the interval type
     * @param intervalType
     * @throws InvalidArgumentException if the ticker cannot be put on the wire
     * @throws InvalidStateException if not connected
     */
    public void watch(String ticker, LocalDateTime start, int intervalLength, IntervalType intervalType) throws InvalidArgumentException, InvalidStateException {
        validateTicker(ticker);
        if (intervalLength <= 0) {
            throw new InvalidArgumentException("The interval length must be positive but was " + intervalLength);
        }
        sendCommand("BW," + ticker + "," + intervalLength + "," + toIqFeedTimestamp(start) + ",,,,,," + intervalType.getCode() + ",,");
    }

    /**
     * Watch with one minute bars
     */
    public void watch(String ticker, LocalDateTime start) throws InvalidArgumentException, InvalidStateException {
        watch(ticker, start, DEFAULT_INTERVAL_LENGTH, IntervalType.SECONDS);
    }

    public void unwatch(String ticker) throws InvalidArgumentException, InvalidStateException {
        validateTicker(ticker);
        sendCommand("BR," + ticker);
    }

    static void validateTicker(String ticker) throws InvalidArgumentException {
        if (StringUtils.isBlank(ticker) || StringUtils.containsAny(ticker, ",\r\n")) {
            throw new InvalidArgumentException("Not a valid ticker: '" + ticker + "'");
        }
    }

    public void registerHistoryBarObserver(IBarObserver observer) {
        historyBarObservers.add(observer);
    }

    public void registerLiveBarObserver(IBarObserver observer) {
        liveBarObservers.add(observer);
    }

    /**
     * Disconnects and forgets all observers
     */
    @Override
    public void disconnect() throws InvalidStateException {
        try {
            super.disconnect();
        } finally {
            historyBarObservers.clear();
            liveBarObservers.clear();
        }
    }

    @Override
    protected void onReadLoopStarted() {
        lastLiveBar.clear();
    }

    @Override
    public HandlerResult handleFields(String[] fields) {
        if (NO_DATA_FOR_TICKER.equals(getField(fields, 0))) {
            log.error("No data for " + getField(fields, 1));
            return HandlerResult.HANDLED;
        }

        String barType = getField(fields, 1);
        if (!HISTORY_BAR.equals(barType) && !LIVE_BAR.equals(barType)) {
            return HandlerResult.UNKNOWN_MESSAGE;
        }

        Bar bar;
        try {
            bar = parseBar(fields);
        } catch (MalformedFieldException e) {
            log.error("Error processing bar with fields " + StringUtils.join(fields, FIELD_SEPARATOR) + ": " + e.getMessage());
            return HandlerResult.HANDLED;
        }

        if (HISTORY_BAR.equals(barType)) {
            handleHistoryBar(bar);
        } else {
            handleLiveBar(bar);
        }
        return HandlerResult.HANDLED;
    }

    /**
     * Parses "connId,tag,ticker,timestamp,open,high,low,close,totalVolume,intervalVolume,numTrades"
     */
    static Bar parseBar(String[] fields) throws MalformedFieldException {
        requireFieldCount(fields, BAR_FIELD_COUNT);
        LocalDateTime timestamp = parseTimestamp(fields[3]);
        return new Bar(timestamp.toLocalDate(), timestamp.toLocalTime(),
                parsePrice(fields[4]), parsePrice(fields[5]), parsePrice(fields[6]), parsePrice(fields[7]),
                parseCount(fields[8]), parseCount(fields[9]), parseCount(fields[10]),
                fields[2]);
    }

    private void handleHistoryBar(Bar bar) {
        notifyObservers(historyBarObservers, bar);
    }

    private void handleLiveBar(Bar bar) {
        if (bar.equals(lastLiveBar.get(bar.getTicker()))) {
            return; // repeated update, nothing changed
        }
        lastLiveBar.put(bar.getTicker(), bar);
        notifyObservers(liveBarObservers, bar);
    }

    private void notifyObservers(List<IBarObserver> observers, Bar bar) {
        for (IBarObserver observer : observers) {
            try {
                observer.onBar(bar);
            } catch (Exception e) {
                log.error("Bar observer failed on " + bar + ": " + e, e);
            }
        }
    }
}
