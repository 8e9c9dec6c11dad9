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

import com.iqbars.adapters.IHistoricalBarSource;
import com.iqbars.elements.Bar;
import com.iqbars.elements.DailyBar;
import com.iqbars.elements.IntervalType;
import com.iqbars.exceptions.InvalidArgumentException;
import com.iqbars.exceptions.InvalidStateException;
import com.iqbars.exceptions.MalformedFieldException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static com.iqbars.adapters.iqfeed.IQFeedFieldCodec.*;

/**
 * A connection to the IQFeed lookup port for bounded history requests. Any number of requests may be
 * outstanding at once; responses are matched to requests by the request id echoed in every line.
 */
public class HistoryConnection extends IQFeedConnection implements IHistoricalBarSource {
    public static final String HISTORY_BAR_PREFIX = "H_";
    public static final String DAILY_BAR_PREFIX = "D_";
    public static final int DEFAULT_TIMEOUT_SECONDS = 30;
    public static final int HISTORY_BAR_FIELD_COUNT = 9;
    public static final int DAILY_BAR_FIELD_COUNT = 8;

    private int defaultTimeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

    public HistoryConnection() {
        this(null);
    }

    public HistoryConnection(String name) {
        super(name);
    }

    @Override
    public void init(IIqFeedConfig config) throws InvalidArgumentException, InvalidStateException {
        super.init(config);
        int timeout = config.intComponentConfigEntryWithOverride(IIqFeedConfig.HISTORY, "requestTimeoutSeconds", DEFAULT_TIMEOUT_SECONDS);
        if (timeout <= 0) {
            throw new InvalidArgumentException("history.requestTimeoutSeconds must be positive but was " + timeout);
        }
        defaultTimeoutSeconds = timeout;
    }

    public int getDefaultTimeoutSeconds() {
        return defaultTimeoutSeconds;
    }

    @Override
    public List<Bar> requestBarsInPeriod(String ticker, LocalDateTime start, LocalDateTime end, int intervalLength,
                                         IntervalType intervalType, int timeoutSeconds)
            throws InvalidArgumentException, InvalidStateException, NoDataError, IQFeedError, TimeoutException {
        BarConnection.validateTicker(ticker);
        if (end.isBefore(start)) {
            throw new InvalidArgumentException("The period ends (" + end + ") before it starts (" + start + ")");
        }
        String period = intervalLength + "," + toIqFeedTimestamp(start) + "," + toIqFeedTimestamp(end);
        // HIT,[Symbol],[Interval],[BeginDate BeginTime],[EndDate EndTime],[MaxDatapoints],[BeginFilterTime],[EndFilterTime],[DataDirection],[RequestID],[DatapointsPerSend],[IntervalType]
        return awaitRequest(HISTORY_BAR_PREFIX, ticker,
                requestId -> "HIT," + ticker + "," + period + ",,,,1," + requestId + ",," + intervalType.getCode() + ",",
                HistoryConnection::parseHistoryBar, timeoutSeconds);
    }

    /**
     * Period request with the configured timeout
     */
    public List<Bar> requestBarsInPeriod(String ticker, LocalDateTime start, LocalDateTime end, int intervalLength,
                                         IntervalType intervalType)
            throws InvalidArgumentException, InvalidStateException, NoDataError, IQFeedError, TimeoutException {
        return requestBarsInPeriod(ticker, start, end, intervalLength, intervalType, defaultTimeoutSeconds);
    }

    @Override
    public DailyBar requestDailyBarForDate(String ticker, LocalDate day, int timeoutSeconds)
            throws InvalidArgumentException, InvalidStateException, NoDataError, IQFeedError, TimeoutException {
        BarConnection.validateTicker(ticker);
        String date = toIqFeedDate(day);
        // HDT,[Symbol],[BeginDate],[EndDate],[MaxDatapoints],[DataDirection],[RequestID],[DatapointsPerSend]
        List<DailyBar> bars = awaitRequest(DAILY_BAR_PREFIX, ticker,
                requestId -> "HDT," + ticker + "," + date + "," + date + ",,1," + requestId + ",,",
                HistoryConnection::parseDailyBar, timeoutSeconds);
        if (bars.isEmpty()) {
            throw new NoDataError("Didn't get valid data for " + ticker + " on " + day);
        }
        return bars.get(bars.size() - 1); // a single day query may still answer with more than one line
    }

    public DailyBar requestDailyBarForDate(String ticker, LocalDate day)
            throws InvalidArgumentException, InvalidStateException, NoDataError, IQFeedError, TimeoutException {
        return requestDailyBarForDate(ticker, day, defaultTimeoutSeconds);
    }

    /**
     * Parses "ticker,timestamp,high,low,open,close,totalVolume,intervalVolume,numTrades"
     */
    static Bar parseHistoryBar(String[] fields) throws MalformedFieldException {
        requireFieldCount(fields, HISTORY_BAR_FIELD_COUNT);
        LocalDateTime timestamp = parseTimestamp(fields[1]);
        double high = parsePrice(fields[2]);
        double low = parsePrice(fields[3]);
        double open = parsePrice(fields[4]);
        double close = parsePrice(fields[5]);
        return new Bar(timestamp.toLocalDate(), timestamp.toLocalTime(), open, high, low, close,
                parseCount(fields[6]), parseCount(fields[7]), parseCount(fields[8]), fields[0]);
    }

    /**
     * Parses "ticker,date,high,low,open,close,periodVolume,openInterest"
     */
    static DailyBar parseDailyBar(String[] fields) throws MalformedFieldException {
        requireFieldCount(fields, DAILY_BAR_FIELD_COUNT);
        return new DailyBar(parseDate(fields[1]), parsePrice(fields[2]), parsePrice(fields[3]),
                parsePrice(fields[4]), parsePrice(fields[5]), parseCount(fields[6]), parseCount(fields[7]), fields[0]);
    }
}
