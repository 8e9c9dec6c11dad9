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

import com.iqbars.adapters.IHistoricalBarSource;
import com.iqbars.adapters.iqfeed.HistoryConnection;
import com.iqbars.adapters.iqfeed.IIqFeedConfig;
import com.iqbars.adapters.iqfeed.IQFeedError;
import com.iqbars.adapters.iqfeed.NoDataError;
import com.iqbars.adapters.iqfeed.TerminationStyle;
import com.iqbars.elements.Bar;
import com.iqbars.elements.IntervalType;
import com.iqbars.exceptions.InvalidArgumentException;
import com.iqbars.exceptions.InvalidStateException;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static com.iqbars.adapters.iqfeed.IQFeedFieldCodec.formatPrice;

/**
 * Fetches one trading day of interval bars for a ticker from the IQFeed lookup port and renders them as live bar
 * lines, ready to be written to a relay client. Any failure renders as a single "n,ticker" line.
 */
public class BarRelayJob {
    public static final int DEFAULT_LOOKUP_PORT = 9100;
    public static final int DEFAULT_INTERVAL_SECONDS = 60;
    public static final String DEFAULT_MARKET_OPEN = "09:30";
    public static final String DEFAULT_MARKET_CLOSE = "16:00";

    private static final Log log = LogFactory.getLog(BarRelayJob.class);
    private static final DateTimeFormatter REQUEST_DATE = DateTimeFormatter.BASIC_ISO_DATE;
    private static final DateTimeFormatter BAR_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final IIqFeedConfig config;
    private final int intervalSeconds;
    private final LocalTime marketOpen;
    private final LocalTime marketClose;

    public BarRelayJob(IIqFeedConfig config) throws InvalidArgumentException, InvalidStateException {
        this.config = config;
        intervalSeconds = config.intComponentConfigEntryWithOverride(IIqFeedConfig.RELAY, "intervalSeconds", DEFAULT_INTERVAL_SECONDS);
        if (intervalSeconds <= 0) {
            throw new InvalidArgumentException("relay.intervalSeconds must be positive but was " + intervalSeconds);
        }
        marketOpen = parseTimeOfDay("marketOpen", DEFAULT_MARKET_OPEN);
        marketClose = parseTimeOfDay("marketClose", DEFAULT_MARKET_CLOSE);
        if (!marketOpen.isBefore(marketClose)) {
            throw new InvalidArgumentException("relay.marketOpen (" + marketOpen + ") must be before relay.marketClose (" + marketClose + ")");
        }
    }

    private LocalTime parseTimeOfDay(String key, String defaultValue) throws InvalidArgumentException, InvalidStateException {
        String value = StringUtils.defaultIfBlank(config.simpleComponentConfigEntryWithOverride(IIqFeedConfig.RELAY, key), defaultValue);
        try {
            return LocalTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidArgumentException("relay." + key + " is not a time of day: '" + value + "'", e);
        }
    }

    /**
     * @param ticker the ticker to fetch
     * @param date the trading day as "yyyyMMdd"
     * @return one BC line per bar, in arrival order. Empty when the lookup succeeds with no bars, and the single
     * line "n,ticker" when the date is malformed or the lookup fails.
     */
    public List<String> processJob(String ticker, String date) {
        LocalDate day;
        try {
            day = LocalDate.parse(StringUtils.trimToEmpty(date), REQUEST_DATE);
        } catch (DateTimeParseException e) {
            log.error("Not a request date: '" + date + "' (ticker " + ticker + ")");
            return noData(ticker);
        }

        log.info("Getting bars for " + ticker);
        IHistoricalBarSource source;
        try {
            source = createSource();
            source.connect(getLookupHost(), getLookupPort(), TerminationStyle.RUN_FOREVER);
        } catch (InvalidArgumentException | InvalidStateException e) {
            log.error("Could not connect to IQFeed for " + ticker + ": " + e.getMessage(), e);
            return noData(ticker);
        }

        try {
            List<Bar> bars = source.requestBarsInPeriod(ticker, day.atTime(marketOpen), day.atTime(marketClose),
                    intervalSeconds, IntervalType.SECONDS, getRequestTimeoutSeconds());
            log.info("Got bars for " + ticker);
            return formatBars(ticker, bars);
        } catch (InvalidArgumentException | InvalidStateException | NoDataError | IQFeedError | TimeoutException e) {
            log.error("Error retrieving bars for " + ticker + ": " + e, e);
            return noData(ticker);
        } finally {
            try {
                source.disconnect();
            } catch (InvalidStateException e) {
                log.warn("Error while disconnecting " + source.getName() + ": " + e.getMessage());
            }
        }
    }

    /**
     * Makes a fresh, unconnected source for one job
     */
    protected IHistoricalBarSource createSource() throws InvalidArgumentException, InvalidStateException {
        HistoryConnection connection = new HistoryConnection("relay history");
        connection.init(config);
        return connection;
    }

    protected String getLookupHost() throws InvalidArgumentException, InvalidStateException {
        String host = config.simpleComponentConfigEntryWithOverride(IIqFeedConfig.RELAY, "iqfeedHost");
        if (StringUtils.isBlank(host)) {
            throw new InvalidArgumentException("relay.iqfeedHost is not configured (set IQFEED_HOST)");
        }
        return host.trim();
    }

    protected int getLookupPort() throws InvalidArgumentException, InvalidStateException {
        return config.intComponentConfigEntryWithOverride(IIqFeedConfig.RELAY, "iqfeedLookupPort", DEFAULT_LOOKUP_PORT);
    }

    private int getRequestTimeoutSeconds() throws InvalidArgumentException, InvalidStateException {
        return config.intComponentConfigEntryWithOverride(IIqFeedConfig.HISTORY, "requestTimeoutSeconds", HistoryConnection.DEFAULT_TIMEOUT_SECONDS);
    }

    List<String> formatBars(String ticker, List<Bar> bars) {
        String intervalTag = "B-" + ticker + "-" + StringUtils.leftPad(Integer.toString(intervalSeconds), 4, '0') + "-s";
        ArrayList<String> lines = new ArrayList<>(bars.size());
        for (Bar bar : bars) {
            StringBuilder line = new StringBuilder(intervalTag);
            line.append(",BC,").append(ticker);
            line.append(',').append(BAR_TIMESTAMP.format(bar.getTimestamp()));
            line.append(',').append(formatPrice(bar.getOpen()));
            line.append(',').append(formatPrice(bar.getHigh()));
            line.append(',').append(formatPrice(bar.getLow()));
            line.append(',').append(formatPrice(bar.getClose()));
            line.append(',').append(bar.getCumulativeVolume());
            line.append(',').append(bar.getIntervalVolume());
            line.append(',').append(bar.getNumTrades());
            lines.add(line.toString());
        }
        return lines;
    }

    private static List<String> noData(String ticker) {
        return Collections.singletonList(BarRelayClientHandler.NO_DATA_PREFIX + ticker);
    }
}
