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
import com.iqbars.elements.DailyBar;
import com.iqbars.elements.IntervalType;
import com.iqbars.exceptions.InvalidArgumentException;
import com.iqbars.adapters.iqfeed.lookup.PendingLookupRequest;
import com.iqbars.exceptions.InvalidStateException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.*;

class HistoryConnectionTest {
    private static final long WAIT_MILLIS = 3000;
    private static final LocalDateTime OPEN = LocalDateTime.of(2019, 11, 29, 9, 30);
    private static final LocalDateTime CLOSE = LocalDateTime.of(2019, 11, 29, 16, 0);
    private static final LocalDate DAY = LocalDate.of(2019, 11, 29);
    private static final int HIT_REQUEST_ID = 9;
    private static final int HDT_REQUEST_ID = 6;

    private MockIQFeedServer server;
    private HistoryConnection connection;
    private ExecutorService executor;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockIQFeedServer();
        IqFeedConfig config = new IqFeedConfig();
        config.setComponentConfigEntry(IIqFeedConfig.HISTORY, "requestTimeoutSeconds", "5");
        connection = new HistoryConnection("test history");
        connection.init(config);
        connection.connect(server.getHost(), server.getPort(), TerminationStyle.RUN_FOREVER);
        executor = Executors.newFixedThreadPool(3);
    }

    @AfterEach
    void tearDown() throws Exception {
        executor.shutdownNow();
        if (connection.isConnected()) {
            connection.disconnect();
        }
        server.close();
    }

    private static List<String> lines(String... lines) {
        return Arrays.asList(lines);
    }

    @Test
    void periodRequestReturnsTheBarsInOrder() throws Exception {
        server.respond("HIT", fields -> {
            String id = fields[HIT_REQUEST_ID];
            return lines(
                    id + ",2019-11-29 09:31:00,266.9,266.4,266.6,266.8,310000,310000,412,",
                    id + ",2019-11-29 09:32:00,267.2,266.7,266.8,267.1,395000,85000,230,",
                    id + ",2019-11-29 09:33:00,267.4,267.0,267.1,267.3,420000,25000,101,",
                    id + ",!ENDMSG!,");
        });

        List<Bar> bars = connection.requestBarsInPeriod("AAPL", OPEN, CLOSE, 60, IntervalType.SECONDS);

        assertThat(bars).hasSize(3);
        assertThat(bars).extracting(Bar::getTime).containsExactly(LocalTime.of(9, 31), LocalTime.of(9, 32), LocalTime.of(9, 33));
        Bar first = bars.get(0);
        assertThat(first.getTicker()).isEqualTo("AAPL");
        assertThat(first.getHigh()).isEqualTo(266.9);
        assertThat(first.getLow()).isEqualTo(266.4);
        assertThat(first.getOpen()).isEqualTo(266.6);
        assertThat(first.getClose()).isEqualTo(266.8);
        assertThat(first.getCumulativeVolume()).isEqualTo(310000L);
        assertThat(first.getIntervalVolume()).isEqualTo(310000L);
        assertThat(first.getNumTrades()).isEqualTo(412L);
        assertThat(connection.getPendingRequestCount()).isZero();
    }

    @Test
    void periodRequestCommandCarriesTheRequestId() throws Exception {
        server.respond("HIT", fields -> lines(fields[HIT_REQUEST_ID] + ",!ENDMSG!,"));

        List<Bar> bars = connection.requestBarsInPeriod("AAPL", OPEN, CLOSE, 60, IntervalType.SECONDS);

        assertThat(bars).isEmpty();
        assertThat(server.awaitLine("HIT", WAIT_MILLIS))
                .matches("HIT,AAPL,60,20191129 093000,20191129 160000,,,,1,H_AAPL\\d{10},,s,");
    }

    @Test
    void noDataMarkerFailsTheRequest() {
        server.respond("HIT", fields -> lines(fields[HIT_REQUEST_ID] + ",E,!NO_DATA!,"));

        assertThatThrownBy(() -> connection.requestBarsInPeriod("ZZZZ", OPEN, CLOSE, 60, IntervalType.SECONDS))
                .isInstanceOf(NoDataError.class);
        assertThat(connection.getPendingRequestCount()).isZero();
    }

    @Test
    void terminatorIsCheckedBeforeTheNoDataMarker() throws Exception {
        server.respond("HIT", fields -> lines(fields[HIT_REQUEST_ID] + ",!ENDMSG!,!NO_DATA!"));

        assertThat(connection.requestBarsInPeriod("ZZZZ", OPEN, CLOSE, 60, IntervalType.SECONDS)).isEmpty();
    }

    @Test
    void serverErrorIsCarriedThrough() {
        server.respond("HIT", fields -> lines(fields[HIT_REQUEST_ID] + ",E,Too many simultaneous requests.,"));

        assertThatThrownBy(() -> connection.requestBarsInPeriod("AAPL", OPEN, CLOSE, 60, IntervalType.SECONDS))
                .isInstanceOfSatisfying(IQFeedError.class, e -> {
                    assertThat(e.getLiteralError()).isEqualTo("Too many simultaneous requests.");
                    assertThat(e.isRetriable()).isTrue();
                });
    }

    @Test
    void malformedDataLinesAreDropped() throws Exception {
        server.respond("HIT", fields -> {
            String id = fields[HIT_REQUEST_ID];
            return lines(
                    id + ",2019-11-29 09:31:00,266.9,266.4,266.6,266.8,310000,310000,412,",
                    id + ",2019-11-29 09:32:00,not a price,266.7,266.8,267.1,395000,85000,230,",
                    id + ",2019-11-29 09:33:00,267.4",
                    id + ",2019-11-29 09:34:00,267.4,267.0,267.1,267.3,420000,25000,101,",
                    id + ",!ENDMSG!,");
        });

        List<Bar> bars = connection.requestBarsInPeriod("AAPL", OPEN, CLOSE, 60, IntervalType.SECONDS);

        assertThat(bars).extracting(Bar::getTime).containsExactly(LocalTime.of(9, 31), LocalTime.of(9, 34));
    }

    @Test
    void dailyRequestReturnsTheLastBar() throws Exception {
        server.respond("HDT", fields -> {
            String id = fields[HDT_REQUEST_ID];
            return lines(
                    id + ",2019-11-29,268.0,264.8,266.6,267.3,11654363,0,",
                    id + ",2019-11-29,268.0,264.8,266.6,267.25,11654400,0,",
                    id + ",!ENDMSG!,");
        });

        DailyBar bar = connection.requestDailyBarForDate("AAPL", DAY);

        assertThat(bar.getTicker()).isEqualTo("AAPL");
        assertThat(bar.getDate()).isEqualTo(DAY);
        assertThat(bar.getHigh()).isEqualTo(268.0);
        assertThat(bar.getLow()).isEqualTo(264.8);
        assertThat(bar.getOpen()).isEqualTo(266.6);
        assertThat(bar.getClose()).isEqualTo(267.25);
        assertThat(bar.getIntervalVolume()).isEqualTo(11654400L);
        assertThat(bar.getOpenInterest()).isZero();
        assertThat(server.awaitLine("HDT", WAIT_MILLIS)).matches("HDT,AAPL,20191129,20191129,,1,D_AAPL\\d{10},,");
    }

    @Test
    void emptyDailyResponseIsNoData() {
        server.respond("HDT", fields -> lines(fields[HDT_REQUEST_ID] + ",!ENDMSG!,"));

        assertThatThrownBy(() -> connection.requestDailyBarForDate("AAPL", DAY)).isInstanceOf(NoDataError.class);
    }

    @Test
    void unansweredRequestTimesOutAndLeavesTheConnectionUsable() throws Exception {
        assertThatThrownBy(() -> connection.requestBarsInPeriod("AAPL", OPEN, CLOSE, 60, IntervalType.SECONDS, 1))
                .isInstanceOf(TimeoutException.class);
        assertThat(connection.getPendingRequestCount()).isZero();

        String lateRequest = server.awaitLine("HIT", WAIT_MILLIS);
        String lateId = lateRequest.split(",", -1)[HIT_REQUEST_ID];
        server.send(lateId + ",2019-11-29 09:31:00,266.9,266.4,266.6,266.8,310000,310000,412,", lateId + ",!ENDMSG!,");

        server.respond("HIT", fields -> lines(fields[HIT_REQUEST_ID] + ",!ENDMSG!,"));
        assertThat(connection.requestBarsInPeriod("AAPL", OPEN, CLOSE, 60, IntervalType.SECONDS)).isEmpty();
        assertThat(connection.getState()).isEqualTo(ConnectionState.READING_MESSAGES);
    }

    @Test
    void timedOutRequestLeavesOtherPendingRequestsWaiting() throws Exception {
        Future<List<Bar>> aapl = executor.submit(() -> connection.requestBarsInPeriod("AAPL", OPEN, CLOSE, 60, IntervalType.SECONDS, 1));
        Future<List<Bar>> msft = executor.submit(() -> connection.requestBarsInPeriod("MSFT", OPEN, CLOSE, 60, IntervalType.SECONDS, 10));

        Map<String, String> idByTicker = new HashMap<>();
        for (int i = 0; i < 2; i++) {
            String[] fields = server.awaitLine("HIT", WAIT_MILLIS).split(",", -1);
            idByTicker.put(fields[1], fields[HIT_REQUEST_ID]);
        }
        assertThat(idByTicker).containsOnlyKeys("AAPL", "MSFT");

        assertThatThrownBy(() -> aapl.get(WAIT_MILLIS, TimeUnit.MILLISECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(TimeoutException.class);
        assertThat(msft.isDone()).isFalse();
        assertThat(connection.getPendingRequestCount()).isEqualTo(1);

        String msftId = idByTicker.get("MSFT");
        server.send(
                msftId + ",2019-11-29 09:31:00,151.2,150.9,151.0,151.1,120000,120000,310,",
                msftId + ",2019-11-29 09:32:00,151.4,151.0,151.1,151.3,180000,60000,150,",
                msftId + ",!ENDMSG!,");

        List<Bar> bars = msft.get(WAIT_MILLIS, TimeUnit.MILLISECONDS);
        assertThat(bars).extracting(Bar::getTicker).containsExactly("MSFT", "MSFT");
        assertThat(bars).extracting(Bar::getClose).containsExactly(151.1, 151.3);
        assertThat(connection.getPendingRequestCount()).isZero();
    }

    @Test
    void idsIssuedWhileRequestsAreOutstandingAreFree() throws Exception {
        List<Future<List<Bar>>> requests = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            requests.add(executor.submit(() -> connection.requestBarsInPeriod("AAPL", OPEN, CLOSE, 60, IntervalType.SECONDS)));
        }
        Set<String> outstanding = new HashSet<>();
        for (int i = 0; i < 3; i++) {
            outstanding.add(server.awaitLine("HIT", WAIT_MILLIS).split(",", -1)[HIT_REQUEST_ID]);
        }
        assertThat(outstanding).hasSize(3);
        assertThat(connection.getPendingRequestCount()).isEqualTo(3);

        for (int i = 0; i < 300; i++) {
            assertThat(connection.issueRequestId(HistoryConnection.HISTORY_BAR_PREFIX, "AAPL")).isNotIn(outstanding);
        }

        for (String id : outstanding) {
            server.send(id + ",!ENDMSG!,");
        }
        for (Future<List<Bar>> request : requests) {
            assertThat(request.get(WAIT_MILLIS, TimeUnit.MILLISECONDS)).isEmpty();
        }
    }

    @Test
    void requestIdTakenBeforeRegistrationIsReplaced() throws Exception {
        String takenId = "H_AAPL0000000001";
        HistoryConnection racing = new HistoryConnection("racing history") {
            private boolean first = true;

            @Override
            public String issueRequestId(String prefix, String ticker) {
                if (first) {
                    first = false;
                    return takenId;
                }
                return super.issueRequestId(prefix, ticker);
            }
        };
        try (MockIQFeedServer other = new MockIQFeedServer()) {
            other.respond("HIT", fields -> lines(
                    fields[HIT_REQUEST_ID] + ",2019-11-29 09:31:00,266.9,266.4,266.6,266.8,310000,310000,412,",
                    fields[HIT_REQUEST_ID] + ",!ENDMSG!,"));
            racing.connect(other.getHost(), other.getPort(), TerminationStyle.RUN_FOREVER);
            try {
                assertThat(racing.register(takenId, new PendingLookupRequest<>("AAPL", HistoryConnection::parseHistoryBar))).isTrue();

                List<Bar> bars = racing.requestBarsInPeriod("AAPL", OPEN, CLOSE, 60, IntervalType.SECONDS);

                assertThat(bars).extracting(Bar::getTicker).containsExactly("AAPL");
                String sentId = other.awaitLine("HIT", WAIT_MILLIS).split(",", -1)[HIT_REQUEST_ID];
                assertThat(sentId).startsWith("H_AAPL").isNotEqualTo(takenId);
                assertThat(racing.getPendingRequestCount()).isEqualTo(1);
            } finally {
                racing.disconnect();
            }
        }
    }

    @Test
    void secondTerminatorForTheSameRequestIsIgnored() throws Exception {
        server.respond("HIT", fields -> {
            String id = fields[HIT_REQUEST_ID];
            return lines(
                    id + ",2019-11-29 09:31:00,266.9,266.4,266.6,266.8,310000,310000,412,",
                    id + ",!ENDMSG!,",
                    id + ",2019-11-29 09:32:00,267.2,266.7,266.8,267.1,395000,85000,230,",
                    id + ",!ENDMSG!,");
        });

        assertThat(connection.requestBarsInPeriod("AAPL", OPEN, CLOSE, 60, IntervalType.SECONDS)).hasSize(1);
    }

    @Test
    void concurrentRequestsGetTheirOwnLines() throws Exception {
        Future<List<Bar>> aapl = executor.submit(() -> connection.requestBarsInPeriod("AAPL", OPEN, CLOSE, 60, IntervalType.SECONDS));
        Future<List<Bar>> msft = executor.submit(() -> connection.requestBarsInPeriod("MSFT", OPEN, CLOSE, 60, IntervalType.SECONDS));

        String first = server.awaitLine("HIT", WAIT_MILLIS);
        String second = server.awaitLine("HIT", WAIT_MILLIS);
        String firstId = first.split(",", -1)[HIT_REQUEST_ID];
        String secondId = second.split(",", -1)[HIT_REQUEST_ID];

        server.send(
                secondId + ",2019-11-29 09:31:00,2.0,2.0,2.0,2.0,2,2,2,",
                firstId + ",2019-11-29 09:31:00,1.0,1.0,1.0,1.0,1,1,1,",
                firstId + ",2019-11-29 09:32:00,1.0,1.0,1.0,1.0,1,1,1,",
                secondId + ",!ENDMSG!,",
                firstId + ",!ENDMSG!,");

        List<Bar> aaplBars = aapl.get(WAIT_MILLIS, TimeUnit.MILLISECONDS);
        List<Bar> msftBars = msft.get(WAIT_MILLIS, TimeUnit.MILLISECONDS);
        assertThat(aaplBars).extracting(Bar::getTicker).containsOnly("AAPL");
        assertThat(msftBars).extracting(Bar::getTicker).containsOnly("MSFT");
        assertThat(aaplBars.size() + msftBars.size()).isEqualTo(3);
    }

    @Test
    void outstandingRequestIdCannotBeReused() throws Exception {
        Future<List<Bar>> pending = executor.submit(() ->
                connection.awaitCommand("HIT,AAPL,60,,,,,,1,DUPLICATE,,s,", "AAPL", "DUPLICATE", HistoryConnection::parseHistoryBar, 5));
        assertThat(server.awaitLine("HIT", WAIT_MILLIS)).isNotNull();

        assertThatThrownBy(() -> connection.awaitCommand("HIT,MSFT,60,,,,,,1,DUPLICATE,,s,", "MSFT", "DUPLICATE", HistoryConnection::parseHistoryBar, 5))
                .isInstanceOf(InvalidArgumentException.class);

        server.send("DUPLICATE,!ENDMSG!,");
        assertThat(pending.get(WAIT_MILLIS, TimeUnit.MILLISECONDS)).isEmpty();
    }

    @Test
    void connectionLossFailsOutstandingRequests() throws Exception {
        server.respond("HIT", fields -> {
            try {
                server.dropClient();
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
            return Collections.emptyList();
        });

        long started = System.currentTimeMillis();
        assertThatThrownBy(() -> connection.requestBarsInPeriod("AAPL", OPEN, CLOSE, 60, IntervalType.SECONDS, 20))
                .isInstanceOf(InvalidStateException.class);
        assertThat(System.currentTimeMillis() - started).isLessThan(10000L);
    }

    @Test
    void requestsNeedAConnection() throws Exception {
        connection.disconnect();

        assertThatThrownBy(() -> connection.requestBarsInPeriod("AAPL", OPEN, CLOSE, 60, IntervalType.SECONDS))
                .isInstanceOf(InvalidStateException.class);
    }

    @Test
    void defaultTimeoutComesFromConfiguration() throws Exception {
        assertThat(connection.getDefaultTimeoutSeconds()).isEqualTo(5);
        assertThat(new HistoryConnection().getDefaultTimeoutSeconds()).isEqualTo(HistoryConnection.DEFAULT_TIMEOUT_SECONDS);

        IqFeedConfig badConfig = new IqFeedConfig();
        badConfig.setComponentConfigEntry(IIqFeedConfig.HISTORY, "requestTimeoutSeconds", "0");
        assertThatThrownBy(() -> new HistoryConnection().init(badConfig)).isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void periodMustNotEndBeforeItStarts() {
        assertThatThrownBy(() -> connection.requestBarsInPeriod("AAPL", CLOSE, OPEN, 60, IntervalType.SECONDS))
                .isInstanceOf(InvalidArgumentException.class);
    }
}
