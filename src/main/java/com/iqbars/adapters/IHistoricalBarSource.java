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

package com.iqbars.adapters;

import com.iqbars.adapters.iqfeed.IQFeedError;
import com.iqbars.adapters.iqfeed.NoDataError;
import com.iqbars.adapters.iqfeed.TerminationStyle;
import com.iqbars.elements.Bar;
import com.iqbars.elements.DailyBar;
import com.iqbars.elements.IntervalType;
import com.iqbars.exceptions.InvalidArgumentException;
import com.iqbars.exceptions.InvalidStateException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * A market data source for historical bars, used one connection at a time: connect, request, disconnect.
 */
public interface IHistoricalBarSource {
    public String getName();

    public void connect(String host, int port, TerminationStyle terminationStyle) throws InvalidStateException;

    public void disconnect() throws InvalidStateException;

    /**
     * Gets the interval bars for a ticker in a time period.
     *
     * @param ticker         the ticker for which historic data is requested
     * @param start          the beginning of the first interval to retrieve
     * @param end            the end of the last interval to retrieve
     * @param intervalLength in units of the interval type
     * @param intervalType   seconds, volume or ticks
     * @param timeoutSeconds the maximum time allowed to spend on this operation
     * @return the bars in the order the source sent them. May be empty.
     * @throws InvalidArgumentException if the request cannot be expressed
     * @throws InvalidStateException if not connected or the connection stopped during the request
     * @throws NoDataError if the source has nothing for the ticker in the period
     * @throws IQFeedError if the source reported an error
     * @throws TimeoutException
     */
    public List<Bar> requestBarsInPeriod(String ticker, LocalDateTime start, LocalDateTime end, int intervalLength,
                                         IntervalType intervalType, int timeoutSeconds)
            throws InvalidArgumentException, InvalidStateException, NoDataError, IQFeedError, TimeoutException;

    /**
     * Gets the daily bar of one day
     * @throws NoDataError if there is no bar for that day
     */
    public DailyBar requestDailyBarForDate(String ticker, LocalDate day, int timeoutSeconds)
            throws InvalidArgumentException, InvalidStateException, NoDataError, IQFeedError, TimeoutException;
}
