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

package com.iqbars.elements;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * An interval bar (OHLC plus volume figures) for one ticker, as received from IQFeed either in response to a
 * history request or pushed on a watched ticker. Immutable. Two bars are equal when every field is equal,
 * which is what live bar de-duplication relies on.
 */
public final class Bar {
    private final LocalDate date;
    private final LocalTime time;
    private final double open;
    private final double high;
    private final double low;
    private final double close;
    private final long cumulativeVolume;
    private final long intervalVolume;
    private final long numTrades;
    private final String ticker;

    @SuppressWarnings("ConstructorWithTooManyParameters")
    public Bar(LocalDate date, LocalTime time, double open, double high, double low, double close,
               long cumulativeVolume, long intervalVolume, long numTrades, String ticker) {
        this.date = date;
        this.time = time;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.cumulativeVolume = cumulativeVolume;
        this.intervalVolume = intervalVolume;
        this.numTrades = numTrades;
        this.ticker = ticker;
    }

    public LocalDate getDate() {
        return date;
    }

    public LocalTime getTime() {
        return time;
    }

    public LocalDateTime getTimestamp() {
        return LocalDateTime.of(date, time);
    }

    public double getOpen() {
        return open;
    }

    public double getHigh() {
        return high;
    }

    public double getLow() {
        return low;
    }

    public double getClose() {
        return close;
    }

    public long getCumulativeVolume() {
        return cumulativeVolume;
    }

    public long getIntervalVolume() {
        return intervalVolume;
    }

    public long getNumTrades() {
        return numTrades;
    }

    public String getTicker() {
        return ticker;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Bar other = (Bar) o;
        return new EqualsBuilder()
                .append(date, other.date)
                .append(time, other.time)
                .append(open, other.open)
                .append(high, other.high)
                .append(low, other.low)
                .append(close, other.close)
                .append(cumulativeVolume, other.cumulativeVolume)
                .append(intervalVolume, other.intervalVolume)
                .append(numTrades, other.numTrades)
                .append(ticker, other.ticker)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(date).append(time)
                .append(open).append(high).append(low).append(close)
                .append(cumulativeVolume).append(intervalVolume).append(numTrades)
                .append(ticker)
                .toHashCode();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
                .append("ticker", ticker)
                .append("date", date)
                .append("time", time)
                .append("open", open)
                .append("high", high)
                .append("low", low)
                .append("close", close)
                .append("cumulativeVolume", cumulativeVolume)
                .append("intervalVolume", intervalVolume)
                .append("numTrades", numTrades)
                .toString();
    }
}
