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

/**
 * End of day bar with open interest. Immutable.
 */
public final class DailyBar {
    private final LocalDate date;
    private final double high;
    private final double low;
    private final double open;
    private final double close;
    private final long intervalVolume;
    private final long openInterest;
    private final String ticker;

    public DailyBar(LocalDate date, double high, double low, double open, double close,
                    long intervalVolume, long openInterest, String ticker) {
        this.date = date;
        this.high = high;
        this.low = low;
        this.open = open;
        this.close = close;
        this.intervalVolume = intervalVolume;
        this.openInterest = openInterest;
        this.ticker = ticker;
    }

    public LocalDate getDate() {
        return date;
    }

    public double getHigh() {
        return high;
    }

    public double getLow() {
        return low;
    }

    public double getOpen() {
        return open;
    }

    public double getClose() {
        return close;
    }

    public long getIntervalVolume() {
        return intervalVolume;
    }

    public long getOpenInterest() {
        return openInterest;
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
        DailyBar other = (DailyBar) o;
        return new EqualsBuilder()
                .append(date, other.date)
                .append(high, other.high)
                .append(low, other.low)
                .append(open, other.open)
                .append(close, other.close)
                .append(intervalVolume, other.intervalVolume)
                .append(openInterest, other.openInterest)
                .append(ticker, other.ticker)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(19, 41)
                .append(date).append(high).append(low).append(open).append(close)
                .append(intervalVolume).append(openInterest).append(ticker)
                .toHashCode();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
                .append("ticker", ticker)
                .append("date", date)
                .append("high", high)
                .append("low", low)
                .append("open", open)
                .append("close", close)
                .append("intervalVolume", intervalVolume)
                .append("openInterest", openInterest)
                .toString();
    }
}
