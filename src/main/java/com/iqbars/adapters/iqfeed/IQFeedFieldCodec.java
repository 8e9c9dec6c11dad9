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

import com.iqbars.exceptions.MalformedFieldException;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Conversions between IQFeed field text and Java values.
 * IQFeed wants timestamps as "yyyyMMdd HHmmss" (dates as "yyyyMMdd") in requests, but answers with
 * "yyyy-MM-dd HH:mm:ss" (dates as "yyyy-MM-dd").
 */
public final class IQFeedFieldCodec {
    public static final char FIELD_SEPARATOR = ',';

    private static final DateTimeFormatter INBOUND_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter INBOUND_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private IQFeedFieldCodec() {
    }

    /**
     * Converts a timestamp to an IQFeed request timestamp "yyyyMMdd HHmmss"
     * @param timestamp
     * @return
     */
    public static String toIqFeedTimestamp(LocalDateTime timestamp) {
        StringBuilder retval = new StringBuilder(toIqFeedDate(timestamp.toLocalDate()));

        retval.append(" ");
        retval.append(StringUtils.leftPad(Integer.toString(timestamp.getHour()), 2, '0'));
        retval.append(StringUtils.leftPad(Integer.toString(timestamp.getMinute()), 2, '0'));
        retval.append(StringUtils.leftPad(Integer.toString(timestamp.getSecond()), 2, '0'));

        return retval.toString();
    }

    /**
     * Converts a date to an IQFeed request date "yyyyMMdd"
     * @param date
     * @return
     */
    public static String toIqFeedDate(LocalDate date) {
        StringBuilder retval = new StringBuilder();

        retval.append(StringUtils.leftPad(Integer.toString(date.getYear()), 4, '0'));
        retval.append(StringUtils.leftPad(Integer.toString(date.getMonthValue()), 2, '0'));
        retval.append(StringUtils.leftPad(Integer.toString(date.getDayOfMonth()), 2, '0'));

        return retval.toString();
    }

    /**
     * Parses an IQFeed response timestamp such as "2019-11-29 09:30:00"
     * @param timestamp the field text
     * @return the timestamp. Use toLocalDate() and toLocalTime() for the separate parts.
     * @throws MalformedFieldException if the text is not in the expected form
     */
    public static LocalDateTime parseTimestamp(String timestamp) throws MalformedFieldException {
        try {
            return LocalDateTime.parse(StringUtils.trimToEmpty(timestamp), INBOUND_TIMESTAMP);
        } catch (DateTimeParseException e) {
            throw new MalformedFieldException("Not an IQFeed timestamp: '" + timestamp + "'", e);
        }
    }

    /**
     * Parses an IQFeed response date such as "2019-11-29"
     * @param date the field text
     * @return the date
     * @throws MalformedFieldException if the text is not in the expected form
     */
    public static LocalDate parseDate(String date) throws MalformedFieldException {
        try {
            return LocalDate.parse(StringUtils.trimToEmpty(date), INBOUND_DATE);
        } catch (DateTimeParseException e) {
            throw new MalformedFieldException("Not an IQFeed date: '" + date + "'", e);
        }
    }

    public static double parsePrice(String field) throws MalformedFieldException {
        try {
            return Double.parseDouble(StringUtils.trimToEmpty(field));
        } catch (NumberFormatException e) {
            throw new MalformedFieldException("Not a price: '" + field + "'", e);
        }
    }

    /**
     * Renders a price in plain decimal notation with at least one fractional digit, e.g. "267.25", "268.0" or
     * "10000000.0". Never uses an exponent. NaN and infinities render as {@link Double#toString(double)} does.
     */
    public static String formatPrice(double price) {
        if (Double.isNaN(price) || Double.isInfinite(price)) {
            return Double.toString(price);
        }
        String plain = BigDecimal.valueOf(price).stripTrailingZeros().toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }

    public static long parseCount(String field) throws MalformedFieldException {
        try {
            return Long.parseLong(StringUtils.trimToEmpty(field));
        } catch (NumberFormatException e) {
            throw new MalformedFieldException("Not an integer count: '" + field + "'", e);
        }
    }

    /**
     * Bounds-safe field access. IQFeed pads or omits trailing fields freely, so a missing field reads as "".
     * @param fields the fields of one line
     * @param index the zero based position
     * @return the field, or an empty string if there is no such field
     */
    public static String getField(String[] fields, int index) {
        if (fields == null || index < 0 || index >= fields.length) {
            return "";
        }
        return fields[index];
    }

    /**
     * Splits one received line into fields, dropping trailing empty fields. Empty fields in the middle of the
     * line keep their position.
     * @param message the line without its terminator
     * @return the fields
     */
    public static String[] splitFields(String message) {
        return StringUtils.splitPreserveAllTokens(StringUtils.stripEnd(message, ","), FIELD_SEPARATOR);
    }

    /**
     * Verifies the exact field count of a positional record
     * @throws MalformedFieldException if the count is off
     */
    public static void requireFieldCount(String[] fields, int expected) throws MalformedFieldException {
        int actual = fields == null ? 0 : fields.length;
        if (actual != expected) {
            throw new MalformedFieldException("Expected " + expected + " fields but got " + actual + ": " +
                    StringUtils.join(fields, FIELD_SEPARATOR));
        }
    }
}
