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

package com.iqbars.adapters.iqfeed.lookup;

import com.iqbars.adapters.iqfeed.IQFeedError;
import com.iqbars.adapters.iqfeed.NoDataError;
import com.iqbars.exceptions.InvalidStateException;
import com.iqbars.exceptions.MalformedFieldException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.*;

class PendingLookupRequestTest {

    private final PendingLookupRequest<String> request = new PendingLookupRequest<>("AAPL", fields -> {
        if (fields.length < 2) {
            throw new MalformedFieldException("short line");
        }
        return fields[0] + ":" + fields[1];
    });

    @Test
    void completesWithRecordsInArrivalOrder() throws Exception {
        request.add(new String[]{"AAPL", "1"});
        request.add(new String[]{"AAPL", "2"});

        assertThat(request.complete()).isTrue();
        assertThat(request.await(1, TimeUnit.SECONDS)).containsExactly("AAPL:1", "AAPL:2");
    }

    @Test
    void resolvesAtMostOnce() throws Exception {
        assertThat(request.complete()).isTrue();
        assertThat(request.complete()).isFalse();
        assertThat(request.fail(new NoDataError("late"))).isFalse();

        assertThat(request.isDone()).isTrue();
        assertThat(request.await(1, TimeUnit.SECONDS)).isEmpty();
    }

    @Test
    void rejectedLinesAreNotAccumulated() throws Exception {
        assertThatThrownBy(() -> request.add(new String[]{"AAPL"})).isInstanceOf(MalformedFieldException.class);
        assertThat(request.size()).isZero();
    }

    @Test
    void failuresReachTheWaiterWithTheirOwnType() {
        PendingLookupRequest<String> noData = new PendingLookupRequest<>("X", fields -> fields[0]);
        noData.fail(new NoDataError("none"));
        assertThatThrownBy(() -> noData.await(1, TimeUnit.SECONDS)).isInstanceOf(NoDataError.class);

        PendingLookupRequest<String> serverError = new PendingLookupRequest<>("X", fields -> fields[0]);
        serverError.fail(new IQFeedError("Invalid symbol."));
        assertThatThrownBy(() -> serverError.await(1, TimeUnit.SECONDS)).isInstanceOf(IQFeedError.class);

        PendingLookupRequest<String> closed = new PendingLookupRequest<>("X", fields -> fields[0]);
        closed.fail(new InvalidStateException("connection closed"));
        assertThatThrownBy(() -> closed.await(1, TimeUnit.SECONDS)).isInstanceOf(InvalidStateException.class);
    }

    @Test
    void timesOutWhenNothingArrives() {
        assertThatThrownBy(() -> request.await(50, TimeUnit.MILLISECONDS)).isInstanceOf(TimeoutException.class);
        assertThat(request.isDone()).isFalse();
    }
}
