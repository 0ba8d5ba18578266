/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.amazonaws.services.dynamodbv2.model.LimitExceededException;
import com.amazonaws.services.dynamodbv2.model.ProvisionedThroughputExceededException;
import com.amazonaws.services.dynamodbv2.model.ResourceNotFoundException;
import com.salesforce.dynamodbv2.mapper.exceptions.MapperException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class SessionRetryTest {

    private final List<Long> sleeps = new ArrayList<>();
    private final SessionRetry sut = new SessionRetry(4, 100L, 2, sleeps::add);

    @Test
    void backoffGrowsExponentially() {
        assertEquals(100L, sut.backoffMillis(1));
        assertEquals(200L, sut.backoffMillis(2));
        assertEquals(400L, sut.backoffMillis(3));
    }

    @Test
    void roundBackoffStopsGrowingAtMaxAttempts() {
        sut.backoff("op", 1);
        sut.backoff("op", 4);
        sut.backoff("op", 9);
        assertEquals(List.of(100L, 800L, 800L), sleeps);
    }

    @Test
    void retriesThrottledCalls() {
        AtomicInteger calls = new AtomicInteger();
        String result = sut.execute("op", () -> {
            if (calls.incrementAndGet() < 3) {
                throw calls.get() == 1 ? new LimitExceededException("slow down")
                    : new ProvisionedThroughputExceededException("slow down");
            }
            return "ok";
        });
        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(100L, 200L), sleeps);
    }

    @Test
    void givesUpAfterLastAttempt() {
        AtomicInteger calls = new AtomicInteger();
        LimitExceededException throttled = new LimitExceededException("slow down");
        MapperException e = assertThrows(MapperException.class, () -> sut.execute("op", () -> {
            calls.incrementAndGet();
            throw throttled;
        }));
        assertSame(throttled, e.getCause());
        assertEquals(4, calls.get());
        assertEquals(List.of(100L, 200L, 400L), sleeps);
    }

    @Test
    void otherErrorsAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        assertThrows(ResourceNotFoundException.class, () -> sut.execute("op", () -> {
            calls.incrementAndGet();
            throw new ResourceNotFoundException("missing");
        }));
        assertEquals(1, calls.get());
    }

}
