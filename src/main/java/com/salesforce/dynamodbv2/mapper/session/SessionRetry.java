/*
 * Copyright (c) 2019, salesforce.com, inc.
 * All rights reserved.
 * Licensed under the BSD 3-Clause license.
 * For full license text, see LICENSE.txt file in the repo root  or https://opensource.org/licenses/BSD-3-Clause
 */

package com.salesforce.dynamodbv2.mapper.session;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.amazonaws.services.dynamodbv2.model.LimitExceededException;
import com.amazonaws.services.dynamodbv2.model.ProvisionedThroughputExceededException;
import com.google.common.annotations.VisibleForTesting;
import com.salesforce.dynamodbv2.mapper.exceptions.MapperException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries throttled calls with exponential backoff. Any other failure is passed through untouched.
 */
public class SessionRetry {

    private static final Logger LOG = LoggerFactory.getLogger(SessionRetry.class);

    private static final int DEFAULT_MAX_ATTEMPTS = 6;
    private static final long DEFAULT_INITIAL_BACKOFF_MILLIS = 1000L;
    private static final int DEFAULT_BACKOFF_MULTIPLIER = 2;

    /**
     * Sleep function used between attempts.
     */
    @FunctionalInterface
    public interface Sleeper {

        void sleep(long millis);

    }

    private static class ThreadSleeper implements Sleeper {
        @Override
        public void sleep(long millis) {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException ie) {
                LOG.debug("Sleeper sleep was interrupted ", ie);
                Thread.currentThread().interrupt();
            }
        }
    }

    private final int maxAttempts;
    private final long initialBackoffMillis;
    private final int backoffMultiplier;
    private final Sleeper sleeper;

    public SessionRetry() {
        this(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_BACKOFF_MILLIS, DEFAULT_BACKOFF_MULTIPLIER, new ThreadSleeper());
    }

    public SessionRetry(int maxAttempts, long initialBackoffMillis, int backoffMultiplier, Sleeper sleeper) {
        checkArgument(maxAttempts > 0, "maxAttempts must be positive");
        checkArgument(initialBackoffMillis >= 0, "initialBackoffMillis must not be negative");
        checkArgument(backoffMultiplier > 0, "backoffMultiplier must be positive");
        this.maxAttempts = maxAttempts;
        this.initialBackoffMillis = initialBackoffMillis;
        this.backoffMultiplier = backoffMultiplier;
        this.sleeper = checkNotNull(sleeper, "sleeper is required");
    }

    /**
     * Runs the call, retrying while it is throttled.
     *
     * @param operation name of the operation, for logging
     * @param call      the call to run
     * @return the call's result
     * @throws MapperException if the call is still throttled after the last attempt
     */
    public <T> T execute(String operation, Supplier<T> call) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return call.get();
            } catch (LimitExceededException | ProvisionedThroughputExceededException e) {
                if (attempt >= maxAttempts) {
                    throw new MapperException(operation + " was throttled " + attempt + " times", e);
                }
                long backoff = backoffMillis(attempt);
                LOG.warn("{} was throttled on attempt {}, retrying in {}ms", operation, attempt, backoff);
                sleeper.sleep(backoff);
            }
        }
    }

    /**
     * Sleeps before another round of a partially completed call. The delay grows like the throttling backoff and
     * stops growing once {@code round} reaches the maximum number of attempts.
     */
    public void backoff(String operation, int round) {
        long backoff = backoffMillis(Math.min(round, maxAttempts));
        LOG.debug("{} backing off {}ms before round {}", operation, backoff, round + 1);
        sleeper.sleep(backoff);
    }

    @VisibleForTesting
    long backoffMillis(int attempt) {
        return initialBackoffMillis * (long) Math.pow(backoffMultiplier, attempt - 1);
    }

}
