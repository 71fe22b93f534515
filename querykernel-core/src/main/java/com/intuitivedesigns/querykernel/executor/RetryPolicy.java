/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.executor;

import java.time.Duration;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * Bounded retries with exponential backoff and full jitter.
 *
 * @param maxAttempts total attempts including the first one
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double multiplier) {

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("Backoff must not be negative");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) maxBackoff = initialBackoff;
        if (multiplier < 1.0) multiplier = 1.0;
    }

    public static RetryPolicy none() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0);
    }

    public boolean shouldRetry(int attemptsSoFar, boolean retryable) {
        return retryable && attemptsSoFar < maxAttempts;
    }

    /**
     * Delay before the next attempt: uniform in {@code [0, min(max, initial * multiplier^(attempt-1))]}.
     *
     * @param attempt the attempt that just failed, starting at 1
     * @param random  uniform source in [0, 1)
     */
    public Duration backoff(int attempt, DoubleSupplier random) {
        double ceiling = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        long cap = (long) Math.min(maxBackoff.toMillis(), ceiling);
        if (cap <= 0) return Duration.ZERO;
        return Duration.ofMillis(Math.min(cap, (long) (random.getAsDouble() * (cap + 1))));
    }
}
