/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.executor;

import com.intuitivedesigns.querykernel.config.KernelConfig;
import com.intuitivedesigns.querykernel.model.SourceKind;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable executor tuning.
 *
 * <pre>
 * executor.max.parallelism=4
 * executor.attempt.timeout.ms=30000
 * executor.retry.max.attempts=3
 * executor.retry.initial.backoff.ms=100
 * executor.retry.max.backoff.ms=2000
 * executor.retry.multiplier=2.0
 * executor.kind.relational.limit=8
 * </pre>
 */
public final class ExecutorSettings {

    public static final String MAX_PARALLELISM_KEY = "executor.max.parallelism";
    public static final String ATTEMPT_TIMEOUT_KEY = "executor.attempt.timeout.ms";
    public static final String RETRY_MAX_ATTEMPTS_KEY = "executor.retry.max.attempts";
    public static final String RETRY_INITIAL_BACKOFF_KEY = "executor.retry.initial.backoff.ms";
    public static final String RETRY_MAX_BACKOFF_KEY = "executor.retry.max.backoff.ms";
    public static final String RETRY_MULTIPLIER_KEY = "executor.retry.multiplier";
    public static final String KIND_LIMIT_PREFIX = "executor.kind.";

    public static final int DEFAULT_MAX_PARALLELISM = 4;
    public static final long DEFAULT_ATTEMPT_TIMEOUT_MS = 30_000L;

    private final int maxParallelism;
    private final Duration attemptTimeout;
    private final RetryPolicy retryPolicy;
    private final Map<SourceKind, Integer> kindLimits;

    public ExecutorSettings(int maxParallelism, Duration attemptTimeout, RetryPolicy retryPolicy, Map<SourceKind, Integer> kindLimits) {
        if (maxParallelism < 1) throw new IllegalArgumentException("maxParallelism must be >= 1");
        Objects.requireNonNull(attemptTimeout, "attemptTimeout");
        if (attemptTimeout.isZero() || attemptTimeout.isNegative()) {
            throw new IllegalArgumentException("attemptTimeout must be > 0");
        }
        this.maxParallelism = maxParallelism;
        this.attemptTimeout = attemptTimeout;
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        EnumMap<SourceKind, Integer> limits = defaultKindLimits();
        if (kindLimits != null) {
            kindLimits.forEach((k, v) -> limits.put(k, Math.max(1, v)));
        }
        this.kindLimits = Collections.unmodifiableMap(limits);
    }

    public static ExecutorSettings defaults() {
        return from(KernelConfig.empty());
    }

    public static ExecutorSettings from(KernelConfig config) {
        RetryPolicy retry = new RetryPolicy(
                Math.max(1, config.getInt(RETRY_MAX_ATTEMPTS_KEY, 3)),
                Duration.ofMillis(Math.max(0L, config.getLong(RETRY_INITIAL_BACKOFF_KEY, 100L))),
                Duration.ofMillis(Math.max(0L, config.getLong(RETRY_MAX_BACKOFF_KEY, 2_000L))),
                config.getDouble(RETRY_MULTIPLIER_KEY, 2.0));

        EnumMap<SourceKind, Integer> limits = defaultKindLimits();
        for (SourceKind kind : SourceKind.values()) {
            String key = KIND_LIMIT_PREFIX + kind.name().toLowerCase(Locale.ROOT) + ".limit";
            limits.put(kind, Math.max(1, config.getInt(key, limits.get(kind))));
        }

        return new ExecutorSettings(
                Math.max(1, config.getInt(MAX_PARALLELISM_KEY, DEFAULT_MAX_PARALLELISM)),
                Duration.ofMillis(Math.max(1L, config.getLong(ATTEMPT_TIMEOUT_KEY, DEFAULT_ATTEMPT_TIMEOUT_MS))),
                retry,
                limits);
    }

    // Connection-pool sized defaults per storage family
    private static EnumMap<SourceKind, Integer> defaultKindLimits() {
        EnumMap<SourceKind, Integer> m = new EnumMap<>(SourceKind.class);
        m.put(SourceKind.RELATIONAL, 8);
        m.put(SourceKind.DOCUMENT, 6);
        m.put(SourceKind.VECTOR, 4);
        m.put(SourceKind.MESSAGE_LOG, 2);
        return m;
    }

    public int maxParallelism() {
        return maxParallelism;
    }

    public Duration attemptTimeout() {
        return attemptTimeout;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public Map<SourceKind, Integer> kindLimits() {
        return kindLimits;
    }

    public int kindLimit(SourceKind kind) {
        return kindLimits.getOrDefault(kind, maxParallelism);
    }

    @Override
    public String toString() {
        return "ExecutorSettings{maxParallelism=" + maxParallelism + ", attemptTimeout=" + attemptTimeout
                + ", retry=" + retryPolicy + ", kindLimits=" + kindLimits + '}';
    }
}
