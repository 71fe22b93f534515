/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.cache;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.intuitivedesigns.querykernel.metrics.MetricsRuntime;
import com.intuitivedesigns.querykernel.spi.Cache;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded, expiring fetch-result cache on Caffeine.
 * Entries are evicted by size (W-TinyLFU) and expire a fixed time after write.
 */
public final class CaffeineResultCache<K, V> implements Cache<K, V> {

    private final com.github.benmanes.caffeine.cache.Cache<K, V> underlying;
    private final MetricsRuntime metrics;

    public CaffeineResultCache(long maxSize, Duration ttl, MetricsRuntime metrics) {
        this(maxSize, ttl, metrics, Ticker.systemTicker());
    }

    CaffeineResultCache(long maxSize, Duration ttl, MetricsRuntime metrics, Ticker ticker) {
        Objects.requireNonNull(ttl, "ttl");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.underlying = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    @Override
    public Optional<V> get(K key) {
        if (key == null) return Optional.empty();
        V v = underlying.getIfPresent(key);
        metrics.counter(v == null ? "qk.cache.miss" : "qk.cache.hit");
        return Optional.ofNullable(v);
    }

    @Override
    public void put(K key, V value) {
        if (key != null && value != null) {
            underlying.put(key, value);
        }
    }

    @Override
    public void invalidate(K key) {
        if (key != null) underlying.invalidate(key);
    }

    public long estimatedSize() {
        underlying.cleanUp();
        return underlying.estimatedSize();
    }

    @Override
    public void close() {
        underlying.invalidateAll();
        underlying.cleanUp();
    }
}
