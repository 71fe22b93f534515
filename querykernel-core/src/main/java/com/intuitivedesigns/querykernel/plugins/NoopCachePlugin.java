/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plugins;

import com.intuitivedesigns.querykernel.config.KernelConfig;
import com.intuitivedesigns.querykernel.metrics.MetricsRuntime;
import com.intuitivedesigns.querykernel.spi.Cache;
import com.intuitivedesigns.querykernel.spi.CachePlugin;
import com.intuitivedesigns.querykernel.spi.PluginKind;

import java.util.Optional;

/**
 * Default result cache: remembers nothing, so every fetch reaches its source.
 */
public final class NoopCachePlugin implements CachePlugin {

    public static final String ID = "NOOP";

    @Override
    public String id() { return ID; }

    @Override
    public PluginKind kind() { return PluginKind.CACHE; }

    @Override
    public Cache<?, ?> create(KernelConfig config, MetricsRuntime metrics) {
        return new NoopCache<>();
    }

    private static final class NoopCache<K, V> implements Cache<K, V> {
        @Override
        public Optional<V> get(K key) { return Optional.empty(); }

        @Override
        public void put(K key, V value) { /* No-op */ }

        @Override
        public void invalidate(K key) { /* No-op */ }
    }
}
