/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plugins;

import com.intuitivedesigns.querykernel.cache.CaffeineResultCache;
import com.intuitivedesigns.querykernel.config.KernelConfig;
import com.intuitivedesigns.querykernel.metrics.MetricsRuntime;
import com.intuitivedesigns.querykernel.spi.Cache;
import com.intuitivedesigns.querykernel.spi.CachePlugin;
import com.intuitivedesigns.querykernel.spi.PluginKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

public final class LocalCachePlugin implements CachePlugin {

    public static final String ID = "LOCAL_CAFFEINE";
    private static final Logger log = LoggerFactory.getLogger(LocalCachePlugin.class);

    // Config keys
    public static final String KEY_MAX_SIZE = "cache.local.max.size";
    public static final String KEY_TTL_SECONDS = "cache.local.ttl.seconds";

    // Defaults
    private static final long DEFAULT_MAX_SIZE = 10_000;
    private static final long DEFAULT_TTL_SECONDS = 300;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public PluginKind kind() {
        return PluginKind.CACHE;
    }

    @Override
    public Cache<?, ?> create(KernelConfig config, MetricsRuntime metrics) {
        long maxSize = clamp(config.getLong(KEY_MAX_SIZE, DEFAULT_MAX_SIZE), 1, 10_000_000);
        long ttlSec = clamp(config.getLong(KEY_TTL_SECONDS, DEFAULT_TTL_SECONDS), 1, 86_400);

        log.info("Creating Local Cache (Size={}, TTL={}s)", maxSize, ttlSec);
        return new CaffeineResultCache<>(maxSize, Duration.ofSeconds(ttlSec), metrics);
    }

    private static long clamp(long v, long min, long max) {
        return Math.max(min, Math.min(max, v));
    }
}
