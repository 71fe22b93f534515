/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.config;

import com.intuitivedesigns.querykernel.adapter.SourceAdapter;
import com.intuitivedesigns.querykernel.generation.QueryGenerator;
import com.intuitivedesigns.querykernel.metrics.MetricsRuntime;
import com.intuitivedesigns.querykernel.model.SourceDescriptor;
import com.intuitivedesigns.querykernel.spi.Cache;
import com.intuitivedesigns.querykernel.spi.CachePlugin;
import com.intuitivedesigns.querykernel.spi.KernelPlugin;
import com.intuitivedesigns.querykernel.spi.PluginCatalog;
import com.intuitivedesigns.querykernel.spi.QueryGeneratorPlugin;
import com.intuitivedesigns.querykernel.spi.SourceAdapterPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Creates kernel components from the plugins visible on the classpath.
 */
public final class KernelFactory {

    private static final Logger log = LoggerFactory.getLogger(KernelFactory.class);

    // Config keys
    public static final String KEY_GENERATOR_TYPE = "generator.type";
    public static final String KEY_CACHE_TYPE = "cache.type";

    // Defaults
    private static final String DEFAULT_GENERATOR = "LLM_HTTP";
    private static final String DEFAULT_CACHE = "NOOP";

    private static final PluginCatalog CATALOG = new PluginCatalog(resolveClassLoader());

    private KernelFactory() {}

    // --- FACTORY METHODS ---

    /**
     * @param sourceConfig keys under {@code sources.<id>.}, prefix stripped
     */
    public static SourceAdapter createAdapter(SourceDescriptor source, KernelConfig sourceConfig, MetricsRuntime metrics) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(sourceConfig, "sourceConfig");
        Objects.requireNonNull(metrics, "metrics");

        final String key = SourceCatalogLoader.PREFIX + source.id() + ".adapter";
        final SourceAdapterPlugin plugin = CATALOG.adapters().require(source.adapterType(), key);
        try {
            return plugin.create(source, sourceConfig, metrics);
        } catch (Throwable t) {
            throw new RuntimeException("Failed creating Source Adapter [" + plugin.id() + "] for source '" + source.id() + "'", t);
        }
    }

    public static QueryGenerator createGenerator(KernelConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final String id = normalizeId(config.getString(KEY_GENERATOR_TYPE, DEFAULT_GENERATOR), DEFAULT_GENERATOR);
        final QueryGeneratorPlugin plugin = CATALOG.generators().require(id, KEY_GENERATOR_TYPE);
        return createSafe(plugin, config, metrics, "Query Generator");
    }

    /**
     * Result cache keyed by source, contract version and payload fingerprint.
     */
    @SuppressWarnings("unchecked")
    public static Cache<String, List<Map<String, Object>>> createCache(KernelConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final String id = normalizeId(config.getString(KEY_CACHE_TYPE, DEFAULT_CACHE), DEFAULT_CACHE);
        final CachePlugin plugin = CATALOG.caches().require(id, KEY_CACHE_TYPE);
        return (Cache<String, List<Map<String, Object>>>) createSafe(plugin, config, metrics, "Cache");
    }

    // --- UTILITIES ---

    public static void logAvailablePlugins() {
        log.info("Plugin Catalog Loaded:");
        log.info("  Source adapters: {}", CATALOG.adapters().availableIds());
        log.info("  Generators:      {}", CATALOG.generators().availableIds());
        log.info("  Caches:          {}", CATALOG.caches().availableIds());
    }

    private static String normalizeId(String raw, String fallback) {
        if (raw == null) return fallback;
        final String s = raw.trim();
        return s.isEmpty() ? fallback : s;
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return (ctx != null) ? ctx : KernelFactory.class.getClassLoader();
    }

    private static <T> T createSafe(KernelPlugin<T> plugin,
                                    KernelConfig config,
                                    MetricsRuntime metrics,
                                    String typeName) {
        Objects.requireNonNull(plugin, "plugin");
        try {
            return plugin.create(config, metrics);
        } catch (Throwable t) {
            final String pluginId;
            try {
                pluginId = String.valueOf(plugin.id());
            } catch (Throwable ignored) {
                throw new RuntimeException("Failed creating " + typeName + " (plugin id unavailable)", t);
            }
            throw new RuntimeException("Failed creating " + typeName + " [" + pluginId + "]", t);
        }
    }
}
