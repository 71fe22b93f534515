/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.metrics;

public final class NoopMetricsProvider implements MetricsProvider {

    @Override
    public String id() {
        return "NOOP";
    }

    @Override
    public MetricsRuntime create(MetricsSettings s) {
        // Only activates on metrics.provider=NOOP so other providers are not hijacked
        if (s == null || !matches(s.providerId)) {
            return null;
        }
        return NoopMetricsRuntime.INSTANCE;
    }

    private static final class NoopMetricsRuntime implements MetricsRuntime {
        static final NoopMetricsRuntime INSTANCE = new NoopMetricsRuntime();

        private final Object sentinelRegistry = new Object();

        @Override
        public Object registry() {
            return sentinelRegistry;
        }
    }
}
