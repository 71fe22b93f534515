/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process Micrometer runtime. Meters live in a {@link MicrometerMetricsRuntime}
 * composite, readable through {@link MetricsRuntime#registry()}.
 */
public final class MicrometerMetricsProvider implements MetricsProvider {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsProvider.class);

    @Override
    public String id() {
        return "MICROMETER";
    }

    @Override
    public MetricsRuntime create(MetricsSettings s) {
        if (s == null || !matches(s.providerId)) {
            return null;
        }

        final MicrometerMetricsRuntime runtime = new MicrometerMetricsRuntime();
        final MeterRegistry reg = runtime.registry();
        MetricsUtil.applyCommonTags(reg, s);

        if (s.jvmBinders) {
            new JvmMemoryMetrics().bindTo(reg);
            new JvmThreadMetrics().bindTo(reg);
            // JvmGcMetrics holds notification listeners; closed with the JVM
            new JvmGcMetrics().bindTo(reg);
            log.info("JVM binders registered");
        }

        log.info("Micrometer metrics active (tags={})", s.commonTags);
        return runtime;
    }
}
