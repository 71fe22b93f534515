/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsRuntimeTest {

    @Test
    void testTaggedMetersAreSeparatePerTag() {
        try (MicrometerMetricsRuntime runtime = new MicrometerMetricsRuntime()) {
            runtime.counter("qk.executor.failed", Map.of("source", "crm", "kind", "TIMEOUT"));
            runtime.counter("qk.executor.failed", Map.of("source", "crm", "kind", "TIMEOUT"));
            runtime.counter("qk.executor.failed", Map.of("source", "shop", "kind", "NOT_FOUND"));
            runtime.timer("qk.executor.op.latency", 40, Map.of("source", "crm", "outcome", "ok"));

            MeterRegistry reg = runtime.registry();
            assertEquals(2.0, reg.get("qk.executor.failed").tag("source", "crm").counter().count());
            assertEquals(1.0, reg.get("qk.executor.failed").tag("source", "shop").counter().count());
            assertEquals(40.0, reg.get("qk.executor.op.latency").tag("outcome", "ok").timer().totalTime(TimeUnit.MILLISECONDS));
        }
    }

    @Test
    void testGaugeKeepsLastValue() {
        try (MicrometerMetricsRuntime runtime = new MicrometerMetricsRuntime()) {
            runtime.gauge("qk.executor.inflight", 3);
            runtime.gauge("qk.executor.inflight", 1);

            assertEquals(1.0, runtime.registry().get("qk.executor.inflight").gauge().value());
        }
    }

    @Test
    void testNegativeDurationsAndIncrementsAreIgnored() {
        try (MicrometerMetricsRuntime runtime = new MicrometerMetricsRuntime()) {
            runtime.timer("qk.planner.latency", -5);
            runtime.counter("qk.adapter.kafka.read", 0);
            runtime.counter("qk.adapter.kafka.read", 4);

            assertEquals(0.0, runtime.registry().get("qk.planner.latency").timer().totalTime(TimeUnit.MILLISECONDS));
            assertEquals(1, runtime.registry().get("qk.planner.latency").timer().count());
            assertEquals(4.0, runtime.registry().get("qk.adapter.kafka.read").counter().count());
        }
    }

    @Test
    void testBlankTagsAreDropped() {
        Map<String, String> raw = new HashMap<>();
        raw.put("source", "crm");
        raw.put("kind", " ");
        raw.put(" ", "x");
        raw.put("outcome", null);

        assertEquals(1, MicrometerMetricsRuntime.tags(raw).stream().count());
        assertEquals(0, MicrometerMetricsRuntime.tags(null).stream().count());
    }

    @Test
    void testUntaggedRuntimeFoldsTagsIntoPlainMeters() {
        Map<String, Double> counts = new HashMap<>();
        MetricsRuntime plain = new MetricsRuntime() {
            @Override
            public Object registry() {
                return null;
            }

            @Override
            public void counter(String name) {
                counts.merge(name, 1.0, Double::sum);
            }
        };

        plain.counter("qk.executor.failed", Map.of("source", "crm"));

        assertEquals(1.0, counts.get("qk.executor.failed"));
    }
}
