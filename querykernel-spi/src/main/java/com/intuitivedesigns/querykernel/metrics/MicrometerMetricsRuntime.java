/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-backed runtime for the kernel's meters.
 *
 * <p>Meters are registered on a composite that always holds an in-memory
 * {@link SimpleMeterRegistry}, so planner, executor and adapter meters can be read back
 * through {@link #registry()}. Tagged calls (per source, per outcome) become distinct
 * meters under one name. Gauges hold the last pushed value.</p>
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final CompositeMeterRegistry registry;
    // raw double bits of the last value pushed per gauge name
    private final Map<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    public MicrometerMetricsRuntime() {
        this.registry = new CompositeMeterRegistry();
        this.registry.add(new SimpleMeterRegistry());
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return "MICROMETER";
    }

    @Override
    public void counter(String name) {
        registry.counter(name).increment();
    }

    @Override
    public void counter(String name, double increment) {
        if (increment > 0) {
            registry.counter(name).increment(increment);
        }
    }

    @Override
    public void counter(String name, Map<String, String> tags) {
        registry.counter(name, tags(tags)).increment();
    }

    @Override
    public void timer(String name, long durationMillis) {
        registry.timer(name).record(Math.max(0L, durationMillis), TimeUnit.MILLISECONDS);
    }

    @Override
    public void timer(String name, long durationMillis, Map<String, String> tags) {
        registry.timer(name, tags(tags)).record(Math.max(0L, durationMillis), TimeUnit.MILLISECONDS);
    }

    @Override
    public void gauge(String name, double value) {
        AtomicLong bits = gauges.computeIfAbsent(name, key -> {
            AtomicLong state = new AtomicLong(Double.doubleToLongBits(value));
            Gauge.builder(key, state, s -> Double.longBitsToDouble(s.get())).register(registry);
            return state;
        });
        bits.set(Double.doubleToLongBits(value));
    }

    @Override
    public void close() {
        registry.close();
        log.info("Metrics runtime closed ({} gauges).", gauges.size());
    }

    /**
     * Blank keys and values are dropped; Micrometer rejects them.
     */
    static Tags tags(Map<String, String> raw) {
        if (raw == null || raw.isEmpty()) return Tags.empty();
        List<Tag> out = new ArrayList<>(raw.size());
        raw.forEach((k, v) -> {
            if (k != null && !k.isBlank() && v != null && !v.isBlank()) out.add(Tag.of(k.trim(), v.trim()));
        });
        return Tags.of(out);
    }
}
