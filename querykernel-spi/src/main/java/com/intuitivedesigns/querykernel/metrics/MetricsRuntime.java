/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.metrics;

import java.util.Map;

/**
 * Vendor-agnostic instrumentation contract.
 *
 * The kernel records through this interface only, so it compiles and runs with no
 * metrics backend on the classpath (NOOP defaults).
 */
public interface MetricsRuntime extends AutoCloseable {

    /**
     * Returns the underlying registry (e.g. a Micrometer MeterRegistry) for advanced usage.
     */
    Object registry();

    default boolean enabled() { return false; }

    /**
     * @return implementation identifier, e.g. "MICROMETER" or "NOOP".
     */
    default String type() { return "NOOP"; }

    default void counter(String name) {}

    default void counter(String name, double increment) {}

    default void timer(String name, long durationMillis) {}

    /**
     * Tagged counter, e.g. {@code source=crm}. Runtimes without tag support count it untagged.
     */
    default void counter(String name, Map<String, String> tags) {
        counter(name);
    }

    default void timer(String name, long durationMillis, Map<String, String> tags) {
        timer(name, durationMillis);
    }

    default void gauge(String name, double value) {}

    @Override
    default void close() {
        // no-op by default
    }
}
