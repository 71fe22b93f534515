/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.metrics;

/**
 * Service Provider Interface for metrics backends.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and registered in
 * {@code META-INF/services/com.intuitivedesigns.querykernel.metrics.MetricsProvider}.
 */
public interface MetricsProvider {

    /**
     * Identifier matched against {@code metrics.provider} (e.g. "MICROMETER").
     */
    String id();

    /**
     * @return a runtime if this provider is selected, or {@code null} to be skipped.
     */
    MetricsRuntime create(MetricsSettings settings);

    default boolean matches(String configuredId) {
        return configuredId != null && id().equalsIgnoreCase(configuredId.trim());
    }
}
