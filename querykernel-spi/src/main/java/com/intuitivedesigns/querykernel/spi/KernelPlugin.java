/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.spi;

import com.intuitivedesigns.querykernel.config.KernelConfig;
import com.intuitivedesigns.querykernel.metrics.MetricsRuntime;

/**
 * A plugin that builds one component from global configuration.
 *
 * @param <T> component type produced
 */
public interface KernelPlugin<T> extends ServicePlugin {

    T create(KernelConfig config, MetricsRuntime metrics) throws Exception;
}
