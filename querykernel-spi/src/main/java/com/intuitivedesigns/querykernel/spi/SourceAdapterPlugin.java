/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.spi;

import com.intuitivedesigns.querykernel.adapter.SourceAdapter;
import com.intuitivedesigns.querykernel.config.KernelConfig;
import com.intuitivedesigns.querykernel.metrics.MetricsRuntime;
import com.intuitivedesigns.querykernel.model.SourceDescriptor;

/**
 * SPI factory for source adapters. One adapter instance is created per registered source.
 */
public interface SourceAdapterPlugin extends ServicePlugin {

    @Override
    default PluginKind kind() {
        return PluginKind.SOURCE_ADAPTER;
    }

    /**
     * @param sourceConfig keys under {@code sources.<id>.}, prefix stripped
     */
    SourceAdapter create(SourceDescriptor source, KernelConfig sourceConfig, MetricsRuntime metrics) throws Exception;
}
