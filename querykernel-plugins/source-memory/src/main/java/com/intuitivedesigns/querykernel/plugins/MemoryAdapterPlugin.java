/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plugins;

import com.intuitivedesigns.querykernel.adapter.SourceAdapter;
import com.intuitivedesigns.querykernel.adapter.memory.MemorySourceAdapter;
import com.intuitivedesigns.querykernel.config.KernelConfig;
import com.intuitivedesigns.querykernel.metrics.MetricsRuntime;
import com.intuitivedesigns.querykernel.model.SourceDescriptor;
import com.intuitivedesigns.querykernel.spi.SourceAdapterPlugin;

import java.util.Objects;

/**
 * In-memory tables loaded from the JSON fixture named by the source's connection
 * ({@code classpath:} or file path).
 */
public final class MemoryAdapterPlugin implements SourceAdapterPlugin {

    public static final String ID = "MEMORY";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public SourceAdapter create(SourceDescriptor source, KernelConfig sourceConfig, MetricsRuntime metrics) {
        Objects.requireNonNull(source, "source");
        String fixture = sourceConfig.getString("fixture", source.connectionRef());
        return MemorySourceAdapter.fromFixture(source.id(), fixture);
    }
}
