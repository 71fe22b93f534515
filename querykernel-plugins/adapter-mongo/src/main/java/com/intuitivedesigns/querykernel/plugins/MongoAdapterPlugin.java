/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plugins;

import com.intuitivedesigns.querykernel.adapter.SourceAdapter;
import com.intuitivedesigns.querykernel.adapter.mongo.MongoSourceAdapter;
import com.intuitivedesigns.querykernel.config.KernelConfig;
import com.intuitivedesigns.querykernel.metrics.MetricsRuntime;
import com.intuitivedesigns.querykernel.model.SourceDescriptor;
import com.intuitivedesigns.querykernel.spi.SourceAdapterPlugin;

/**
 * Serves both DOCUMENT and VECTOR sources; the connection is a MongoDB URI.
 */
public final class MongoAdapterPlugin implements SourceAdapterPlugin {

    public static final String ID = "MONGO";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public SourceAdapter create(SourceDescriptor source, KernelConfig sourceConfig, MetricsRuntime metrics) {
        return MongoSourceAdapter.fromConfig(source.id(), source.kind(), source.connectionRef(), sourceConfig, metrics);
    }
}
