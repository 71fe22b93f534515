/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plugins;

import com.intuitivedesigns.querykernel.adapter.SourceAdapter;
import com.intuitivedesigns.querykernel.adapter.kafka.KafkaSourceAdapter;
import com.intuitivedesigns.querykernel.config.KernelConfig;
import com.intuitivedesigns.querykernel.metrics.MetricsRuntime;
import com.intuitivedesigns.querykernel.model.SourceDescriptor;
import com.intuitivedesigns.querykernel.spi.SourceAdapterPlugin;

/**
 * Message-log sources on Kafka. The connection is the bootstrap server list.
 */
public final class KafkaAdapterPlugin implements SourceAdapterPlugin {

    public static final String ID = "KAFKA";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public SourceAdapter create(SourceDescriptor source, KernelConfig sourceConfig, MetricsRuntime metrics) {
        return KafkaSourceAdapter.fromConfig(source.id(), source.connectionRef(), sourceConfig, metrics);
    }
}
