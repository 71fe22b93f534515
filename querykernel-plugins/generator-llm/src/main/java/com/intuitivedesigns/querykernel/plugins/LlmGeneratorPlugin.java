/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plugins;

import com.intuitivedesigns.querykernel.config.KernelConfig;
import com.intuitivedesigns.querykernel.generation.QueryGenerator;
import com.intuitivedesigns.querykernel.generation.llm.LlmQueryGenerator;
import com.intuitivedesigns.querykernel.metrics.MetricsRuntime;
import com.intuitivedesigns.querykernel.spi.QueryGeneratorPlugin;

public final class LlmGeneratorPlugin implements QueryGeneratorPlugin {

    public static final String ID = "LLM_HTTP";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public QueryGenerator create(KernelConfig config, MetricsRuntime metrics) {
        return new LlmQueryGenerator(config, metrics);
    }
}
