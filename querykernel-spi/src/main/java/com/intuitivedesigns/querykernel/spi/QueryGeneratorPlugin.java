/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.spi;

import com.intuitivedesigns.querykernel.generation.QueryGenerator;

public interface QueryGeneratorPlugin extends KernelPlugin<QueryGenerator> {

    @Override
    default PluginKind kind() {
        return PluginKind.GENERATOR;
    }
}
