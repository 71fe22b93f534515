/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.spi;

public interface CachePlugin extends KernelPlugin<Cache<?, ?>> {

    @Override
    default PluginKind kind() {
        return PluginKind.CACHE;
    }
}
