/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.spi;

public interface ServicePlugin {
    /**
     * @return The unique ID of this plugin implementation (e.g., 'JDBC', 'NOOP').
     */
    String id();

    /**
     * @return The kind of plugin (SOURCE_ADAPTER, GENERATOR, CACHE).
     */
    PluginKind kind();
}
