/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.spi;

/**
 * All plugins visible to one class loader, grouped by kind.
 */
public final class PluginCatalog {

    private final ServicePluginRegistry<SourceAdapterPlugin> adapters;
    private final ServicePluginRegistry<QueryGeneratorPlugin> generators;
    private final ServicePluginRegistry<CachePlugin> caches;

    public PluginCatalog(ClassLoader cl) {
        this.adapters = new ServicePluginRegistry<>(SourceAdapterPlugin.class, cl);
        this.generators = new ServicePluginRegistry<>(QueryGeneratorPlugin.class, cl);
        this.caches = new ServicePluginRegistry<>(CachePlugin.class, cl);
    }

    public ServicePluginRegistry<SourceAdapterPlugin> adapters() {
        return adapters;
    }

    public ServicePluginRegistry<QueryGeneratorPlugin> generators() {
        return generators;
    }

    public ServicePluginRegistry<CachePlugin> caches() {
        return caches;
    }
}
