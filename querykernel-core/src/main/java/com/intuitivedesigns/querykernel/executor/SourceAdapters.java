/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.executor;

import com.intuitivedesigns.querykernel.adapter.SourceAdapter;
import com.intuitivedesigns.querykernel.adapter.SourceAdapterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connected adapters keyed by source id. Owns their lifecycle.
 */
public final class SourceAdapters implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SourceAdapters.class);

    private final Map<String, SourceAdapter> bySource = new ConcurrentHashMap<>();

    /**
     * Connects and registers an adapter, closing any adapter it replaces.
     */
    public void register(String sourceId, SourceAdapter adapter) throws SourceAdapterException {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(adapter, "adapter");
        adapter.connect();
        SourceAdapter prev = bySource.put(sourceId, adapter);
        if (prev != null && prev != adapter) {
            safeClose(sourceId, prev);
        }
    }

    public Optional<SourceAdapter> get(String sourceId) {
        return Optional.ofNullable(bySource.get(sourceId));
    }

    public Set<String> sourceIds() {
        return Set.copyOf(bySource.keySet());
    }

    public boolean remove(String sourceId) {
        SourceAdapter a = bySource.remove(sourceId);
        if (a == null) return false;
        safeClose(sourceId, a);
        return true;
    }

    @Override
    public void close() {
        for (Map.Entry<String, SourceAdapter> e : bySource.entrySet()) {
            safeClose(e.getKey(), e.getValue());
        }
        bySource.clear();
    }

    private static void safeClose(String sourceId, SourceAdapter adapter) {
        try {
            adapter.close();
        } catch (Exception e) {
            log.warn("Error closing adapter for source '{}'", sourceId, e);
        }
    }
}
