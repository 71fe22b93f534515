/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.adapter;

import com.intuitivedesigns.querykernel.model.QueryPayload;
import com.intuitivedesigns.querykernel.model.TableSchema;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Uniform access to one backing data store.
 *
 * <p>Implementations must be safe for concurrent {@link #execute} calls once connected,
 * and must respond to thread interruption by aborting the in-flight call (or at least by
 * not blocking past {@code timeout}).</p>
 */
public interface SourceAdapter extends AutoCloseable {

    /**
     * Opens pools / clients. Idempotent.
     */
    void connect() throws SourceAdapterException;

    /**
     * Reads the current table/collection layout of the source.
     */
    List<TableSchema> introspect() throws SourceAdapterException;

    /**
     * Runs one query payload and returns raw rows keyed by field name.
     *
     * @throws SourceAdapterException classified as retryable or fatal
     */
    List<Map<String, Object>> execute(QueryPayload payload, Duration timeout) throws SourceAdapterException;

    @Override
    default void close() {
        // no-op by default
    }
}
