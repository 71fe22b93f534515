/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel;

import com.intuitivedesigns.querykernel.metrics.MetricsRuntime;
import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.QueryPayload;
import com.intuitivedesigns.querykernel.model.SourceDescriptor;
import com.intuitivedesigns.querykernel.model.SourceKind;
import com.intuitivedesigns.querykernel.plan.FetchOperation;

import java.util.Arrays;
import java.util.Map;

/**
 * Shared builders for core tests.
 */
public final class TestPlans {

    private TestPlans() {}

    public static MetricsRuntime metrics() {
        return () -> null;
    }

    public static SourceDescriptor source(String id, SourceKind kind, int priority) {
        return new SourceDescriptor(id, "", kind, "MEMORY", priority, true, id + " test source");
    }

    public static FetchOperation fetch(String id, String sourceId, String table, FieldSpec... fields) {
        return FetchOperation.builder(id)
                .source(sourceId)
                .table(table)
                .payload(QueryPayload.of(Map.of("table", table)))
                .fields(Arrays.asList(fields))
                .build();
    }
}
