/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.model;

import java.util.List;
import java.util.Objects;

/**
 * Introspection result for a single table, collection or topic.
 */
public record TableSchema(String table, List<FieldSpec> fields) {

    public TableSchema {
        Objects.requireNonNull(table, "table");
        fields = (fields == null) ? List.of() : List.copyOf(fields);
    }
}
