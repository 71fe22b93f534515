/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.aggregate;

import com.intuitivedesigns.querykernel.model.FieldSpec;

import java.util.List;

/**
 * @param columns  output shape of the final operation
 * @param warnings run warnings carried over from the execution record
 */
public record AggregationResult(List<FieldSpec> columns, List<ResultRow> rows, List<String> warnings) {

    public AggregationResult {
        columns = (columns == null) ? List.of() : List.copyOf(columns);
        rows = (rows == null) ? List.of() : List.copyOf(rows);
        warnings = (warnings == null) ? List.of() : List.copyOf(warnings);
    }

    public int size() {
        return rows.size();
    }
}
