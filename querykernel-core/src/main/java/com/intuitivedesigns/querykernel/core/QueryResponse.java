/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.core;

import com.intuitivedesigns.querykernel.aggregate.ResultRow;
import com.intuitivedesigns.querykernel.model.FieldSpec;

import java.util.List;
import java.util.Objects;

/**
 * Answer to one question.
 *
 * @param warnings    partial-failure and schema-drift notes; a non-empty list means the rows may be incomplete
 * @param diagnostics planner notes (dropped sources, repairs)
 */
public record QueryResponse(String planId,
                            List<FieldSpec> columns,
                            List<ResultRow> rows,
                            List<String> warnings,
                            List<String> diagnostics) {

    public QueryResponse {
        Objects.requireNonNull(planId, "planId");
        columns = (columns == null) ? List.of() : List.copyOf(columns);
        rows = (rows == null) ? List.of() : List.copyOf(rows);
        warnings = (warnings == null) ? List.of() : List.copyOf(warnings);
        diagnostics = (diagnostics == null) ? List.of() : List.copyOf(diagnostics);
    }

    public boolean partial() {
        return !warnings.isEmpty();
    }
}
