/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.error;

import com.intuitivedesigns.querykernel.registry.Violation;

import java.util.List;

/**
 * No usable plan could be produced: no candidates, generation failure, or violations that
 * survived the repair pass.
 */
public class PlanningException extends QueryKernelException {

    private final List<String> diagnostics;
    private final List<Violation> violations;

    public PlanningException(ErrorKind kind, String message, List<String> diagnostics) {
        this(kind, message, diagnostics, List.of(), null);
    }

    public PlanningException(ErrorKind kind, String message, List<String> diagnostics,
                             List<Violation> violations, Throwable cause) {
        super(kind, message, cause);
        this.diagnostics = (diagnostics == null) ? List.of() : List.copyOf(diagnostics);
        this.violations = (violations == null) ? List.of() : List.copyOf(violations);
    }

    public List<String> diagnostics() {
        return diagnostics;
    }

    public List<Violation> violations() {
        return violations;
    }

    @Override
    public QueryError toError() {
        String opId = violations.isEmpty() ? null : violations.get(0).operationId();
        return new QueryError(opId, kind(), getMessage(), violations);
    }
}
