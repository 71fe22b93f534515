/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.error;

import com.intuitivedesigns.querykernel.registry.Violation;

import java.util.List;

/**
 * Per-operation contract violations. Raised by callers that require a valid plan
 * (e.g. replaying a stored plan); the planner handles violations itself.
 */
public class ValidationException extends QueryKernelException {

    private final List<Violation> violations;

    public ValidationException(List<Violation> violations) {
        super(ErrorKind.VALIDATION_FAILED, summarize(violations), null);
        this.violations = List.copyOf(violations);
    }

    public List<Violation> violations() {
        return violations;
    }

    @Override
    public QueryError toError() {
        String opId = violations.isEmpty() ? null : violations.get(0).operationId();
        return new QueryError(opId, kind(), getMessage(), violations);
    }

    private static String summarize(List<Violation> violations) {
        if (violations == null || violations.isEmpty()) return "Plan failed validation";
        return "Plan failed validation: " + violations.size() + " violation(s), first: " + violations.get(0).message();
    }
}
