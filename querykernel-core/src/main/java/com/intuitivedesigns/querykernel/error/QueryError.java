/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.error;

import com.intuitivedesigns.querykernel.registry.Violation;

import java.util.List;

/**
 * What a failed run reports back to the caller.
 *
 * @param operationId failing operation, or null when the failure precedes any plan
 * @param violations  field/type mismatches behind a validation failure; empty otherwise
 */
public record QueryError(String operationId, ErrorKind kind, String message, List<Violation> violations) {

    public QueryError {
        violations = (violations == null) ? List.of() : List.copyOf(violations);
    }
}
