/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.registry;

import java.util.Objects;

/**
 * One contract problem found on one operation.
 *
 * @param field    offending field, or null when the problem is not field-specific
 * @param expected what the contract or counterpart side declares, if applicable
 * @param actual   what the operation declares, if applicable
 */
public record Violation(String operationId, ViolationKind kind, String field, String expected, String actual, String message) {

    public Violation {
        Objects.requireNonNull(operationId, "operationId");
        Objects.requireNonNull(kind, "kind");
        message = (message == null) ? kind.name() : message;
    }

    public static Violation of(String operationId, ViolationKind kind, String message) {
        return new Violation(operationId, kind, null, null, null, message);
    }
}
