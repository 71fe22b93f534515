/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plan;

public enum OperationKind {
    /** Runs a payload against one source adapter. */
    FETCH,
    /** Hash join of two inputs, evaluated locally. */
    JOIN,
    /** Concatenation of two or more inputs, evaluated locally. */
    UNION,
    /** Group-by summary of one input, evaluated locally. */
    AGGREGATE;

    public boolean isLocal() {
        return this != FETCH;
    }
}
