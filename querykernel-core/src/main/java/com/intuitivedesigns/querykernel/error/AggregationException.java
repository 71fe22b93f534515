/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.error;

/**
 * Always fatal: partial merges are never returned as complete.
 */
public class AggregationException extends QueryKernelException {

    private final String operationId;

    public AggregationException(ErrorKind kind, String message) {
        this(null, kind, message);
    }

    public AggregationException(String operationId, ErrorKind kind, String message) {
        super(kind, message, null);
        this.operationId = operationId;
    }

    public String operationId() {
        return operationId;
    }

    /**
     * Copy bound to the operation being evaluated, keeping the innermost binding.
     */
    public AggregationException at(String opId) {
        return (operationId != null) ? this : new AggregationException(opId, kind(), getMessage());
    }

    @Override
    public QueryError toError() {
        return new QueryError(operationId, kind(), getMessage(), null);
    }
}
