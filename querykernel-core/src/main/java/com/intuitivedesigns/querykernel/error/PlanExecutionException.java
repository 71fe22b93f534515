/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.error;

import com.intuitivedesigns.querykernel.executor.ExecutionRecord;

/**
 * Terminal run failure: the final output (or an operation it requires) failed or was skipped.
 * Carries the partial record so completed sibling results remain inspectable.
 */
public class PlanExecutionException extends QueryKernelException {

    private final String operationId;
    private final String finalOutputId;
    private final transient ExecutionRecord record;

    /**
     * @param operationId   the operation whose failure ended the run
     * @param finalOutputId the plan's final output, which did not succeed
     */
    public PlanExecutionException(String operationId, String finalOutputId, ErrorKind kind, String message,
                                  ExecutionRecord record) {
        super(kind, message, null);
        this.operationId = operationId;
        this.finalOutputId = finalOutputId;
        this.record = record;
    }

    public String operationId() {
        return operationId;
    }

    public String finalOutputId() {
        return finalOutputId;
    }

    public ExecutionRecord record() {
        return record;
    }

    @Override
    public QueryError toError() {
        return new QueryError(operationId, kind(), getMessage(), null);
    }
}
