/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.error;

import com.intuitivedesigns.querykernel.adapter.SourceAdapterException;

/**
 * Machine-readable failure category carried by every kernel exception and operation error.
 */
public enum ErrorKind {
    // planning
    NO_CANDIDATE_SOURCES,
    GENERATION_FAILED,
    VALIDATION_FAILED,
    INVALID_PLAN,

    // execution
    TIMEOUT,
    TRANSIENT,
    PERMISSION_DENIED,
    MALFORMED_QUERY,
    NOT_FOUND,
    CANCELLED,
    UPSTREAM_FAILED,
    ADAPTER_UNAVAILABLE,

    // aggregation
    UNSUPPORTED_COERCION,
    MISSING_KEY_FIELD,
    INCOMPLETE_RECORD,

    INTERNAL;

    public static ErrorKind from(SourceAdapterException.Reason reason) {
        if (reason == null) return INTERNAL;
        switch (reason) {
            case TIMEOUT: return TIMEOUT;
            case TRANSIENT: return TRANSIENT;
            case PERMISSION_DENIED: return PERMISSION_DENIED;
            case MALFORMED_QUERY: return MALFORMED_QUERY;
            case NOT_FOUND: return NOT_FOUND;
            case CANCELLED: return CANCELLED;
            default: return INTERNAL;
        }
    }
}
