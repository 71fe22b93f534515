/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.error;

import java.util.Objects;

/**
 * Root of the kernel's unchecked exception hierarchy.
 */
public abstract class QueryKernelException extends RuntimeException {

    private final ErrorKind kind;

    protected QueryKernelException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Structured, user-facing form of this failure.
     */
    public abstract QueryError toError();
}
