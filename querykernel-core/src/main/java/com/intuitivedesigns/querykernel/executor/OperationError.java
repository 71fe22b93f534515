/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.executor;

import com.intuitivedesigns.querykernel.error.ErrorKind;

import java.util.Objects;

/**
 * @param retryable whether the last failure was classified retryable (attempts may have run out)
 */
public record OperationError(ErrorKind kind, String message, boolean retryable) {

    public OperationError {
        Objects.requireNonNull(kind, "kind");
        message = (message == null) ? kind.name() : message;
    }

    public static OperationError of(ErrorKind kind, String message) {
        return new OperationError(kind, message, false);
    }
}
