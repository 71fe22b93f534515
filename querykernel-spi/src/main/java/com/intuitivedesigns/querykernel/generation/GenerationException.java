/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.generation;

public class GenerationException extends Exception {

    private final String sourceId;

    public GenerationException(String sourceId, String message) {
        this(sourceId, message, null);
    }

    public GenerationException(String sourceId, String message, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
    }

    public String sourceId() {
        return sourceId;
    }
}
