/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.generation;

import com.intuitivedesigns.querykernel.model.SourceDescriptor;

import java.util.List;
import java.util.Objects;

/**
 * @param feedback validation problems from a previous attempt; empty on the first attempt
 */
public record GenerationRequest(String question, SchemaContext context, SourceDescriptor source, List<String> feedback) {

    public GenerationRequest {
        Objects.requireNonNull(question, "question");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(source, "source");
        feedback = (feedback == null) ? List.of() : List.copyOf(feedback);
    }

    public boolean isRetry() {
        return !feedback.isEmpty();
    }
}
