/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.generation;

import java.util.List;
import java.util.Optional;

/**
 * Turns a question into an executable payload for one source.
 *
 * The only contract the kernel relies on: the returned payload is something the matching
 * adapter can execute, or a {@link GenerationException} is raised.
 */
public interface QueryGenerator extends AutoCloseable {

    GeneratedQuery generate(GenerationRequest request) throws GenerationException;

    /**
     * Optional summary step over the merged rows. Default: none.
     *
     * @param availableFields fields present in the merged output
     */
    default Optional<AggregateSpec> summarize(String question, List<String> availableFields) {
        return Optional.empty();
    }

    @Override
    default void close() {
        // no-op by default
    }
}
