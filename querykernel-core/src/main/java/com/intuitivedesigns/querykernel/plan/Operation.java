/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plan;

import java.util.List;
import java.util.Optional;

/**
 * One vertex of a {@link Plan}. Implementations are immutable records that validate their own
 * shape on construction.
 */
public interface Operation {

    String id();

    OperationKind kind();

    /**
     * Ids of operations whose output this one consumes. Empty for fetches.
     */
    List<String> inputs();

    String outputName();

    /**
     * Source this operation dispatches to; empty for locally evaluated operations.
     */
    default Optional<String> targetSource() {
        return Optional.empty();
    }
}
