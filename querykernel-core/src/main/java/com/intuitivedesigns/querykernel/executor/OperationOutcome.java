/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.executor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of one operation's execution state.
 *
 * @param rows     raw adapter rows for succeeded fetches; empty for everything else
 * @param error    null unless {@code status == FAILED}
 * @param attempts adapter calls made, 0 for local operations and cache hits
 */
public record OperationOutcome(
        String operationId,
        OperationStatus status,
        List<Map<String, Object>> rows,
        OperationError error,
        int attempts,
        Instant startedAt,
        Instant finishedAt,
        List<String> warnings
) {

    public OperationOutcome {
        rows = (rows == null) ? List.of() : rows;
        warnings = (warnings == null) ? List.of() : List.copyOf(warnings);
    }

    public boolean succeeded() {
        return status == OperationStatus.SUCCEEDED;
    }
}
