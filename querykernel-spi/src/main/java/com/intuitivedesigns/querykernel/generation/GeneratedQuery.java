/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.generation;

import com.intuitivedesigns.querykernel.model.QueryPayload;

import java.util.List;
import java.util.Objects;

/**
 * Draft fetch produced by a generator. Untrusted until the planner validates it.
 *
 * @param table  target table, collection or topic
 * @param fields fields the payload is expected to return; empty means "all contract fields"
 */
public record GeneratedQuery(String table, List<String> fields, QueryPayload payload) {

    public GeneratedQuery {
        Objects.requireNonNull(payload, "payload");
        fields = (fields == null) ? List.of() : List.copyOf(fields);
    }
}
