/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plan;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * @param contracts contract stamps keyed by {@link ContractStamp#key(String, String)}
 */
public record PlanMetadata(String question, Instant createdAt, Map<String, ContractStamp> contracts) {

    public PlanMetadata {
        question = (question == null) ? "" : question;
        if (createdAt == null) createdAt = Instant.now();
        contracts = (contracts == null) ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(contracts));
    }

    public static PlanMetadata of(String question) {
        return new PlanMetadata(question, Instant.now(), Map.of());
    }

    public Optional<ContractStamp> contract(String sourceId, String table) {
        return Optional.ofNullable(contracts.get(ContractStamp.key(sourceId, table)));
    }
}
