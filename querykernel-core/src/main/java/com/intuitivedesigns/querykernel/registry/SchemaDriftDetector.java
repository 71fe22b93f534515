/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.registry;

import com.intuitivedesigns.querykernel.plan.ContractStamp;
import com.intuitivedesigns.querykernel.plan.FetchOperation;
import com.intuitivedesigns.querykernel.plan.Plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Compares the contract stamps recorded in plan metadata with the registry's current contracts.
 * Fetches without a recorded stamp are not checked.
 */
public final class SchemaDriftDetector {

    private final SchemaRegistry registry;

    public SchemaDriftDetector(SchemaRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public List<SchemaDrift> detect(Plan plan) {
        List<SchemaDrift> out = new ArrayList<>();
        for (FetchOperation fetch : plan.fetches()) {
            check(plan, fetch).ifPresent(out::add);
        }
        return out;
    }

    public Optional<SchemaDrift> check(Plan plan, FetchOperation fetch) {
        Optional<ContractStamp> planned = plan.metadata().contract(fetch.sourceId(), fetch.table());
        if (planned.isEmpty()) return Optional.empty();

        ContractStamp current = registry.listFields(fetch.sourceId(), fetch.table())
                .map(FieldContract::stamp)
                .orElse(null);
        if (planned.get().equals(current)) return Optional.empty();
        return Optional.of(new SchemaDrift(fetch.id(), fetch.sourceId(), fetch.table(), planned.get(), current));
    }
}
