/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.registry;

import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.SourceDescriptor;
import com.intuitivedesigns.querykernel.plan.FetchOperation;
import com.intuitivedesigns.querykernel.plan.Operation;
import com.intuitivedesigns.querykernel.plan.Plan;
import com.intuitivedesigns.querykernel.plan.ShapeResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-operation contract checks. Fetches are checked against the registry; local operations
 * are checked for key presence and type compatibility through {@link ShapeResolver}.
 */
final class PlanValidator {

    private final SchemaRegistry registry;

    PlanValidator(SchemaRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    ValidationReport validate(Plan plan) {
        List<Violation> out = new ArrayList<>();
        for (Operation op : plan.operations()) {
            if (op instanceof FetchOperation f) {
                checkFetch(f, out);
            }
        }
        out.addAll(ShapeResolver.resolve(plan).violations());
        return new ValidationReport(out);
    }

    private void checkFetch(FetchOperation f, List<Violation> out) {
        Optional<SourceDescriptor> source = registry.source(f.sourceId());
        if (source.isEmpty()) {
            out.add(new Violation(f.id(), ViolationKind.UNKNOWN_SOURCE, null, null, f.sourceId(),
                    "Source '" + f.sourceId() + "' is not registered"));
            return;
        }
        if (!source.get().enabled()) {
            out.add(new Violation(f.id(), ViolationKind.SOURCE_DISABLED, null, null, f.sourceId(),
                    "Source '" + f.sourceId() + "' is disabled"));
        }

        Optional<FieldContract> contract = registry.listFields(f.sourceId(), f.table());
        if (contract.isEmpty()) {
            out.add(new Violation(f.id(), ViolationKind.UNKNOWN_TABLE, null, null, f.table(),
                    "Table '" + f.table() + "' has no contract in source '" + f.sourceId() + "'"));
            return;
        }

        for (FieldSpec declared : f.fields()) {
            Optional<FieldSpec> actual = contract.get().field(declared.name());
            if (actual.isEmpty()) {
                out.add(new Violation(f.id(), ViolationKind.UNKNOWN_FIELD, declared.name(), null, declared.type().name(),
                        "Field '" + declared.name() + "' does not exist in " + f.sourceId() + "/" + f.table()));
            } else if (actual.get().type() != declared.type()) {
                out.add(new Violation(f.id(), ViolationKind.FIELD_TYPE_MISMATCH, declared.name(),
                        actual.get().type().name(), declared.type().name(),
                        "Field '" + declared.name() + "' is " + actual.get().type() + " in contract v"
                                + contract.get().version() + ", operation declares " + declared.type()));
            }
        }
    }
}
