/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.registry;

import com.intuitivedesigns.querykernel.plan.ContractStamp;

import java.util.Objects;

/**
 * A contract that changed (or vanished) since a plan was built.
 *
 * @param current null when the contract no longer exists
 */
public record SchemaDrift(String operationId, String sourceId, String table, ContractStamp planned, ContractStamp current) {

    public SchemaDrift {
        Objects.requireNonNull(operationId, "operationId");
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(planned, "planned");
    }

    public String describe() {
        String now = (current == null) ? "removed" : "v" + current.version();
        return "Schema drift on " + sourceId + "/" + table + " for " + operationId
                + ": planned against v" + planned.version() + ", registry now " + now;
    }
}
