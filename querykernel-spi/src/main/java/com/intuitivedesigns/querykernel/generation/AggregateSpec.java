/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.generation;

import com.intuitivedesigns.querykernel.model.AggregateTerm;

import java.util.List;

/**
 * Summary step requested on top of the merged rows.
 */
public record AggregateSpec(List<String> groupBy, List<AggregateTerm> terms) {

    public AggregateSpec {
        groupBy = (groupBy == null) ? List.of() : List.copyOf(groupBy);
        terms = (terms == null) ? List.of() : List.copyOf(terms);
        if (terms.isEmpty()) {
            throw new IllegalArgumentException("AggregateSpec needs at least one term");
        }
    }
}
