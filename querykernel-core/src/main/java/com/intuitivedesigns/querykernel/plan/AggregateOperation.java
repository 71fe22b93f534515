/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plan;

import com.intuitivedesigns.querykernel.model.AggregateTerm;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public record AggregateOperation(
        String id,
        String input,
        List<String> groupBy,
        List<AggregateTerm> terms,
        String outputName
) implements Operation {

    public AggregateOperation {
        id = OperationIds.require(id, "Operation id");
        input = OperationIds.require(input, "Input of '" + id + "'");
        groupBy = (groupBy == null) ? List.of() : List.copyOf(groupBy);
        if (terms == null || terms.isEmpty()) {
            throw new IllegalArgumentException("Aggregate '" + id + "' needs at least one term");
        }
        terms = List.copyOf(terms);
        Set<String> names = new HashSet<>(groupBy);
        for (AggregateTerm t : terms) {
            if (!names.add(t.alias())) {
                throw new IllegalArgumentException("Aggregate '" + id + "' produces column '" + t.alias() + "' twice");
            }
        }
        outputName = OperationIds.outputOr(outputName, id);
    }

    @Override
    public OperationKind kind() {
        return OperationKind.AGGREGATE;
    }

    @Override
    public List<String> inputs() {
        return List.of(input);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private String input;
        private final List<String> groupBy = new ArrayList<>();
        private final List<AggregateTerm> terms = new ArrayList<>();
        private String outputName;

        private Builder(String id) {
            this.id = id;
        }

        public Builder input(String inputId) {
            this.input = inputId;
            return this;
        }

        public Builder groupBy(String field) {
            this.groupBy.add(field);
            return this;
        }

        public Builder groupBy(List<String> fields) {
            this.groupBy.addAll(fields);
            return this;
        }

        public Builder term(AggregateTerm term) {
            this.terms.add(term);
            return this;
        }

        public Builder terms(List<AggregateTerm> terms) {
            this.terms.addAll(terms);
            return this;
        }

        public Builder output(String outputName) {
            this.outputName = outputName;
            return this;
        }

        public AggregateOperation build() {
            return new AggregateOperation(id, input, groupBy, terms, outputName);
        }
    }
}
