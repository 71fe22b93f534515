/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plan;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Concatenates its inputs in declaration order.
 *
 * @param distinct             drop rows whose values equal an earlier row
 * @param tolerateFailedInputs run with the inputs that succeeded instead of being skipped;
 *                             at least one input must still succeed
 */
public record UnionOperation(
        String id,
        List<String> inputs,
        boolean distinct,
        boolean tolerateFailedInputs,
        String outputName
) implements Operation {

    public UnionOperation {
        id = OperationIds.require(id, "Operation id");
        if (inputs == null || inputs.size() < 2) {
            throw new IllegalArgumentException("Union '" + id + "' needs at least two inputs");
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String in : inputs) {
            if (!unique.add(OperationIds.require(in, "Input of '" + id + "'"))) {
                throw new IllegalArgumentException("Union '" + id + "' lists input '" + in + "' twice");
            }
        }
        inputs = List.copyOf(unique);
        outputName = OperationIds.outputOr(outputName, id);
    }

    @Override
    public OperationKind kind() {
        return OperationKind.UNION;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private final List<String> inputs = new ArrayList<>();
        private boolean distinct;
        private boolean tolerate;
        private String outputName;

        private Builder(String id) {
            this.id = id;
        }

        public Builder input(String inputId) {
            this.inputs.add(inputId);
            return this;
        }

        public Builder inputs(List<String> inputIds) {
            this.inputs.addAll(inputIds);
            return this;
        }

        public Builder distinct(boolean distinct) {
            this.distinct = distinct;
            return this;
        }

        public Builder tolerateFailedInputs(boolean tolerate) {
            this.tolerate = tolerate;
            return this;
        }

        public Builder output(String outputName) {
            this.outputName = outputName;
            return this;
        }

        public UnionOperation build() {
            return new UnionOperation(id, inputs, distinct, tolerate, outputName);
        }
    }
}
