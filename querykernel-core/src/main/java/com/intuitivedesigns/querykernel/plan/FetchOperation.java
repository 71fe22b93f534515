/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plan;

import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.QueryPayload;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Reads rows from one source.
 *
 * @param fields fields the payload returns, with the types used to coerce raw values
 */
public record FetchOperation(
        String id,
        String sourceId,
        String table,
        QueryPayload payload,
        List<FieldSpec> fields,
        String outputName
) implements Operation {

    public FetchOperation {
        id = OperationIds.require(id, "Operation id");
        sourceId = OperationIds.requireText(sourceId, "Fetch source of '" + id + "'");
        table = OperationIds.requireText(table, "Fetch table of '" + id + "'");
        Objects.requireNonNull(payload, "payload");
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("Fetch '" + id + "' must declare at least one field");
        }
        Set<String> seen = new HashSet<>();
        for (FieldSpec f : fields) {
            Objects.requireNonNull(f, "field");
            if (!seen.add(f.name())) {
                throw new IllegalArgumentException("Fetch '" + id + "' declares field '" + f.name() + "' twice");
            }
        }
        fields = List.copyOf(fields);
        outputName = OperationIds.outputOr(outputName, id);
    }

    @Override
    public OperationKind kind() {
        return OperationKind.FETCH;
    }

    @Override
    public List<String> inputs() {
        return List.of();
    }

    @Override
    public Optional<String> targetSource() {
        return Optional.of(sourceId);
    }

    public Optional<FieldSpec> field(String name) {
        for (FieldSpec f : fields) {
            if (f.name().equals(name)) return Optional.of(f);
        }
        return Optional.empty();
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private String sourceId;
        private String table;
        private QueryPayload payload = QueryPayload.empty();
        private final List<FieldSpec> fields = new ArrayList<>();
        private String outputName;

        private Builder(String id) {
            this.id = id;
        }

        public Builder source(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder table(String table) {
            this.table = table;
            return this;
        }

        public Builder payload(QueryPayload payload) {
            this.payload = payload;
            return this;
        }

        public Builder field(FieldSpec field) {
            this.fields.add(field);
            return this;
        }

        public Builder fields(List<FieldSpec> fields) {
            this.fields.addAll(fields);
            return this;
        }

        public Builder output(String outputName) {
            this.outputName = outputName;
            return this;
        }

        public FetchOperation build() {
            return new FetchOperation(id, sourceId, table, payload, fields, outputName);
        }
    }
}
