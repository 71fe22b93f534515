/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.generation;

import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.SourceKind;

import java.util.List;
import java.util.Objects;

/**
 * Bounded schema summary of one source, handed to a {@link QueryGenerator}.
 *
 * @param truncated true when tables or fields were cut to stay inside the configured budget
 */
public record SchemaContext(String sourceId, SourceKind kind, String description, List<Table> tables, boolean truncated) {

    public SchemaContext {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(kind, "kind");
        description = (description == null) ? "" : description;
        tables = (tables == null) ? List.of() : List.copyOf(tables);
    }

    public record Table(String name, List<FieldSpec> fields, List<String> entities) {
        public Table {
            Objects.requireNonNull(name, "name");
            fields = (fields == null) ? List.of() : List.copyOf(fields);
            entities = (entities == null) ? List.of() : List.copyOf(entities);
        }
    }

    /**
     * Compact text form, one line per table: {@code orders(id:INTEGER key, total:FLOAT)}.
     */
    public String render() {
        StringBuilder sb = new StringBuilder(256);
        sb.append("source ").append(sourceId).append(" [").append(kind).append(']');
        if (!description.isEmpty()) sb.append(" - ").append(description);
        sb.append('\n');
        for (Table t : tables) {
            sb.append(t.name()).append('(');
            for (int i = 0; i < t.fields().size(); i++) {
                FieldSpec f = t.fields().get(i);
                if (i > 0) sb.append(", ");
                sb.append(f.name()).append(':').append(f.type());
                if (f.isKey()) sb.append(" key");
            }
            sb.append(')');
            if (!t.entities().isEmpty()) sb.append(" entities=").append(t.entities());
            sb.append('\n');
        }
        if (truncated) sb.append("...\n");
        return sb.toString();
    }
}
