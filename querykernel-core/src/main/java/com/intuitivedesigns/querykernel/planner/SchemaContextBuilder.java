/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.planner;

import com.intuitivedesigns.querykernel.generation.SchemaContext;
import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.SourceDescriptor;
import com.intuitivedesigns.querykernel.registry.FieldContract;
import com.intuitivedesigns.querykernel.registry.SchemaRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the bounded schema summary handed to the generator.
 *
 * <p>Tables the question mentions (by name or mapped entity) come first, then the rest
 * alphabetically. Key fields are kept ahead of value fields when a table is cut down.</p>
 */
final class SchemaContextBuilder {

    private final SchemaRegistry registry;
    private final PlannerSettings settings;

    SchemaContextBuilder(SchemaRegistry registry, PlannerSettings settings) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    SchemaContext build(SourceDescriptor source, String question) {
        Set<String> tokens = KeywordSourceClassifier.tokenize(question);
        List<String> mentioned = new ArrayList<>();
        List<String> others = new ArrayList<>();
        for (String table : registry.listTables(source.id())) {
            if (isMentioned(source.id(), table, tokens)) mentioned.add(table);
            else others.add(table);
        }
        List<String> ordered = new ArrayList<>(mentioned);
        ordered.addAll(others);

        boolean truncated = ordered.size() > settings.maxTables();
        if (truncated) ordered = ordered.subList(0, settings.maxTables());

        List<SchemaContext.Table> tables = new ArrayList<>();
        for (String table : ordered) {
            Optional<FieldContract> contract = registry.listFields(source.id(), table);
            if (contract.isEmpty()) continue;
            List<FieldSpec> fields = contract.get().fields();
            if (fields.size() > settings.maxFieldsPerTable()) {
                fields = keysFirst(fields, settings.maxFieldsPerTable());
                truncated = true;
            }
            SchemaContext.Table t = new SchemaContext.Table(table, fields, registry.entitiesFor(source.id(), table));
            List<SchemaContext.Table> candidate = new ArrayList<>(tables);
            candidate.add(t);
            SchemaContext trial = new SchemaContext(source.id(), source.kind(), source.description(), candidate, truncated);
            if (!tables.isEmpty() && trial.render().length() > settings.maxContextChars()) {
                truncated = true;
                break;
            }
            tables.add(t);
        }
        return new SchemaContext(source.id(), source.kind(), source.description(), tables, truncated);
    }

    private boolean isMentioned(String sourceId, String table, Set<String> tokens) {
        if (KeywordSourceClassifier.mentions(tokens, table)) return true;
        for (String entity : registry.entitiesFor(sourceId, table)) {
            if (KeywordSourceClassifier.mentions(tokens, entity)) return true;
        }
        return false;
    }

    private static List<FieldSpec> keysFirst(List<FieldSpec> fields, int limit) {
        List<FieldSpec> out = new ArrayList<>(limit);
        for (FieldSpec f : fields) {
            if (out.size() < limit && f.isKey()) out.add(f);
        }
        for (FieldSpec f : fields) {
            if (out.size() < limit && !f.isKey()) out.add(f);
        }
        return out;
    }
}
