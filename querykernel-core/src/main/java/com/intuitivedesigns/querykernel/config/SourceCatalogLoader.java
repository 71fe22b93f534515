/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.config;

import com.intuitivedesigns.querykernel.model.FieldRole;
import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.SemanticType;
import com.intuitivedesigns.querykernel.model.SourceDescriptor;
import com.intuitivedesigns.querykernel.model.SourceKind;
import com.intuitivedesigns.querykernel.registry.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads source declarations from configuration.
 *
 * <pre>
 * sources.crm.kind=RELATIONAL
 * sources.crm.adapter=JDBC
 * sources.crm.connection=jdbc:postgresql://db:5432/crm
 * sources.crm.priority=10
 * sources.crm.enabled=true
 * sources.crm.description=Customer master data
 * sources.crm.tables.customers.fields=customer_id:INTEGER:KEY,name:TEXT,signed_up:TIMESTAMP:TIMESTAMP
 * sources.crm.tables.customers.entities=customer,client
 * </pre>
 *
 * Declared tables are optional; sources without them rely on introspection. Any other key
 * under {@code sources.<id>.} is passed through to the adapter plugin.
 */
public final class SourceCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(SourceCatalogLoader.class);

    public static final String PREFIX = "sources.";

    private SourceCatalogLoader() {}

    /**
     * One configured source with its adapter settings and statically declared tables.
     */
    public record SourceEntry(SourceDescriptor descriptor,
                              KernelConfig adapterConfig,
                              Map<String, List<FieldSpec>> tables,
                              Map<String, List<String>> entities) {
    }

    public static List<SourceEntry> load(KernelConfig config) {
        Set<String> ids = new TreeSet<>();
        for (String key : config.keys()) {
            if (!key.startsWith(PREFIX)) continue;
            String rest = key.substring(PREFIX.length());
            int dot = rest.indexOf('.');
            if (dot > 0) ids.add(rest.substring(0, dot));
        }

        List<SourceEntry> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            KernelConfig sc = config.subset(PREFIX + id + ".");
            String rawKind = sc.getString("kind", null);
            if (rawKind == null || rawKind.isBlank()) {
                throw new IllegalArgumentException("Missing required configuration key: " + PREFIX + id + ".kind");
            }
            SourceKind kind;
            try {
                kind = SourceKind.valueOf(rawKind.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid " + PREFIX + id + ".kind='" + rawKind + "'", e);
            }

            SourceDescriptor d = new SourceDescriptor(
                    id,
                    sc.getString("connection", ""),
                    kind,
                    sc.getString("adapter", "MEMORY"),
                    sc.getInt("priority", 100),
                    sc.getBoolean("enabled", true),
                    sc.getString("description", ""));

            Map<String, List<FieldSpec>> tables = new LinkedHashMap<>();
            Map<String, List<String>> entities = new LinkedHashMap<>();
            KernelConfig tc = sc.subset("tables.");
            Set<String> tableNames = new TreeSet<>();
            for (String k : tc.keys()) {
                int dot = k.lastIndexOf('.');
                if (dot > 0) tableNames.add(k.substring(0, dot));
            }
            for (String table : tableNames) {
                String fields = tc.getString(table + ".fields", null);
                if (fields != null && !fields.isBlank()) {
                    tables.put(table, parseFields(id, table, fields));
                }
                String ents = tc.getString(table + ".entities", null);
                if (ents != null && !ents.isBlank()) {
                    entities.put(table, splitCsv(ents));
                }
            }

            out.add(new SourceEntry(d, sc, tables, entities));
        }
        log.info("Loaded {} source declaration(s): {}", out.size(), ids);
        return out;
    }

    /**
     * Registers each source, its declared tables and its entity mappings.
     */
    public static void register(SchemaRegistry registry, List<SourceEntry> entries) {
        for (SourceEntry e : entries) {
            registry.upsertSource(e.descriptor());
            e.tables().forEach((table, fields) -> registry.upsertFields(e.descriptor().id(), table, fields));
            e.entities().forEach((table, names) -> {
                for (String entity : names) registry.mapEntity(entity, e.descriptor().id(), table);
            });
        }
    }

    /**
     * Parses {@code name:TYPE[:ROLE]} items. KEY fields are non-nullable.
     */
    static List<FieldSpec> parseFields(String sourceId, String table, String raw) {
        List<FieldSpec> out = new ArrayList<>();
        for (String item : splitCsv(raw)) {
            String[] parts = item.split(":");
            if (parts.length < 2 || parts.length > 3) {
                throw new IllegalArgumentException("Bad field declaration '" + item + "' in " + sourceId + "/" + table
                        + "; expected name:TYPE[:ROLE]");
            }
            SemanticType type = SemanticType.parse(parts[1]);
            FieldRole role = (parts.length == 3) ? FieldRole.valueOf(parts[2].trim().toUpperCase(Locale.ROOT)) : FieldRole.VALUE;
            out.add(new FieldSpec(parts[0], type, role != FieldRole.KEY, role));
        }
        return out;
    }

    private static List<String> splitCsv(String raw) {
        List<String> out = new ArrayList<>();
        for (String s : raw.split(",")) {
            String t = s.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }
}
