/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.generation.llm;

import com.intuitivedesigns.querykernel.generation.GeneratedQuery;
import com.intuitivedesigns.querykernel.generation.SchemaContext;
import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.QueryPayload;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Payload shapes understood by each adapter type, plus a deterministic drafter that fills
 * them from the schema context alone.
 */
final class PayloadTemplates {

    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern WORD = Pattern.compile("[^a-z0-9_]+");

    private PayloadTemplates() {}

    /**
     * One-line description of the payload the adapter expects, used in prompts.
     */
    static String describe(String adapterType) {
        switch (normalize(adapterType)) {
            case "JDBC":
                return "{\"sql\": \"SELECT ... FROM <table> WHERE col = ?\", \"params\": [..], \"limit\": n}";
            case "MONGO":
                return "{\"collection\": \"<name>\", \"filter\": {..}, \"fields\": [..], \"sort\": {..}, \"limit\": n}"
                        + " or with \"vector\": [..] for similarity search";
            case "KAFKA":
                return "{\"topic\": \"<name>\", \"fromTimestamp\": epochMillis, \"toTimestamp\": epochMillis,"
                        + " \"where\": {..}, \"fields\": [..], \"limit\": n}";
            default:
                return "{\"table\": \"<name>\", \"where\": {..}, \"fields\": [..], \"orderBy\": \"<field>\", \"limit\": n}";
        }
    }

    /**
     * Picks the table the question mentions (first table otherwise) and selects all of its fields.
     *
     * @return null when the context has no tables
     */
    static GeneratedQuery draft(String question, SchemaContext context, String adapterType, long limit) {
        if (context.tables().isEmpty()) return null;
        SchemaContext.Table table = pickTable(question, context.tables());

        List<String> fields = new ArrayList<>(table.fields().size());
        for (FieldSpec f : table.fields()) fields.add(f.name());

        Map<String, Object> payload = new LinkedHashMap<>();
        switch (normalize(adapterType)) {
            case "JDBC":
                payload.put("sql", select(table.name(), fields));
                break;
            case "MONGO":
                payload.put("collection", table.name());
                if (!fields.isEmpty()) payload.put("fields", fields);
                break;
            case "KAFKA":
                payload.put("topic", table.name());
                break;
            default:
                payload.put("table", table.name());
                if (!fields.isEmpty()) payload.put("fields", fields);
                break;
        }
        if (limit > 0) payload.put("limit", limit);
        return new GeneratedQuery(table.name(), fields, QueryPayload.of(payload));
    }

    static SchemaContext.Table pickTable(String question, List<SchemaContext.Table> tables) {
        Set<String> tokens = tokens(question);
        for (SchemaContext.Table t : tables) {
            if (mentions(tokens, t.name())) return t;
        }
        for (SchemaContext.Table t : tables) {
            for (String entity : t.entities()) {
                if (mentions(tokens, entity)) return t;
            }
        }
        return tables.get(0);
    }

    static Set<String> tokens(String text) {
        Set<String> out = new LinkedHashSet<>();
        if (text == null) return out;
        for (String w : WORD.split(text.toLowerCase(Locale.ROOT))) {
            if (!w.isEmpty()) out.add(w);
        }
        return out;
    }

    static boolean mentions(Set<String> tokens, String name) {
        String n = name.toLowerCase(Locale.ROOT);
        int dot = n.lastIndexOf('.');
        if (dot >= 0) n = n.substring(dot + 1);
        return tokens.contains(n) || tokens.contains(n + "s") || (n.endsWith("s") && tokens.contains(n.substring(0, n.length() - 1)));
    }

    private static String select(String table, List<String> fields) {
        StringBuilder sb = new StringBuilder("SELECT ");
        if (fields.isEmpty()) {
            sb.append('*');
        } else {
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(quote(fields.get(i)));
            }
        }
        return sb.append(" FROM ").append(quote(table)).toString();
    }

    private static String quote(String identifier) {
        if (PLAIN_IDENTIFIER.matcher(identifier).matches()) return identifier;
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    private static String normalize(String adapterType) {
        return (adapterType == null) ? "" : adapterType.trim().toUpperCase(Locale.ROOT);
    }
}
