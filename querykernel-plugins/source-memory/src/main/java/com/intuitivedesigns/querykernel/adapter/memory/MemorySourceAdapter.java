/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.adapter.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.querykernel.adapter.SourceAdapter;
import com.intuitivedesigns.querykernel.adapter.SourceAdapterException;
import com.intuitivedesigns.querykernel.model.FieldRole;
import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.QueryPayload;
import com.intuitivedesigns.querykernel.model.SemanticType;
import com.intuitivedesigns.querykernel.model.TableSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Serves tables held in memory, optionally loaded from a JSON fixture.
 *
 * <p>Fixture layout:</p>
 * <pre>
 * { "tables": { "customers": {
 *     "fields": [ { "name": "id", "type": "INTEGER", "role": "KEY" }, ... ],
 *     "rows":   [ { "id": 1, "name": "a" }, ... ] } } }
 * </pre>
 * Fields may be omitted; they are then inferred from the first row.
 *
 * <p>Payload keys: {@code table} (required), {@code where} (field to value equality map),
 * {@code fields} (projection), {@code orderBy}, {@code descending} and {@code limit}.</p>
 */
public final class MemorySourceAdapter implements SourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(MemorySourceAdapter.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String CLASSPATH_PREFIX = "classpath:";

    private final String sourceId;
    private final String fixture;
    private final Map<String, Table> tables = new LinkedHashMap<>();
    private final AtomicBoolean connected = new AtomicBoolean(false);

    private MemorySourceAdapter(String sourceId, String fixture) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
        this.fixture = (fixture == null) ? "" : fixture.trim();
    }

    public static MemorySourceAdapter fromFixture(String sourceId, String fixture) {
        return new MemorySourceAdapter(sourceId, fixture);
    }

    public static MemorySourceAdapter empty(String sourceId) {
        return new MemorySourceAdapter(sourceId, "");
    }

    /**
     * Adds or replaces a table. Null {@code fields} means "infer from the first row".
     */
    public synchronized MemorySourceAdapter table(String name, List<FieldSpec> fields, List<Map<String, Object>> rows) {
        List<Map<String, Object>> copy = new ArrayList<>();
        for (Map<String, Object> r : rows) copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(r)));
        List<FieldSpec> specs = (fields == null) ? infer(copy) : List.copyOf(fields);
        tables.put(name, new Table(specs, Collections.unmodifiableList(copy)));
        return this;
    }

    @Override
    public void connect() throws SourceAdapterException {
        if (!connected.compareAndSet(false, true)) return;
        if (fixture.isEmpty()) return;
        try (InputStream in = open(fixture)) {
            JsonNode root = MAPPER.readTree(in);
            JsonNode ts = root.path("tables");
            if (!ts.isObject()) {
                throw SourceAdapterException.fatal(SourceAdapterException.Reason.MALFORMED_QUERY,
                        "Fixture " + fixture + " has no 'tables' object");
            }
            Iterator<Map.Entry<String, JsonNode>> it = ts.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                table(e.getKey(), parseFields(e.getValue().path("fields")), parseRows(e.getValue().path("rows")));
            }
            log.info("Memory source '{}' loaded {} table(s) from {}", sourceId, tables.size(), fixture);
        } catch (IOException | IllegalArgumentException e) {
            connected.set(false);
            throw new SourceAdapterException(SourceAdapterException.Reason.NOT_FOUND, false,
                    "Cannot load fixture " + fixture + " for source '" + sourceId + "': " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized List<TableSchema> introspect() {
        List<TableSchema> out = new ArrayList<>(tables.size());
        tables.forEach((name, t) -> out.add(new TableSchema(name, t.fields)));
        return out;
    }

    @Override
    public List<Map<String, Object>> execute(QueryPayload payload, Duration timeout) throws SourceAdapterException {
        String name = payload.getString("table", null);
        if (name == null || name.isBlank()) {
            throw SourceAdapterException.fatal(SourceAdapterException.Reason.MALFORMED_QUERY, "Payload has no 'table'");
        }
        Table t;
        synchronized (this) {
            t = tables.get(name);
        }
        if (t == null) {
            throw SourceAdapterException.fatal(SourceAdapterException.Reason.NOT_FOUND,
                    "Table '" + name + "' not found in source '" + sourceId + "'");
        }

        Map<String, Object> where = payload.getMap("where");
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map<String, Object> row : t.rows) {
            if (matches(row, where)) rows.add(row);
        }

        String orderBy = payload.getString("orderBy", null);
        if (orderBy != null) {
            boolean descending = Boolean.parseBoolean(payload.getString("descending", "false"));
            Comparator<Map<String, Object>> cmp = (a, b) -> compareValues(a.get(orderBy), b.get(orderBy), descending);
            rows.sort(cmp);
        }

        long limit = payload.getLong("limit", -1L);
        if (limit >= 0 && rows.size() > limit) rows = rows.subList(0, (int) limit);

        List<Object> projection = payload.getList("fields");
        if (projection.isEmpty()) return new ArrayList<>(rows);

        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> p = new LinkedHashMap<>();
            for (Object f : projection) {
                String key = String.valueOf(f);
                if (row.containsKey(key)) p.put(key, row.get(key));
            }
            out.add(p);
        }
        return out;
    }

    private static boolean matches(Map<String, Object> row, Map<String, Object> where) {
        for (Map.Entry<String, Object> cond : where.entrySet()) {
            if (!sameValue(row.get(cond.getKey()), cond.getValue())) return false;
        }
        return true;
    }

    private static boolean sameValue(Object a, Object b) {
        if (a instanceof Number na && b instanceof Number nb) {
            return Double.compare(na.doubleValue(), nb.doubleValue()) == 0;
        }
        return Objects.equals(a, b);
    }

    // Nulls last in either direction; numbers numerically; everything else by string form.
    private static int compareValues(Object a, Object b, boolean descending) {
        if (a == null || b == null) {
            if (a == b) return 0;
            return (a == null) ? 1 : -1;
        }
        int c;
        if (a instanceof Number na && b instanceof Number nb) {
            c = Double.compare(na.doubleValue(), nb.doubleValue());
        } else {
            c = String.valueOf(a).compareTo(String.valueOf(b));
        }
        return descending ? -c : c;
    }

    private static InputStream open(String location) throws IOException {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String res = location.substring(CLASSPATH_PREFIX.length());
            if (res.startsWith("/")) res = res.substring(1);
            ClassLoader cl = Thread.currentThread().getContextClassLoader();
            if (cl == null) cl = MemorySourceAdapter.class.getClassLoader();
            InputStream in = cl.getResourceAsStream(res);
            if (in == null) throw new IOException("classpath resource not found: " + res);
            return in;
        }
        return Files.newInputStream(Path.of(location));
    }

    private static List<FieldSpec> parseFields(JsonNode node) {
        if (!node.isArray() || node.isEmpty()) return null;
        List<FieldSpec> out = new ArrayList<>();
        for (JsonNode f : node) {
            FieldRole role = FieldRole.valueOf(f.path("role").asText("VALUE").toUpperCase(Locale.ROOT));
            out.add(new FieldSpec(f.path("name").asText(),
                    SemanticType.parse(f.path("type").asText("TEXT")),
                    f.path("nullable").asBoolean(role != FieldRole.KEY),
                    role));
        }
        return out;
    }

    private static List<Map<String, Object>> parseRows(JsonNode node) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (JsonNode r : node) {
            Map<String, Object> row = MAPPER.convertValue(r, MAPPER.getTypeFactory().constructMapType(LinkedHashMap.class, String.class, Object.class));
            out.add(row);
        }
        return out;
    }

    private static List<FieldSpec> infer(List<Map<String, Object>> rows) {
        if (rows.isEmpty()) return List.of();
        List<FieldSpec> out = new ArrayList<>();
        for (Map.Entry<String, Object> e : rows.get(0).entrySet()) {
            out.add(FieldSpec.value(e.getKey(), SemanticType.infer(e.getValue())));
        }
        return out;
    }

    private static final class Table {
        final List<FieldSpec> fields;
        final List<Map<String, Object>> rows;

        Table(List<FieldSpec> fields, List<Map<String, Object>> rows) {
            this.fields = fields;
            this.rows = rows;
        }
    }
}
