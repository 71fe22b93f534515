/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.querykernel.aggregate.ResultRow;
import com.intuitivedesigns.querykernel.core.QueryResponse;
import com.intuitivedesigns.querykernel.error.QueryError;
import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.SourceDescriptor;
import com.intuitivedesigns.querykernel.registry.SchemaRegistry;
import com.intuitivedesigns.querykernel.registry.TableRef;
import com.intuitivedesigns.querykernel.registry.Violation;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * JSON output for the command line.
 */
final class ResponseRenderer {

    private final ObjectMapper mapper;

    ResponseRenderer() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    String render(QueryResponse response) {
        ObjectNode root = mapper.createObjectNode();
        root.put("planId", response.planId());
        root.put("partial", response.partial());
        ArrayNode cols = root.putArray("columns");
        for (FieldSpec f : response.columns()) {
            cols.addObject().put("name", f.name()).put("type", f.type().name());
        }
        ArrayNode rows = root.putArray("rows");
        for (ResultRow r : response.rows()) {
            rows.add(mapper.valueToTree(r.values()));
        }
        response.warnings().forEach(root.putArray("warnings")::add);
        response.diagnostics().forEach(root.putArray("diagnostics")::add);
        return write(root);
    }

    String render(QueryError error) {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode e = root.putObject("error");
        e.put("operationId", error.operationId());
        e.put("kind", error.kind().name());
        e.put("message", error.message());
        ArrayNode vs = e.putArray("violations");
        for (Violation v : error.violations()) {
            vs.addObject()
                    .put("operationId", v.operationId())
                    .put("kind", v.kind().name())
                    .put("field", v.field())
                    .put("message", v.message());
        }
        return write(root);
    }

    /**
     * Lists sources with their tables. A non-blank {@code filter} keeps only the tables
     * {@link SchemaRegistry#searchTables} matches, and the sources owning them.
     */
    String renderSources(SchemaRegistry registry, String filter) {
        Set<TableRef> hits = (filter == null || filter.isBlank()) ? null : new HashSet<>(registry.searchTables(filter));
        ArrayNode root = mapper.createArrayNode();
        for (SourceDescriptor d : registry.listSources()) {
            List<String> names = new ArrayList<>();
            for (String t : registry.listTables(d.id())) {
                if (hits == null || hits.contains(new TableRef(d.id(), t))) names.add(t);
            }
            if (hits != null && names.isEmpty()) continue;
            ObjectNode s = root.addObject();
            s.put("id", d.id());
            s.put("kind", d.kind().name());
            s.put("adapter", d.adapterType());
            s.put("enabled", d.enabled());
            s.put("priority", d.priority());
            ArrayNode tables = s.putArray("tables");
            for (String t : names) {
                ObjectNode tn = tables.addObject();
                tn.put("name", t);
                registry.listFields(d.id(), t).ifPresent(c -> tn.put("version", c.version()));
            }
        }
        return write(root);
    }

    private String write(Object tree) {
        try {
            return mapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
