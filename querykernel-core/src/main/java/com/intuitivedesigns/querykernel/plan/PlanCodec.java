/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.querykernel.model.AggregateFunction;
import com.intuitivedesigns.querykernel.model.AggregateTerm;
import com.intuitivedesigns.querykernel.model.FieldRole;
import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.QueryPayload;
import com.intuitivedesigns.querykernel.model.SemanticType;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JSON form of a plan for audit and replay.
 *
 * <p>Preserves operation order, every kind-specific field, the final output and the contract
 * stamps recorded at creation time, so a replayed plan can be checked for schema drift.</p>
 */
public final class PlanCodec {

    public static final int FORMAT_VERSION = 1;

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public PlanCodec() {
        this(new ObjectMapper());
    }

    public PlanCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .enable(DeserializationFeature.USE_LONG_FOR_INTS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(Plan plan) {
        try {
            return mapper.writeValueAsString(toTree(plan));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize plan " + plan.id(), e);
        }
    }

    public Plan fromJson(String json) throws IOException {
        return fromTree(mapper.readTree(json));
    }

    public void write(Plan plan, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(file, toJson(plan), StandardCharsets.UTF_8);
    }

    public Plan read(Path file) throws IOException {
        return fromJson(Files.readString(file, StandardCharsets.UTF_8));
    }

    // --- encode ---

    public ObjectNode toTree(Plan plan) {
        ObjectNode root = mapper.createObjectNode();
        root.put("formatVersion", FORMAT_VERSION);
        root.put("id", plan.id());
        root.put("finalOutput", plan.finalOutput());

        ObjectNode meta = root.putObject("metadata");
        meta.put("question", plan.metadata().question());
        meta.put("createdAt", plan.metadata().createdAt().toString());
        ObjectNode contracts = meta.putObject("contracts");
        plan.metadata().contracts().forEach((key, stamp) -> {
            ObjectNode c = contracts.putObject(key);
            c.put("version", stamp.version());
            c.put("hash", stamp.hash());
        });

        ArrayNode ops = root.putArray("operations");
        for (Operation op : plan.operations()) {
            ops.add(encode(op));
        }
        return root;
    }

    private ObjectNode encode(Operation op) {
        ObjectNode n = mapper.createObjectNode();
        n.put("id", op.id());
        n.put("kind", op.kind().name());
        n.put("output", op.outputName());

        if (op instanceof FetchOperation f) {
            n.put("source", f.sourceId());
            n.put("table", f.table());
            n.set("payload", mapper.valueToTree(f.payload().values()));
            ArrayNode fields = n.putArray("fields");
            for (FieldSpec fs : f.fields()) {
                ObjectNode fn = fields.addObject();
                fn.put("name", fs.name());
                fn.put("type", fs.type().name());
                fn.put("nullable", fs.nullable());
                fn.put("role", fs.role().name());
            }
        } else if (op instanceof JoinOperation j) {
            n.put("left", j.leftInput());
            n.put("right", j.rightInput());
            n.put("leftKey", j.leftKey());
            n.put("rightKey", j.rightKey());
            n.put("mode", j.mode().name());
        } else if (op instanceof UnionOperation u) {
            ArrayNode inputs = n.putArray("inputs");
            u.inputs().forEach(inputs::add);
            n.put("distinct", u.distinct());
            n.put("tolerateFailedInputs", u.tolerateFailedInputs());
        } else if (op instanceof AggregateOperation a) {
            n.put("input", a.input());
            ArrayNode groupBy = n.putArray("groupBy");
            a.groupBy().forEach(groupBy::add);
            ArrayNode terms = n.putArray("terms");
            for (AggregateTerm t : a.terms()) {
                ObjectNode tn = terms.addObject();
                tn.put("function", t.function().name());
                if (t.field() != null) tn.put("field", t.field());
                tn.put("alias", t.alias());
            }
        } else {
            throw new IllegalArgumentException("Unsupported operation type: " + op.getClass().getName());
        }
        return n;
    }

    // --- decode ---

    public Plan fromTree(JsonNode root) throws IOException {
        if (root == null || !root.isObject()) {
            throw new IOException("Plan document must be a JSON object");
        }
        int version = root.path("formatVersion").asInt(FORMAT_VERSION);
        if (version != FORMAT_VERSION) {
            throw new IOException("Unsupported plan format version " + version);
        }

        try {
            Plan.Builder b = Plan.builder()
                    .id(text(root, "id"))
                    .finalOutput(text(root, "finalOutput"))
                    .metadata(decodeMetadata(root.path("metadata")));

            JsonNode ops = root.path("operations");
            if (!ops.isArray()) {
                throw new IOException("Plan document has no 'operations' array");
            }
            for (JsonNode n : ops) {
                b.add(decode(n));
            }
            return b.build();
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new IOException("Malformed plan document: " + e.getMessage(), e);
        }
    }

    private PlanMetadata decodeMetadata(JsonNode meta) {
        Map<String, ContractStamp> contracts = new LinkedHashMap<>();
        JsonNode cn = meta.path("contracts");
        Iterator<Map.Entry<String, JsonNode>> it = cn.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            contracts.put(e.getKey(), new ContractStamp(e.getValue().path("version").asLong(), e.getValue().path("hash").asText("")));
        }
        String createdAt = meta.path("createdAt").asText(null);
        return new PlanMetadata(
                meta.path("question").asText(""),
                createdAt == null ? null : Instant.parse(createdAt),
                contracts);
    }

    private Operation decode(JsonNode n) throws IOException {
        OperationKind kind = OperationKind.valueOf(text(n, "kind").toUpperCase(Locale.ROOT));
        String id = text(n, "id");
        String output = n.path("output").asText(null);

        switch (kind) {
            case FETCH: {
                List<FieldSpec> fields = new ArrayList<>();
                for (JsonNode fn : n.path("fields")) {
                    fields.add(new FieldSpec(
                            text(fn, "name"),
                            SemanticType.parse(text(fn, "type")),
                            fn.path("nullable").asBoolean(true),
                            FieldRole.valueOf(fn.path("role").asText(FieldRole.VALUE.name()))));
                }
                Map<String, Object> payload = n.hasNonNull("payload")
                        ? mapper.convertValue(n.get("payload"), MAP_TYPE)
                        : Map.of();
                return new FetchOperation(id, text(n, "source"), text(n, "table"), new QueryPayload(payload), fields, output);
            }
            case JOIN:
                return new JoinOperation(id, text(n, "left"), text(n, "right"),
                        text(n, "leftKey"), n.path("rightKey").asText(null),
                        JoinMode.valueOf(n.path("mode").asText(JoinMode.INNER.name())), output);
            case UNION: {
                List<String> inputs = new ArrayList<>();
                for (JsonNode in : n.path("inputs")) inputs.add(in.asText());
                return new UnionOperation(id, inputs,
                        n.path("distinct").asBoolean(false),
                        n.path("tolerateFailedInputs").asBoolean(false), output);
            }
            case AGGREGATE: {
                List<String> groupBy = new ArrayList<>();
                for (JsonNode g : n.path("groupBy")) groupBy.add(g.asText());
                List<AggregateTerm> terms = new ArrayList<>();
                for (JsonNode t : n.path("terms")) {
                    terms.add(new AggregateTerm(
                            AggregateFunction.valueOf(text(t, "function")),
                            t.path("field").asText(null),
                            t.path("alias").asText(null)));
                }
                return new AggregateOperation(id, text(n, "input"), groupBy, terms, output);
            }
            default:
                throw new IOException("Unsupported operation kind " + kind);
        }
    }

    private static String text(JsonNode n, String field) throws IOException {
        JsonNode v = n.get(field);
        if (v == null || v.isNull() || v.asText().isBlank()) {
            throw new IOException("Missing required field '" + field + "' in " + n);
        }
        return v.asText();
    }
}
