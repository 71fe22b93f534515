/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.querykernel.model.FieldRole;
import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.SemanticType;
import com.intuitivedesigns.querykernel.model.SourceDescriptor;
import com.intuitivedesigns.querykernel.model.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Persists registry snapshots as a single JSON document.
 *
 * <p>Writes go to a sibling temp file that is then moved over the target, so a crash
 * never leaves a half-written snapshot behind.</p>
 */
public final class RegistrySnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(RegistrySnapshotStore.class);
    private static final int FORMAT_VERSION = 1;

    private final Path path;
    private final ObjectMapper mapper;

    public RegistrySnapshotStore(Path path) {
        this.path = Objects.requireNonNull(path, "path");
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path path() {
        return path;
    }

    public void save(InMemorySchemaRegistry registry) throws IOException {
        RegistrySnapshot snap = registry.snapshot();
        ObjectNode root = mapper.createObjectNode();
        root.put("formatVersion", FORMAT_VERSION);

        ArrayNode sources = root.putArray("sources");
        for (SourceDescriptor d : snap.sources()) {
            ObjectNode n = sources.addObject();
            n.put("id", d.id());
            n.put("connectionRef", d.connectionRef());
            n.put("kind", d.kind().name());
            n.put("adapterType", d.adapterType());
            n.put("priority", d.priority());
            n.put("enabled", d.enabled());
            n.put("description", d.description());
        }

        ArrayNode contracts = root.putArray("contracts");
        for (FieldContract c : snap.contracts()) {
            ObjectNode n = contracts.addObject();
            n.put("source", c.sourceId());
            n.put("table", c.table());
            n.put("version", c.version());
            n.put("hash", c.contentHash());
            n.put("updatedAt", c.updatedAt().toString());
            ArrayNode fields = n.putArray("fields");
            for (FieldSpec f : c.fields()) {
                ObjectNode fn = fields.addObject();
                fn.put("name", f.name());
                fn.put("type", f.type().name());
                fn.put("nullable", f.nullable());
                fn.put("role", f.role().name());
            }
        }

        ObjectNode ontology = root.putObject("ontology");
        snap.ontology().forEach((entity, keys) -> {
            ArrayNode arr = ontology.putArray(entity);
            keys.forEach(arr::add);
        });

        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        mapper.writeValue(tmp.toFile(), root);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.info("Saved registry snapshot to {} ({} sources, {} contracts)", path, snap.sources().size(), snap.contracts().size());
    }

    /**
     * Loads the snapshot, or returns an empty registry when the file does not exist.
     */
    public InMemorySchemaRegistry load(Clock clock) throws IOException {
        if (!Files.exists(path)) {
            log.info("No registry snapshot at {}; starting empty", path);
            return new InMemorySchemaRegistry(clock);
        }
        JsonNode root = mapper.readTree(path.toFile());
        if (root == null || !root.isObject()) {
            throw new IOException("Registry snapshot is not a JSON object: " + path);
        }
        int format = root.path("formatVersion").asInt(-1);
        if (format != FORMAT_VERSION) {
            throw new IOException("Unsupported registry snapshot formatVersion " + format + " in " + path);
        }

        try {
            List<SourceDescriptor> sources = new ArrayList<>();
            for (JsonNode n : root.path("sources")) {
                sources.add(new SourceDescriptor(
                        text(n, "id"),
                        n.path("connectionRef").asText(""),
                        SourceKind.valueOf(text(n, "kind").toUpperCase(Locale.ROOT)),
                        n.path("adapterType").asText(null),
                        n.path("priority").asInt(100),
                        n.path("enabled").asBoolean(true),
                        n.path("description").asText("")));
            }

            List<FieldContract> contracts = new ArrayList<>();
            for (JsonNode n : root.path("contracts")) {
                List<FieldSpec> fields = new ArrayList<>();
                for (JsonNode f : n.path("fields")) {
                    fields.add(new FieldSpec(
                            text(f, "name"),
                            SemanticType.parse(text(f, "type")),
                            f.path("nullable").asBoolean(true),
                            FieldRole.valueOf(f.path("role").asText("VALUE").toUpperCase(Locale.ROOT))));
                }
                contracts.add(new FieldContract(
                        text(n, "source"),
                        text(n, "table"),
                        fields,
                        n.path("version").asLong(),
                        n.path("hash").asText(null),
                        Instant.parse(text(n, "updatedAt"))));
            }

            Map<String, List<String>> ontology = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = root.path("ontology").fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                List<String> keys = new ArrayList<>();
                for (JsonNode k : e.getValue()) keys.add(k.asText());
                ontology.put(e.getKey(), keys);
            }

            InMemorySchemaRegistry registry = InMemorySchemaRegistry.restore(new RegistrySnapshot(sources, contracts, ontology), clock);
            log.info("Loaded registry snapshot from {} ({} sources, {} contracts)", path, sources.size(), contracts.size());
            return registry;
        } catch (RuntimeException e) {
            throw new IOException("Malformed registry snapshot " + path + ": " + e.getMessage(), e);
        }
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) {
            throw new IllegalArgumentException("missing '" + field + "'");
        }
        return v.asText();
    }
}
