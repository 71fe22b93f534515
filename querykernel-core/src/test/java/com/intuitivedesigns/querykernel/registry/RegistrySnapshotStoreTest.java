/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.registry;

import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.SemanticType;
import com.intuitivedesigns.querykernel.model.SourceKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.intuitivedesigns.querykernel.TestPlans.source;
import static org.junit.jupiter.api.Assertions.*;

class RegistrySnapshotStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T00:00:00Z"), ZoneOffset.UTC);

    @Test
    void testSaveAndLoadPreservesVersionsAndOntology(@TempDir Path dir) throws IOException {
        InMemorySchemaRegistry original = new InMemorySchemaRegistry(CLOCK);
        original.upsertSource(source("crm", SourceKind.RELATIONAL, 10));
        original.upsertSource(source("shop", SourceKind.DOCUMENT, 20).withEnabled(false));
        original.upsertFields("crm", "customers", List.of(FieldSpec.key("customer_id", SemanticType.INTEGER)));
        original.upsertFields("crm", "customers", List.of(
                FieldSpec.key("customer_id", SemanticType.INTEGER),
                FieldSpec.value("name", SemanticType.TEXT)));
        original.mapEntity("customer", "crm", "customers");

        RegistrySnapshotStore store = new RegistrySnapshotStore(dir.resolve("state/registry.json"));
        store.save(original);
        InMemorySchemaRegistry restored = store.load(CLOCK);

        assertEquals(original.listSources(), restored.listSources());
        FieldContract contract = restored.listFields("crm", "customers").orElseThrow();
        assertEquals(original.listFields("crm", "customers").orElseThrow(), contract);
        assertEquals(2, contract.version());
        assertEquals(List.of(new TableRef("crm", "customers")), restored.tablesForEntity("customer"));
        assertFalse(Files.exists(dir.resolve("state/registry.json.tmp")));
    }

    @Test
    void testRestoredRegistryContinuesVersionSequence(@TempDir Path dir) throws IOException {
        InMemorySchemaRegistry original = new InMemorySchemaRegistry(CLOCK);
        original.upsertSource(source("crm", SourceKind.RELATIONAL, 10));
        original.upsertFields("crm", "customers", List.of(FieldSpec.key("id", SemanticType.INTEGER)));

        RegistrySnapshotStore store = new RegistrySnapshotStore(dir.resolve("registry.json"));
        store.save(original);
        InMemorySchemaRegistry restored = store.load(CLOCK);

        FieldContract next = restored.upsertFields("crm", "customers", List.of(FieldSpec.key("id", SemanticType.TEXT)));
        assertEquals(2, next.version());
    }

    @Test
    void testMissingFileGivesEmptyRegistry(@TempDir Path dir) throws IOException {
        InMemorySchemaRegistry r = new RegistrySnapshotStore(dir.resolve("absent.json")).load(CLOCK);
        assertTrue(r.listSources().isEmpty());
    }

    @Test
    void testRejectsUnknownFormat(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("registry.json");
        Files.writeString(file, "{\"formatVersion\": 7, \"sources\": []}");

        assertThrows(IOException.class, () -> new RegistrySnapshotStore(file).load(CLOCK));
    }

    @Test
    void testRejectsMalformedContent(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("registry.json");
        Files.writeString(file, "{\"formatVersion\": 1, \"sources\": [{\"id\": \"crm\", \"kind\": \"TAPE\"}]}");

        IOException e = assertThrows(IOException.class, () -> new RegistrySnapshotStore(file).load(CLOCK));
        assertTrue(e.getMessage().contains("Malformed"));
    }
}
