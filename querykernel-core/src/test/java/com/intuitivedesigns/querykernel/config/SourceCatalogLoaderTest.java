/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.config;

import com.intuitivedesigns.querykernel.config.SourceCatalogLoader.SourceEntry;
import com.intuitivedesigns.querykernel.model.FieldRole;
import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.SemanticType;
import com.intuitivedesigns.querykernel.model.SourceKind;
import com.intuitivedesigns.querykernel.registry.InMemorySchemaRegistry;
import com.intuitivedesigns.querykernel.registry.TableRef;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SourceCatalogLoaderTest {

    private static final KernelConfig CONFIG = KernelConfig.of(Map.of(
            "sources.crm.kind", "relational",
            "sources.crm.adapter", "JDBC",
            "sources.crm.connection", "jdbc:postgresql://db:5432/crm",
            "sources.crm.priority", "10",
            "sources.crm.jdbc.pool.size", "4",
            "sources.crm.tables.customers.fields", "customer_id:INTEGER:KEY, name:TEXT, signed_up:TIMESTAMP:TIMESTAMP",
            "sources.crm.tables.customers.entities", "customer,client",
            "sources.tickets.kind", "MESSAGE_LOG",
            "sources.tickets.enabled", "false",
            "executor.max.parallelism", "4"));

    @Test
    void testLoadsDescriptorsAndTables() {
        List<SourceEntry> entries = SourceCatalogLoader.load(CONFIG);

        assertEquals(2, entries.size());
        SourceEntry crm = entries.get(0);
        assertEquals("crm", crm.descriptor().id());
        assertEquals(SourceKind.RELATIONAL, crm.descriptor().kind());
        assertEquals("JDBC", crm.descriptor().adapterType());
        assertEquals(10, crm.descriptor().priority());
        assertTrue(crm.descriptor().enabled());
        assertEquals("4", crm.adapterConfig().getString("jdbc.pool.size", null));

        List<FieldSpec> fields = crm.tables().get("customers");
        assertEquals(List.of("customer_id", "name", "signed_up"), fields.stream().map(FieldSpec::name).toList());
        assertEquals(FieldRole.KEY, fields.get(0).role());
        assertFalse(fields.get(0).nullable());
        assertEquals(FieldRole.VALUE, fields.get(1).role());
        assertEquals(SemanticType.TIMESTAMP, fields.get(2).type());
        assertEquals(List.of("customer", "client"), crm.entities().get("customers"));

        SourceEntry tickets = entries.get(1);
        assertFalse(tickets.descriptor().enabled());
        assertEquals("MEMORY", tickets.descriptor().adapterType());
        assertTrue(tickets.tables().isEmpty());
    }

    @Test
    void testRegisterPopulatesRegistry() {
        InMemorySchemaRegistry registry = new InMemorySchemaRegistry();

        SourceCatalogLoader.register(registry, SourceCatalogLoader.load(CONFIG));

        assertEquals(List.of("customers"), registry.listTables("crm"));
        assertEquals(1, registry.listFields("crm", "customers").orElseThrow().version());
        assertEquals(List.of(new TableRef("crm", "customers")), registry.tablesForEntity("client"));
        assertTrue(registry.source("tickets").isPresent());
    }

    @Test
    void testMissingKindIsRejected() {
        KernelConfig config = KernelConfig.of(Map.of("sources.crm.adapter", "JDBC"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> SourceCatalogLoader.load(config));
        assertTrue(e.getMessage().contains("sources.crm.kind"));
    }

    @Test
    void testUnknownKindIsRejected() {
        KernelConfig config = KernelConfig.of(Map.of("sources.crm.kind", "TAPE"));

        assertThrows(IllegalArgumentException.class, () -> SourceCatalogLoader.load(config));
    }

    @Test
    void testBadFieldDeclarationIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> SourceCatalogLoader.parseFields("crm", "customers", "customer_id"));
        assertThrows(IllegalArgumentException.class,
                () -> SourceCatalogLoader.parseFields("crm", "customers", "customer_id:MONEY"));
    }
}
