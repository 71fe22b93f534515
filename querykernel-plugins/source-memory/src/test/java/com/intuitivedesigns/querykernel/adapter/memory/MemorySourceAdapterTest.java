/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.adapter.memory;

import com.intuitivedesigns.querykernel.adapter.SourceAdapter;
import com.intuitivedesigns.querykernel.adapter.SourceAdapterException;
import com.intuitivedesigns.querykernel.config.KernelConfig;
import com.intuitivedesigns.querykernel.model.FieldRole;
import com.intuitivedesigns.querykernel.model.QueryPayload;
import com.intuitivedesigns.querykernel.model.SemanticType;
import com.intuitivedesigns.querykernel.model.SourceDescriptor;
import com.intuitivedesigns.querykernel.model.SourceKind;
import com.intuitivedesigns.querykernel.model.TableSchema;
import com.intuitivedesigns.querykernel.plugins.MemoryAdapterPlugin;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MemorySourceAdapterTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private MemorySourceAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        adapter = MemorySourceAdapter.fromFixture("shop", "classpath:fixtures/orders.json");
        adapter.connect();
    }

    private List<Map<String, Object>> run(Map<String, ?> payload) throws SourceAdapterException {
        return adapter.execute(QueryPayload.of(payload), TIMEOUT);
    }

    @Test
    void testIntrospectsDeclaredAndInferredFields() {
        List<TableSchema> tables = adapter.introspect();

        assertEquals(List.of("orders", "regions"), tables.stream().map(TableSchema::table).toList());
        TableSchema orders = tables.get(0);
        assertEquals(FieldRole.KEY, orders.fields().get(0).role());
        assertFalse(orders.fields().get(0).nullable());
        assertEquals(SemanticType.FLOAT, orders.fields().get(2).type());

        TableSchema regions = tables.get(1);
        assertEquals(SemanticType.TEXT, regions.fields().get(0).type());
        assertEquals(SemanticType.BOOLEAN, regions.fields().get(1).type());
    }

    @Test
    void testFiltersOrdersAndLimits() throws Exception {
        List<Map<String, Object>> rows = run(Map.of(
                "table", "orders",
                "where", Map.of("customer_id", 1),
                "orderBy", "amount",
                "limit", 5));

        assertEquals(List.of("o-3", "o-1"), rows.stream().map(r -> r.get("order_id")).toList());
    }

    @Test
    void testDescendingOrderPutsMissingValuesLast() throws Exception {
        List<Map<String, Object>> rows = run(Map.of("table", "orders", "orderBy", "amount", "descending", true));

        assertEquals(List.of("o-2", "o-1", "o-3", "o-4"), rows.stream().map(r -> r.get("order_id")).toList());
    }

    @Test
    void testProjectionKeepsOnlyPresentFields() throws Exception {
        List<Map<String, Object>> rows = run(Map.of(
                "table", "orders",
                "where", Map.of("order_id", "o-4"),
                "fields", List.of("order_id", "amount")));

        assertEquals(List.of(Map.of("order_id", "o-4")), rows);
    }

    @Test
    void testUnknownTableIsNotFound() {
        SourceAdapterException e = assertThrows(SourceAdapterException.class, () -> run(Map.of("table", "refunds")));
        assertEquals(SourceAdapterException.Reason.NOT_FOUND, e.reason());
        assertFalse(e.retryable());
    }

    @Test
    void testMissingTableKeyIsMalformed() {
        SourceAdapterException e = assertThrows(SourceAdapterException.class, () -> run(Map.of("limit", 1)));
        assertEquals(SourceAdapterException.Reason.MALFORMED_QUERY, e.reason());
    }

    @Test
    void testMissingFixtureFailsToConnect() {
        MemorySourceAdapter broken = MemorySourceAdapter.fromFixture("shop", "classpath:fixtures/absent.json");

        SourceAdapterException e = assertThrows(SourceAdapterException.class, broken::connect);
        assertEquals(SourceAdapterException.Reason.NOT_FOUND, e.reason());
    }

    @Test
    void testProgrammaticTablesAndPlugin() throws Exception {
        MemorySourceAdapter empty = MemorySourceAdapter.empty("crm")
                .table("customers", null, List.of(Map.of("customer_id", 1L, "name", "Ada")));
        empty.connect();
        assertEquals(SemanticType.INTEGER, empty.introspect().get(0).fields().get(0).type());

        SourceDescriptor d = new SourceDescriptor("shop", "classpath:fixtures/orders.json",
                SourceKind.DOCUMENT, MemoryAdapterPlugin.ID, 10, true, "");
        SourceAdapter fromPlugin = new MemoryAdapterPlugin().create(d, KernelConfig.empty(), () -> null);
        fromPlugin.connect();
        assertEquals(4, fromPlugin.execute(QueryPayload.of(Map.of("table", "orders")), TIMEOUT).size());
    }
}
