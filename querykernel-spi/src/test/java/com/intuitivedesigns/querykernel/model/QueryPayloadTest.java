/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class QueryPayloadTest {

    @Test
    void testNumbersAreWidened() {
        QueryPayload p = QueryPayload.of(Map.of("limit", 10, "ratio", 0.5f, "tags", List.of(1, 2)));

        assertEquals(10L, p.values().get("limit"));
        assertEquals(0.5d, p.values().get("ratio"));
        assertEquals(List.of(1L, 2L), p.getList("tags"));
    }

    @Test
    void testEqualDocumentsCompareEqual() {
        assertEquals(QueryPayload.of(Map.of("limit", 10)), QueryPayload.of(Map.of("limit", 10L)));
    }

    @Test
    void testPayloadIsDeeplyImmutable() {
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put("status", "open");
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("filter", filter);
        QueryPayload p = QueryPayload.of(raw);

        filter.put("status", "closed");

        assertEquals("open", p.getMap("filter").get("status"));
        assertThrows(UnsupportedOperationException.class, () -> p.values().put("x", 1));
        assertThrows(UnsupportedOperationException.class, () -> p.getMap("filter").put("x", 1));
    }

    @Test
    void testUnsupportedValueIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> QueryPayload.of(Map.of("id", UUID.randomUUID())));
    }

    @Test
    void testFingerprintIgnoresKeyOrder() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("table", "orders");
        a.put("filter", Map.of("b", 2, "a", "x"));
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("filter", Map.of("a", "x", "b", 2));
        b.put("table", "orders");

        assertEquals(QueryPayload.of(a).fingerprint(), QueryPayload.of(b).fingerprint());
        assertEquals("{filter={a=\"x\",b=2},table=\"orders\"}", QueryPayload.of(a).fingerprint());
        assertNotEquals(QueryPayload.of(a).fingerprint(), QueryPayload.of(Map.of("table", "orders")).fingerprint());
    }

    @Test
    void testTypedGetters() {
        QueryPayload p = QueryPayload.of(Map.of("table", "orders", "limit", "25", "bad", "x"));

        assertEquals("orders", p.getString("table", null));
        assertEquals("none", p.getString("missing", "none"));
        assertEquals(25L, p.getLong("limit", 0));
        assertEquals(7L, p.getLong("bad", 7));
        assertTrue(p.getList("table").isEmpty());
        assertTrue(p.getMap("missing").isEmpty());
        assertTrue(p.has("limit"));
        assertTrue(p.get("missing").isEmpty());
        assertTrue(QueryPayload.empty().values().isEmpty());
    }
}
