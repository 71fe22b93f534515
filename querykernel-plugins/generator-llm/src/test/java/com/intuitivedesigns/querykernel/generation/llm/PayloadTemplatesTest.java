/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.generation.llm;

import com.intuitivedesigns.querykernel.generation.GeneratedQuery;
import com.intuitivedesigns.querykernel.generation.SchemaContext;
import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.SemanticType;
import com.intuitivedesigns.querykernel.model.SourceKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PayloadTemplatesTest {

    @Test
    void testMentionsHandlesPluralsAndQualifiedNames() {
        Set<String> tokens = PayloadTemplates.tokens("Show ORDERS for each customer");

        assertTrue(PayloadTemplates.mentions(tokens, "order"));
        assertTrue(PayloadTemplates.mentions(tokens, "customers"));
        assertTrue(PayloadTemplates.mentions(tokens, "public.orders"));
        assertFalse(PayloadTemplates.mentions(tokens, "invoices"));
    }

    @Test
    void testOddIdentifiersAreQuoted() {
        SchemaContext ctx = new SchemaContext("crm", SourceKind.RELATIONAL, "", List.of(
                new SchemaContext.Table("Order Lines",
                        List.of(FieldSpec.value("line id", SemanticType.TEXT), FieldSpec.value("qty", SemanticType.INTEGER)),
                        List.of())),
                false);

        GeneratedQuery q = PayloadTemplates.draft("lines", ctx, "jdbc", 0);

        assertEquals("SELECT \"line id\", qty FROM \"Order Lines\"", q.payload().getString("sql", null));
        assertFalse(q.payload().has("limit"));
    }

    @Test
    void testDescribeFallsBackToTablePayload() {
        assertTrue(PayloadTemplates.describe(null).startsWith("{\"table\""));
        assertTrue(PayloadTemplates.describe("mongo").contains("vector"));
    }
}
