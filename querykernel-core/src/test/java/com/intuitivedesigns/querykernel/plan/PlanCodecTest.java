/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plan;

import com.intuitivedesigns.querykernel.model.AggregateFunction;
import com.intuitivedesigns.querykernel.model.AggregateTerm;
import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.QueryPayload;
import com.intuitivedesigns.querykernel.model.SemanticType;
import com.intuitivedesigns.querykernel.model.SourceKind;
import com.intuitivedesigns.querykernel.registry.InMemorySchemaRegistry;
import com.intuitivedesigns.querykernel.registry.ValidationReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.intuitivedesigns.querykernel.TestPlans.source;
import static org.junit.jupiter.api.Assertions.*;

class PlanCodecTest {

    private final PlanCodec codec = new PlanCodec();

    private static Plan samplePlan() {
        FetchOperation customers = FetchOperation.builder("fetch_crm")
                .source("crm")
                .table("customers")
                .payload(QueryPayload.of(Map.of(
                        "table", "customers",
                        "limit", 25,
                        "where", Map.of("region", "EU"))))
                .field(FieldSpec.key("customer_id", SemanticType.INTEGER))
                .field(FieldSpec.value("name", SemanticType.TEXT))
                .build();
        FetchOperation orders = FetchOperation.builder("fetch_shop")
                .source("shop")
                .table("orders")
                .payload(QueryPayload.of(Map.of("table", "orders", "min", 2.5)))
                .field(FieldSpec.key("customer_id", SemanticType.INTEGER))
                .field(FieldSpec.value("amount", SemanticType.FLOAT))
                .build();
        JoinOperation join = JoinOperation.builder("join_1")
                .left("fetch_crm")
                .right("fetch_shop")
                .on("customer_id")
                .mode(JoinMode.LEFT)
                .build();
        AggregateOperation summary = AggregateOperation.builder("summary")
                .input("join_1")
                .groupBy("name")
                .term(new AggregateTerm(AggregateFunction.SUM, "amount", "total"))
                .term(new AggregateTerm(AggregateFunction.COUNT, null, null))
                .build();

        return Plan.builder()
                .id("plan-42")
                .add(customers)
                .add(orders)
                .add(join)
                .add(summary)
                .finalOutput("summary")
                .metadata(new PlanMetadata("total spend by customer",
                        Instant.parse("2025-03-01T10:15:30.123Z"),
                        Map.of("crm/customers", new ContractStamp(3, "abc"), "shop/orders", new ContractStamp(1, "def"))))
                .build();
    }

    @Test
    void testJsonRoundTripPreservesPlan() throws IOException {
        Plan plan = samplePlan();

        Plan decoded = codec.fromJson(codec.toJson(plan));

        assertEquals(plan, decoded);
        assertEquals(List.of("fetch_crm", "fetch_shop", "join_1", "summary"), decoded.dag().topologicalOrder());
        assertEquals(25L, decoded.fetches().get(0).payload().getLong("limit", 0));
        assertEquals(Map.of("region", "EU"), decoded.fetches().get(0).payload().getMap("where"));
    }

    @Test
    void testDecodedPlanValidatesLikeOriginal() throws IOException {
        InMemorySchemaRegistry registry = new InMemorySchemaRegistry();
        registry.upsertSource(source("crm", SourceKind.RELATIONAL, 10));
        registry.upsertSource(source("shop", SourceKind.DOCUMENT, 20));
        registry.upsertFields("crm", "customers", List.of(
                FieldSpec.key("customer_id", SemanticType.INTEGER),
                FieldSpec.value("name", SemanticType.TEXT)));
        registry.upsertFields("shop", "orders", List.of(
                FieldSpec.key("customer_id", SemanticType.INTEGER),
                FieldSpec.value("amount", SemanticType.FLOAT)));
        Plan plan = samplePlan();
        Plan decoded = codec.fromJson(codec.toJson(plan));

        ValidationReport before = registry.validate(plan);
        assertTrue(before.valid());
        assertEquals(before, registry.validate(decoded));

        registry.upsertFields("shop", "orders", List.of(
                FieldSpec.key("customer_id", SemanticType.TEXT),
                FieldSpec.value("amount", SemanticType.TEXT)));

        ValidationReport after = registry.validate(plan);
        assertFalse(after.valid());
        assertEquals(after, registry.validate(decoded));
    }

    @Test
    void testFileRoundTrip(@TempDir Path dir) throws IOException {
        Plan plan = samplePlan();
        Path file = dir.resolve("plans/plan-42.json");

        codec.write(plan, file);

        assertEquals(plan, codec.read(file));
    }

    @Test
    void testTreeCarriesFormatVersionAndStamps() {
        var tree = codec.toTree(samplePlan());

        assertEquals(PlanCodec.FORMAT_VERSION, tree.path("formatVersion").asInt());
        assertEquals(3, tree.path("metadata").path("contracts").path("crm/customers").path("version").asInt());
        assertEquals("LEFT", tree.path("operations").get(2).path("mode").asText());
    }

    @Test
    void testRejectsUnknownFormatVersion() {
        String json = codec.toJson(samplePlan()).replace("\"formatVersion\" : 1", "\"formatVersion\" : 9");
        IOException e = assertThrows(IOException.class, () -> codec.fromJson(json));
        assertTrue(e.getMessage().contains("9"));
    }

    @Test
    void testRejectsStructurallyInvalidPlan() {
        String json = "{\"formatVersion\":1,\"id\":\"p\",\"finalOutput\":\"j\",\"metadata\":{},"
                + "\"operations\":[{\"id\":\"j\",\"kind\":\"JOIN\",\"left\":\"a\",\"right\":\"b\",\"leftKey\":\"id\"}]}";
        assertThrows(IOException.class, () -> codec.fromJson(json));
    }

    @Test
    void testRejectsMissingOperations() {
        assertThrows(IOException.class, () -> codec.fromJson("{\"id\":\"p\",\"finalOutput\":\"x\"}"));
    }
}
