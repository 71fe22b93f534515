/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.registry;

import com.intuitivedesigns.querykernel.adapter.SourceAdapter;
import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.QueryPayload;
import com.intuitivedesigns.querykernel.model.SemanticType;
import com.intuitivedesigns.querykernel.model.SourceKind;
import com.intuitivedesigns.querykernel.model.TableSchema;
import com.intuitivedesigns.querykernel.plan.ContractStamp;
import com.intuitivedesigns.querykernel.plan.Plan;
import com.intuitivedesigns.querykernel.plan.PlanMetadata;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.intuitivedesigns.querykernel.TestPlans.fetch;
import static com.intuitivedesigns.querykernel.TestPlans.source;
import static org.junit.jupiter.api.Assertions.*;

class SchemaDriftDetectorTest {

    private static final FieldSpec ID = FieldSpec.key("id", SemanticType.INTEGER);

    private static Plan planAgainst(FieldContract contract) {
        return Plan.builder()
                .add(fetch("f", "crm", "customers", ID))
                .finalOutput("f")
                .metadata(new PlanMetadata("q", Instant.now(),
                        Map.of(ContractStamp.key("crm", "customers"), contract.stamp())))
                .build();
    }

    @Test
    void testNoDriftWhileContractUnchanged() {
        InMemorySchemaRegistry registry = new InMemorySchemaRegistry();
        registry.upsertSource(source("crm", SourceKind.RELATIONAL, 10));
        FieldContract v1 = registry.upsertFields("crm", "customers", List.of(ID));

        assertTrue(new SchemaDriftDetector(registry).detect(planAgainst(v1)).isEmpty());
    }

    @Test
    void testDetectsVersionChange() {
        InMemorySchemaRegistry registry = new InMemorySchemaRegistry();
        registry.upsertSource(source("crm", SourceKind.RELATIONAL, 10));
        FieldContract v1 = registry.upsertFields("crm", "customers", List.of(ID));
        Plan plan = planAgainst(v1);
        registry.upsertFields("crm", "customers", List.of(ID, FieldSpec.value("name", SemanticType.TEXT)));

        List<SchemaDrift> drift = new SchemaDriftDetector(registry).detect(plan);

        assertEquals(1, drift.size());
        assertEquals(1, drift.get(0).planned().version());
        assertEquals(2, drift.get(0).current().version());
        assertTrue(drift.get(0).describe().contains("planned against v1, registry now v2"));
    }

    @Test
    void testDetectsRemovedContract() {
        InMemorySchemaRegistry registry = new InMemorySchemaRegistry();
        registry.upsertSource(source("crm", SourceKind.RELATIONAL, 10));
        Plan plan = planAgainst(registry.upsertFields("crm", "customers", List.of(ID)));
        registry.removeSource("crm");

        SchemaDrift drift = new SchemaDriftDetector(registry).detect(plan).get(0);
        assertNull(drift.current());
        assertTrue(drift.describe().endsWith("registry now removed"));
    }

    @Test
    void testPlansWithoutStampsNeverDrift() {
        InMemorySchemaRegistry registry = new InMemorySchemaRegistry();
        Plan plan = Plan.builder().add(fetch("f", "crm", "customers", ID)).finalOutput("f").build();

        assertTrue(new SchemaDriftDetector(registry).detect(plan).isEmpty());
    }

    @Test
    void testIntrospectionReportsOnlyChangedContracts() throws Exception {
        InMemorySchemaRegistry registry = new InMemorySchemaRegistry();
        List<TableSchema> layout = new ArrayList<>(List.of(
                new TableSchema("customers", List.of(ID)),
                new TableSchema("orders", List.of(FieldSpec.key("order_id", SemanticType.TEXT)))));
        SourceAdapter adapter = new SourceAdapter() {
            @Override
            public void connect() {
            }

            @Override
            public List<TableSchema> introspect() {
                return layout;
            }

            @Override
            public List<Map<String, Object>> execute(QueryPayload payload, Duration timeout) {
                return List.of();
            }
        };
        IntrospectionWorker worker = new IntrospectionWorker(registry);

        assertEquals(2, worker.introspect(source("crm", SourceKind.RELATIONAL, 10), adapter).size());
        assertTrue(worker.introspect(source("crm", SourceKind.RELATIONAL, 10), adapter).isEmpty());

        layout.set(0, new TableSchema("customers", List.of(ID, FieldSpec.value("name", SemanticType.TEXT))));
        List<FieldContract> changed = worker.introspect(source("crm", SourceKind.RELATIONAL, 10), adapter);
        assertEquals(1, changed.size());
        assertEquals("customers", changed.get(0).table());
        assertEquals(2, changed.get(0).version());
    }
}
