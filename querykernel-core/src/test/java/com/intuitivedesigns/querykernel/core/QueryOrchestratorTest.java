/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.core;

import com.intuitivedesigns.querykernel.adapter.SourceAdapter;
import com.intuitivedesigns.querykernel.adapter.SourceAdapterException;
import com.intuitivedesigns.querykernel.aggregate.ResultAggregator;
import com.intuitivedesigns.querykernel.aggregate.ResultRow;
import com.intuitivedesigns.querykernel.error.ErrorKind;
import com.intuitivedesigns.querykernel.error.ValidationException;
import com.intuitivedesigns.querykernel.executor.CancellationToken;
import com.intuitivedesigns.querykernel.executor.ExecutorSettings;
import com.intuitivedesigns.querykernel.executor.PlanExecutor;
import com.intuitivedesigns.querykernel.executor.RetryPolicy;
import com.intuitivedesigns.querykernel.executor.SourceAdapters;
import com.intuitivedesigns.querykernel.generation.GeneratedQuery;
import com.intuitivedesigns.querykernel.generation.QueryGenerator;
import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.QueryPayload;
import com.intuitivedesigns.querykernel.model.SemanticType;
import com.intuitivedesigns.querykernel.model.SourceKind;
import com.intuitivedesigns.querykernel.model.TableSchema;
import com.intuitivedesigns.querykernel.planner.KeywordSourceClassifier;
import com.intuitivedesigns.querykernel.planner.PlannerSettings;
import com.intuitivedesigns.querykernel.planner.PlanningResult;
import com.intuitivedesigns.querykernel.planner.QueryPlanner;
import com.intuitivedesigns.querykernel.registry.InMemorySchemaRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.intuitivedesigns.querykernel.TestPlans.metrics;
import static com.intuitivedesigns.querykernel.TestPlans.source;
import static org.junit.jupiter.api.Assertions.*;

@Timeout(30)
class QueryOrchestratorTest {

    private InMemorySchemaRegistry registry;
    private SourceAdapters adapters;
    private QueryOrchestrator orchestrator;

    private static SourceAdapter returning(List<Map<String, Object>> rows) {
        return new SourceAdapter() {
            @Override
            public void connect() {
            }

            @Override
            public List<TableSchema> introspect() {
                return List.of();
            }

            @Override
            public List<Map<String, Object>> execute(QueryPayload payload, Duration timeout) {
                return rows;
            }
        };
    }

    private static SourceAdapter failing(SourceAdapterException error) {
        return new SourceAdapter() {
            @Override
            public void connect() {
            }

            @Override
            public List<TableSchema> introspect() {
                return List.of();
            }

            @Override
            public List<Map<String, Object>> execute(QueryPayload payload, Duration timeout) throws SourceAdapterException {
                throw error;
            }
        };
    }

    @BeforeEach
    void setUp() throws Exception {
        registry = new InMemorySchemaRegistry();
        registry.upsertSource(source("crm", SourceKind.RELATIONAL, 10));
        registry.upsertSource(source("shop", SourceKind.DOCUMENT, 20));
        registry.upsertSource(source("support", SourceKind.MESSAGE_LOG, 30));
        registry.upsertFields("crm", "customers", List.of(
                FieldSpec.key("customer_id", SemanticType.INTEGER),
                FieldSpec.value("name", SemanticType.TEXT)));
        registry.upsertFields("shop", "orders", List.of(
                FieldSpec.key("order_id", SemanticType.TEXT),
                FieldSpec.value("customer_id", SemanticType.INTEGER),
                FieldSpec.value("amount", SemanticType.FLOAT)));
        registry.upsertFields("support", "tickets", List.of(
                FieldSpec.key("ticket_id", SemanticType.TEXT),
                FieldSpec.value("message", SemanticType.TEXT)));

        adapters = new SourceAdapters();
        adapters.register("crm", returning(List.of(
                Map.of("customer_id", 1, "name", "Ada"),
                Map.of("customer_id", 2, "name", "Bo"))));
        adapters.register("shop", returning(List.of(
                Map.of("order_id", "o-1", "customer_id", 1, "amount", 12.5))));
        adapters.register("support", failing(
                SourceAdapterException.fatal(SourceAdapterException.Reason.PERMISSION_DENIED, "denied")));

        QueryGenerator generator = request -> {
            String table = request.context().tables().get(0).name();
            return new GeneratedQuery(table, List.of(), QueryPayload.of(Map.of("table", table)));
        };
        ExecutorSettings settings = new ExecutorSettings(4, Duration.ofSeconds(5), RetryPolicy.none(), null);
        orchestrator = new QueryOrchestrator(
                registry,
                new KeywordSourceClassifier(registry, 8),
                new QueryPlanner(registry, generator, PlannerSettings.defaults(), metrics()),
                new PlanExecutor(registry, adapters, settings, metrics()),
                new ResultAggregator());
    }

    @AfterEach
    void tearDown() {
        orchestrator.close();
        adapters.close();
    }

    @Test
    void testAskJoinsRelatedSources() {
        QueryResponse response = orchestrator.ask("customers and their orders");

        assertFalse(response.partial());
        assertEquals(1, response.rows().size());
        ResultRow row = response.rows().get(0);
        assertEquals(1L, row.get("customer_id"));
        assertEquals("Ada", row.get("name"));
        assertEquals("o-1", row.get("order_id"));
        assertEquals(12.5, row.get("amount"));
        assertEquals(List.of("fetch_crm", "fetch_shop"), row.provenance());
    }

    @Test
    void testFailedOptionalSourceMakesResponsePartial() {
        QueryResponse response = orchestrator.ask("customers, orders and tickets");

        assertTrue(response.partial());
        assertEquals(1, response.warnings().size());
        assertTrue(response.warnings().get(0).contains("fetch_support"));
        assertEquals(1, response.rows().size());
        assertEquals("Ada", response.rows().get(0).get("name"));
    }

    @Test
    void testPlannedQuestionCanBeExecutedLater() {
        PlanningResult planned = orchestrator.plan("list customers");
        assertEquals("fetch_crm", planned.plan().finalOutput());

        QueryResponse response = orchestrator.execute(planned.plan(), new CancellationToken());

        assertEquals(planned.plan().id(), response.planId());
        assertEquals(2, response.rows().size());
        assertEquals(List.of("customer_id", "name"), response.columns().stream().map(FieldSpec::name).toList());
        assertTrue(response.diagnostics().isEmpty());
    }

    @Test
    void testStalePlanIsRejectedBeforeExecution() {
        PlanningResult planned = orchestrator.plan("list customers");
        registry.upsertFields("crm", "customers", List.of(
                FieldSpec.key("customer_id", SemanticType.INTEGER),
                FieldSpec.value("full_name", SemanticType.TEXT)));

        ValidationException e = assertThrows(ValidationException.class,
                () -> orchestrator.execute(planned.plan(), new CancellationToken()));
        assertEquals(ErrorKind.VALIDATION_FAILED, e.kind());
        assertEquals("fetch_crm", e.toError().operationId());
        assertEquals("name", e.violations().get(0).field());
    }

    @Test
    void testClosedOrchestratorRejectsQuestions() {
        orchestrator.close();
        orchestrator.close();

        assertThrows(IllegalStateException.class, () -> orchestrator.ask("list customers"));
    }
}
