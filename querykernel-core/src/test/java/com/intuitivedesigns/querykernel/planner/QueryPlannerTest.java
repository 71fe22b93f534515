/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.planner;

import com.intuitivedesigns.querykernel.error.ErrorKind;
import com.intuitivedesigns.querykernel.error.PlanningException;
import com.intuitivedesigns.querykernel.generation.AggregateSpec;
import com.intuitivedesigns.querykernel.generation.GeneratedQuery;
import com.intuitivedesigns.querykernel.generation.GenerationException;
import com.intuitivedesigns.querykernel.generation.GenerationRequest;
import com.intuitivedesigns.querykernel.generation.QueryGenerator;
import com.intuitivedesigns.querykernel.model.AggregateFunction;
import com.intuitivedesigns.querykernel.model.AggregateTerm;
import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.QueryPayload;
import com.intuitivedesigns.querykernel.model.SemanticType;
import com.intuitivedesigns.querykernel.model.SourceDescriptor;
import com.intuitivedesigns.querykernel.model.SourceKind;
import com.intuitivedesigns.querykernel.plan.AggregateOperation;
import com.intuitivedesigns.querykernel.plan.FetchOperation;
import com.intuitivedesigns.querykernel.plan.JoinOperation;
import com.intuitivedesigns.querykernel.plan.Plan;
import com.intuitivedesigns.querykernel.plan.Shape;
import com.intuitivedesigns.querykernel.plan.UnionOperation;
import com.intuitivedesigns.querykernel.registry.InMemorySchemaRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static com.intuitivedesigns.querykernel.TestPlans.metrics;
import static com.intuitivedesigns.querykernel.TestPlans.source;
import static org.junit.jupiter.api.Assertions.*;

class QueryPlannerTest {

    private InMemorySchemaRegistry registry;

    @BeforeEach
    void setUp() {
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
    }

    private QueryPlanner planner(QueryGenerator generator) {
        return new QueryPlanner(registry, generator, PlannerSettings.defaults(), metrics());
    }

    private List<SourceDescriptor> sources(String... ids) {
        List<SourceDescriptor> out = new ArrayList<>();
        for (String id : ids) out.add(registry.source(id).orElseThrow());
        return out;
    }

    /** Selects every contracted field of the first table in context. */
    private static GeneratedQuery selectAll(GenerationRequest r) {
        String table = r.context().tables().get(0).name();
        return new GeneratedQuery(table, List.of(), QueryPayload.of(Map.of("table", table)));
    }

    @Test
    void testSingleSourcePlanIsOneFetch() {
        ScriptedGenerator gen = new ScriptedGenerator(QueryPlannerTest::selectAll);

        PlanningResult result = planner(gen).createPlan("list customers", sources("crm"));
        Plan plan = result.plan();

        assertEquals(1, plan.size());
        assertEquals("fetch_crm", plan.finalOutput());
        FetchOperation f = plan.fetches().get(0);
        assertEquals("customers", f.table());
        assertEquals(List.of("customer_id", "name"), f.fields().stream().map(FieldSpec::name).toList());
        assertTrue(plan.metadata().contract("crm", "customers").isPresent());
        assertEquals("list customers", plan.metadata().question());
        assertTrue(registry.validate(plan).valid());
    }

    @Test
    void testSharedKeySourcesAreJoined() {
        PlanningResult result = planner(new ScriptedGenerator(QueryPlannerTest::selectAll))
                .createPlan("customers and their orders", sources("shop", "crm"));
        Plan plan = result.plan();

        assertEquals("join_1", plan.finalOutput());
        JoinOperation join = (JoinOperation) plan.require("join_1");
        assertEquals("fetch_crm", join.leftInput());
        assertEquals("fetch_shop", join.rightInput());
        assertEquals("customer_id", join.leftKey());
    }

    @Test
    void testUnrelatedSourceIsUnionedTolerantly() {
        Plan plan = planner(new ScriptedGenerator(QueryPlannerTest::selectAll))
                .createPlan("customers, orders and tickets", sources("crm", "shop", "support"))
                .plan();

        assertEquals(QueryPlanner.UNION_ID, plan.finalOutput());
        UnionOperation union = (UnionOperation) plan.require(QueryPlanner.UNION_ID);
        assertEquals(List.of("join_1", "fetch_support"), union.inputs());
        assertTrue(union.tolerateFailedInputs());
        assertFalse(plan.dag().isRequired("fetch_support"));
    }

    @Test
    void testSummaryStepIsAppended() {
        ScriptedGenerator gen = new ScriptedGenerator(QueryPlannerTest::selectAll);
        gen.summary = new AggregateSpec(List.of("name"),
                List.of(new AggregateTerm(AggregateFunction.SUM, "amount", "total")));

        Plan plan = planner(gen).createPlan("total amount by name", sources("crm", "shop")).plan();

        assertEquals(QueryPlanner.SUMMARY_ID, plan.finalOutput());
        AggregateOperation a = (AggregateOperation) plan.require(QueryPlanner.SUMMARY_ID);
        assertEquals("join_1", a.input());
        assertEquals(List.of("name"), a.groupBy());
        assertTrue(gen.summaryFields.contains("amount"));
    }

    @Test
    void testInvalidSummaryIsDroppedDuringRepair() {
        ScriptedGenerator gen = new ScriptedGenerator(QueryPlannerTest::selectAll);
        gen.summary = new AggregateSpec(List.of("colour"),
                List.of(new AggregateTerm(AggregateFunction.COUNT, null, null)));

        PlanningResult result = planner(gen).createPlan("count by colour", sources("crm", "shop"));

        assertEquals("join_1", result.plan().finalOutput());
        assertTrue(result.diagnostics().stream().anyMatch(d -> d.startsWith("Dropped summary step")));
    }

    @Test
    void testRequiredFetchIsRegeneratedWithFeedback() {
        ScriptedGenerator gen = new ScriptedGenerator(r -> r.isRetry()
                ? selectAll(r)
                : new GeneratedQuery("customers", List.of("customer_id", "emial"), QueryPayload.empty()));

        PlanningResult result = planner(gen).createPlan("customer emails", sources("crm"));

        assertEquals(2, gen.requests.size());
        assertTrue(gen.requests.get(1).feedback().get(0).contains("emial"));
        assertTrue(result.diagnostics().stream().anyMatch(d -> d.startsWith("Regenerating crm")));
        assertTrue(registry.validate(result.plan()).valid());
    }

    @Test
    void testRepairIsSinglePass() {
        ScriptedGenerator gen = new ScriptedGenerator(
                r -> new GeneratedQuery("customers", List.of("emial"), QueryPayload.empty()));

        PlanningException e = assertThrows(PlanningException.class,
                () -> planner(gen).createPlan("customer emails", sources("crm")));

        assertEquals(ErrorKind.VALIDATION_FAILED, e.kind());
        assertFalse(e.violations().isEmpty());
        assertEquals(2, gen.requests.size());
    }

    @Test
    void testRequiredFetchFailingRegenerationEndsPlanning() {
        ScriptedGenerator gen = new ScriptedGenerator(r -> {
            if (!r.source().id().equals("shop")) return selectAll(r);
            if (r.isRetry()) throw new IllegalStateException("model down");
            return new GeneratedQuery("orders", List.of("order_id", "customer_id", "amout"), QueryPayload.empty());
        });

        PlanningException e = assertThrows(PlanningException.class,
                () -> planner(gen).createPlan("customers and their orders", sources("crm", "shop")));

        assertEquals(ErrorKind.GENERATION_FAILED, e.kind());
        assertEquals("fetch_shop", e.toError().operationId());
        assertEquals("amout", e.violations().get(0).field());
        assertTrue(e.diagnostics().stream().anyMatch(d -> d.startsWith("Generation failed for shop")));
        assertEquals(3, gen.requests.size());
    }

    @Test
    void testInvalidOptionalSourceIsDropped() {
        ScriptedGenerator gen = new ScriptedGenerator(r -> r.source().id().equals("support")
                ? new GeneratedQuery("tickets", List.of("ticket_id", "severity"), QueryPayload.empty())
                : selectAll(r));

        PlanningResult result = planner(gen).createPlan("customers and tickets", sources("crm", "support"));

        assertEquals("fetch_crm", result.plan().finalOutput());
        assertEquals(1, result.plan().size());
        assertTrue(result.diagnostics().stream().anyMatch(d -> d.startsWith("Dropped optional source support")));
    }

    @Test
    void testNoCandidates() {
        PlanningException e = assertThrows(PlanningException.class,
                () -> planner(new ScriptedGenerator(QueryPlannerTest::selectAll)).createPlan("anything", List.of()));
        assertEquals(ErrorKind.NO_CANDIDATE_SOURCES, e.kind());
    }

    @Test
    void testDisabledCandidatesAreNotPlanned() {
        SourceDescriptor disabled = registry.source("crm").orElseThrow().withEnabled(false);

        PlanningException e = assertThrows(PlanningException.class,
                () -> planner(new ScriptedGenerator(QueryPlannerTest::selectAll)).createPlan("customers", List.of(disabled)));

        assertEquals(ErrorKind.NO_CANDIDATE_SOURCES, e.kind());
        assertTrue(e.diagnostics().get(0).contains("disabled"));
    }

    @Test
    void testGenerationFailureDropsSource() {
        ScriptedGenerator gen = new ScriptedGenerator(r -> {
            if (r.source().id().equals("shop")) throw new IllegalStateException("model unavailable");
            return selectAll(r);
        });

        PlanningResult result = planner(gen).createPlan("customers and orders", sources("crm", "shop"));

        assertEquals("fetch_crm", result.plan().finalOutput());
        assertTrue(result.diagnostics().stream().anyMatch(d -> d.startsWith("Generation failed for shop")));
    }

    @Test
    void testEveryGenerationFailing() {
        ScriptedGenerator gen = new ScriptedGenerator(r -> new GeneratedQuery(" ", List.of(), QueryPayload.empty()));

        PlanningException e = assertThrows(PlanningException.class,
                () -> planner(gen).createPlan("customers", sources("crm", "shop")));

        assertEquals(ErrorKind.GENERATION_FAILED, e.kind());
        assertEquals(2, e.diagnostics().size());
    }

    @Test
    void testClassifierPrefersMentionedTables() {
        registry.mapEntity("client", "crm", "customers");
        KeywordSourceClassifier classifier = new KeywordSourceClassifier(registry, 8);

        assertEquals(List.of("crm"), ids(classifier.candidates("Which clients are active?")));
        assertEquals(List.of("shop", "crm"), ids(classifier.candidates("orders per client")));
        assertEquals(List.of("crm", "shop"), ids(classifier.candidates("orders per customer")));
        assertEquals(List.of("crm", "shop", "support"), ids(classifier.candidates("hello there")));
        assertEquals(1, new KeywordSourceClassifier(registry, 1).candidates("hello there").size());
    }

    @Test
    void testSharedKeyPrefersIncomingKeys() {
        Shape chain = new Shape(List.of(
                FieldSpec.key("customer_id", SemanticType.INTEGER),
                FieldSpec.value("order_id", SemanticType.TEXT)));
        List<FieldSpec> incoming = List.of(
                FieldSpec.key("order_id", SemanticType.TEXT),
                FieldSpec.value("customer_id", SemanticType.INTEGER));

        assertEquals(Optional.of("order_id"), QueryPlanner.sharedKey(chain, incoming));
        assertTrue(QueryPlanner.sharedKey(chain, List.of(FieldSpec.value("x", SemanticType.TEXT))).isEmpty());
    }

    private static List<String> ids(List<SourceDescriptor> sources) {
        return sources.stream().map(SourceDescriptor::id).toList();
    }

    private static final class ScriptedGenerator implements QueryGenerator {
        final Function<GenerationRequest, GeneratedQuery> script;
        final List<GenerationRequest> requests = new ArrayList<>();
        AggregateSpec summary;
        List<String> summaryFields = List.of();

        ScriptedGenerator(Function<GenerationRequest, GeneratedQuery> script) {
            this.script = script;
        }

        @Override
        public GeneratedQuery generate(GenerationRequest request) throws GenerationException {
            requests.add(request);
            return script.apply(request);
        }

        @Override
        public Optional<AggregateSpec> summarize(String question, List<String> availableFields) {
            summaryFields = availableFields;
            return Optional.ofNullable(summary);
        }
    }
}
