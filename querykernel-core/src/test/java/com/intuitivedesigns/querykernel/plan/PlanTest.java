/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plan;

import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.SemanticType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.intuitivedesigns.querykernel.TestPlans.fetch;
import static org.junit.jupiter.api.Assertions.*;

class PlanTest {

    private static final FieldSpec ID = FieldSpec.key("id", SemanticType.INTEGER);

    private static Plan diamond() {
        return Plan.builder()
                .id("p1")
                .add(fetch("a", "crm", "customers", ID, FieldSpec.value("name", SemanticType.TEXT)))
                .add(fetch("b", "shop", "orders", ID, FieldSpec.value("amount", SemanticType.FLOAT)))
                .add(fetch("c", "support", "tickets", ID))
                .add(JoinOperation.builder("j").left("a").right("b").on("id").build())
                .add(UnionOperation.builder("u").input("j").input("c").tolerateFailedInputs(true).build())
                .finalOutput("u")
                .build();
    }

    @Test
    void testBuildIndexesOperations() {
        Plan plan = diamond();

        assertEquals("p1", plan.id());
        assertEquals(5, plan.size());
        assertEquals("u", plan.finalOperation().id());
        assertEquals(3, plan.fetches().size());
        assertTrue(plan.operation("j").isPresent());
        assertThrows(IllegalArgumentException.class, () -> plan.require("missing"));
    }

    @Test
    void testRejectsEmptyPlan() {
        assertThrows(IllegalArgumentException.class, () -> Plan.builder().finalOutput("x").build());
    }

    @Test
    void testRejectsDuplicateIds() {
        Plan.Builder b = Plan.builder()
                .add(fetch("a", "crm", "customers", ID))
                .add(fetch("a", "shop", "orders", ID))
                .finalOutput("a");
        assertThrows(IllegalArgumentException.class, b::build);
    }

    @Test
    void testRejectsUnknownInput() {
        Plan.Builder b = Plan.builder()
                .add(fetch("a", "crm", "customers", ID))
                .add(JoinOperation.builder("j").left("a").right("ghost").on("id").build())
                .finalOutput("j");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, b::build);
        assertTrue(e.getMessage().contains("ghost"));
    }

    @Test
    void testRejectsMissingFinalOutput() {
        Plan.Builder b = Plan.builder().add(fetch("a", "crm", "customers", ID)).finalOutput("b");
        assertThrows(IllegalArgumentException.class, b::build);
    }

    @Test
    void testRejectsCycle() {
        Plan.Builder b = Plan.builder()
                .add(fetch("a", "crm", "customers", ID))
                .add(JoinOperation.builder("j1").left("a").right("j2").on("id").build())
                .add(JoinOperation.builder("j2").left("a").right("j1").on("id").build())
                .finalOutput("j1");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, b::build);
        assertTrue(e.getMessage().contains("cycle"));
    }

    @Test
    void testRejectsDanglingOperation() {
        Plan.Builder b = Plan.builder()
                .add(fetch("a", "crm", "customers", ID))
                .add(fetch("b", "shop", "orders", ID))
                .finalOutput("a");
        assertThrows(IllegalArgumentException.class, b::build);
    }

    @Test
    void testOperationValidation() {
        assertThrows(IllegalArgumentException.class, () -> fetch("bad id!", "crm", "customers", ID));
        assertThrows(IllegalArgumentException.class, () -> fetch("a", "crm", "customers"));
        assertThrows(IllegalArgumentException.class, () -> fetch("a", "crm", "customers", ID, ID));
        assertThrows(IllegalArgumentException.class,
                () -> JoinOperation.builder("j").left("a").right("a").on("id").build());
        assertThrows(IllegalArgumentException.class,
                () -> UnionOperation.builder("u").input("a").build());
        assertThrows(IllegalArgumentException.class,
                () -> UnionOperation.builder("u").input("a").input("a").build());
    }

    @Test
    void testDagOrderAndDependents() {
        PlanDag dag = diamond().dag();

        assertEquals(List.of("a", "b", "c", "j", "u"), dag.topologicalOrder());
        assertEquals(2, dag.inDegree("j"));
        assertEquals(List.of("u"), dag.dependents("j"));
        assertEquals(List.of(), dag.dependents("u"));
    }

    @Test
    void testRequiredSetStopsAtTolerantUnion() {
        Plan plan = diamond();
        PlanDag dag = plan.dag();

        assertEquals(Set.of("u"), dag.required());
        assertFalse(dag.isRequired("a"));
        assertEquals(Set.of("j", "c", "a", "b"), dag.ancestors(plan, "u"));
    }

    @Test
    void testRequiredSetFollowsStrictInputs() {
        Plan plan = Plan.builder()
                .add(fetch("a", "crm", "customers", ID))
                .add(fetch("b", "shop", "orders", ID))
                .add(JoinOperation.builder("j").left("a").right("b").on("id").build())
                .finalOutput("j")
                .build();

        assertEquals(Set.of("j", "a", "b"), plan.dag().required());
    }

    @Test
    void testToBuilderReplacesOperation() {
        Plan plan = diamond();
        Plan changed = plan.toBuilder()
                .replace(UnionOperation.builder("u").input("j").input("c").distinct(true).build())
                .build();

        UnionOperation u = (UnionOperation) changed.require("u");
        assertTrue(u.distinct());
        assertFalse(u.tolerateFailedInputs());
    }
}
