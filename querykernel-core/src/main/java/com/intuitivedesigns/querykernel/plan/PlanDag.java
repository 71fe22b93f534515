/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Graph view over a plan: in-degrees, dependents, topological order and the set of operations the final output cannot do without.
 */
public final class PlanDag {

    private final Map<String, Integer> inDegree;
    private final Map<String, List<String>> dependents;
    private final List<String> topologicalOrder;
    private final Set<String> required;

    private PlanDag(Map<String, Integer> inDegree,
                    Map<String, List<String>> dependents,
                    List<String> topologicalOrder,
                    Set<String> required) {
        this.inDegree = inDegree;
        this.dependents = dependents;
        this.topologicalOrder = topologicalOrder;
        this.required = required;
    }

    static PlanDag of(Plan plan) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new LinkedHashMap<>();
        for (Operation op : plan.operations()) {
            inDegree.put(op.id(), op.inputs().size());
            dependents.putIfAbsent(op.id(), new ArrayList<>());
            for (String in : op.inputs()) {
                dependents.computeIfAbsent(in, k -> new ArrayList<>()).add(op.id());
            }
        }

        // Kahn, seeded and drained in plan order so the result is stable
        Map<String, Integer> remaining = new HashMap<>(inDegree);
        List<String> order = new ArrayList<>();
        Deque<String> queue = new ArrayDeque<>();
        for (Operation op : plan.operations()) {
            if (op.inputs().isEmpty()) queue.add(op.id());
        }
        while (!queue.isEmpty()) {
            String cur = queue.poll();
            order.add(cur);
            for (String dep : dependents.get(cur)) {
                if (remaining.merge(dep, -1, Integer::sum) == 0) queue.add(dep);
            }
        }

        Map<String, List<String>> frozenDeps = new LinkedHashMap<>();
        dependents.forEach((k, v) -> frozenDeps.put(k, List.copyOf(v)));

        return new PlanDag(
                Collections.unmodifiableMap(inDegree),
                Collections.unmodifiableMap(frozenDeps),
                List.copyOf(order),
                Collections.unmodifiableSet(computeRequired(plan)));
    }

    /**
     * An operation is required when its failure makes the final output fail or skip.
     * Inputs of a union that tolerates failed inputs are not required through that union.
     */
    private static Set<String> computeRequired(Plan plan) {
        Set<String> required = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(plan.finalOutput());
        while (!stack.isEmpty()) {
            String cur = stack.pop();
            if (!required.add(cur)) continue;
            Operation op = plan.require(cur);
            if (op instanceof UnionOperation u && u.tolerateFailedInputs()) {
                continue;
            }
            for (String in : op.inputs()) stack.push(in);
        }
        return required;
    }

    public int inDegree(String opId) {
        Integer d = inDegree.get(opId);
        if (d == null) throw new IllegalArgumentException("Unknown operation '" + opId + "'");
        return d;
    }

    public Map<String, Integer> inDegrees() {
        return inDegree;
    }

    public List<String> dependents(String opId) {
        return dependents.getOrDefault(opId, List.of());
    }

    public List<String> topologicalOrder() {
        return topologicalOrder;
    }

    public Set<String> required() {
        return required;
    }

    public boolean isRequired(String opId) {
        return required.contains(opId);
    }

    /**
     * Transitive inputs of {@code opId}, excluding itself.
     */
    public Set<String> ancestors(Plan plan, String opId) {
        Set<String> out = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>(plan.require(opId).inputs());
        while (!stack.isEmpty()) {
            String cur = stack.pop();
            if (out.add(cur)) stack.addAll(plan.require(cur).inputs());
        }
        return out;
    }
}
