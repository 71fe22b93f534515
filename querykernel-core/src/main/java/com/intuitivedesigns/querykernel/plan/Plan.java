/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Immutable DAG of operations with one designated final output.
 *
 * <p>Invariants checked by {@link Builder#build()}:
 * <ul>
 *   <li>operation ids are unique;</li>
 *   <li>every input id resolves to an operation of the same plan;</li>
 *   <li>the input graph is acyclic;</li>
 *   <li>{@code finalOutput} names an operation, and every operation reaches it.</li>
 * </ul>
 * Re-planning produces a new instance; nothing mutates a built plan.
 */
public final class Plan {

    private final String id;
    private final List<Operation> operations;
    private final Map<String, Operation> byId;
    private final String finalOutput;
    private final PlanMetadata metadata;
    private final PlanDag dag;

    private Plan(String id, List<Operation> operations, Map<String, Operation> byId,
                 String finalOutput, PlanMetadata metadata) {
        this.id = id;
        this.operations = operations;
        this.byId = byId;
        this.finalOutput = finalOutput;
        this.metadata = metadata;
        this.dag = PlanDag.of(this);
    }

    public String id() {
        return id;
    }

    public List<Operation> operations() {
        return operations;
    }

    public Optional<Operation> operation(String opId) {
        return Optional.ofNullable(byId.get(opId));
    }

    public Operation require(String opId) {
        Operation op = byId.get(opId);
        if (op == null) {
            throw new IllegalArgumentException("Plan " + id + " has no operation '" + opId + "'");
        }
        return op;
    }

    public String finalOutput() {
        return finalOutput;
    }

    public Operation finalOperation() {
        return byId.get(finalOutput);
    }

    public PlanMetadata metadata() {
        return metadata;
    }

    public PlanDag dag() {
        return dag;
    }

    public int size() {
        return operations.size();
    }

    public List<FetchOperation> fetches() {
        List<FetchOperation> out = new ArrayList<>();
        for (Operation op : operations) {
            if (op instanceof FetchOperation f) out.add(f);
        }
        return out;
    }

    /**
     * Builder pre-loaded with this plan's content, for producing a re-planned copy.
     */
    public Builder toBuilder() {
        Builder b = builder().id(id).finalOutput(finalOutput).metadata(metadata);
        for (Operation op : operations) b.add(op);
        return b;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Plan other)) return false;
        return id.equals(other.id)
                && operations.equals(other.operations)
                && finalOutput.equals(other.finalOutput)
                && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, operations, finalOutput, metadata);
    }

    @Override
    public String toString() {
        return "Plan{id=" + id + ", operations=" + byId.keySet() + ", finalOutput=" + finalOutput + '}';
    }

    public static final class Builder {
        private String id;
        private final List<Operation> operations = new ArrayList<>();
        private String finalOutput;
        private PlanMetadata metadata;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder add(Operation op) {
            this.operations.add(Objects.requireNonNull(op, "operation"));
            return this;
        }

        public Builder remove(String opId) {
            this.operations.removeIf(op -> op.id().equals(opId));
            return this;
        }

        public Builder replace(Operation op) {
            for (int i = 0; i < operations.size(); i++) {
                if (operations.get(i).id().equals(op.id())) {
                    operations.set(i, op);
                    return this;
                }
            }
            throw new IllegalArgumentException("No operation '" + op.id() + "' to replace");
        }

        public Builder finalOutput(String opId) {
            this.finalOutput = opId;
            return this;
        }

        public Builder metadata(PlanMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Plan build() {
            if (operations.isEmpty()) {
                throw new IllegalArgumentException("Plan must contain at least one operation");
            }

            Map<String, Operation> index = new LinkedHashMap<>();
            for (Operation op : operations) {
                if (index.put(op.id(), op) != null) {
                    throw new IllegalArgumentException("Duplicate operation id '" + op.id() + "'");
                }
            }

            for (Operation op : operations) {
                for (String in : op.inputs()) {
                    if (!index.containsKey(in)) {
                        throw new IllegalArgumentException("Operation '" + op.id() + "' references unknown input '" + in + "'");
                    }
                }
            }

            String fin = (finalOutput == null) ? null : finalOutput.trim();
            if (fin == null || !index.containsKey(fin)) {
                throw new IllegalArgumentException("Final output '" + finalOutput + "' is not an operation of the plan");
            }

            requireAcyclic(index);
            requireAllReachFinal(index, fin);

            String planId = (id == null || id.isBlank()) ? UUID.randomUUID().toString() : id.trim();
            PlanMetadata meta = (metadata == null) ? PlanMetadata.of("") : metadata;
            return new Plan(planId,
                    Collections.unmodifiableList(new ArrayList<>(operations)),
                    Collections.unmodifiableMap(index),
                    fin,
                    meta);
        }

        private static void requireAcyclic(Map<String, Operation> index) {
            // Kahn: anything left with in-degree > 0 sits on a cycle
            Map<String, Integer> inDegree = new LinkedHashMap<>();
            Map<String, List<String>> dependents = new LinkedHashMap<>();
            for (Operation op : index.values()) {
                inDegree.put(op.id(), op.inputs().size());
                for (String in : op.inputs()) {
                    dependents.computeIfAbsent(in, k -> new ArrayList<>()).add(op.id());
                }
            }
            List<String> queue = new ArrayList<>();
            inDegree.forEach((k, v) -> {
                if (v == 0) queue.add(k);
            });
            int visited = 0;
            while (visited < queue.size()) {
                String cur = queue.get(visited++);
                for (String dep : dependents.getOrDefault(cur, List.of())) {
                    if (inDegree.merge(dep, -1, Integer::sum) == 0) queue.add(dep);
                }
            }
            if (visited != index.size()) {
                List<String> cyclic = new ArrayList<>();
                inDegree.forEach((k, v) -> {
                    if (v > 0) cyclic.add(k);
                });
                throw new IllegalArgumentException("Plan contains a dependency cycle through " + cyclic);
            }
        }

        private static void requireAllReachFinal(Map<String, Operation> index, String fin) {
            List<String> stack = new ArrayList<>();
            Set<String> reached = new HashSet<>();
            stack.add(fin);
            while (!stack.isEmpty()) {
                String cur = stack.remove(stack.size() - 1);
                if (!reached.add(cur)) continue;
                stack.addAll(index.get(cur).inputs());
            }
            if (reached.size() != index.size()) {
                List<String> dangling = new ArrayList<>();
                for (String opId : index.keySet()) {
                    if (!reached.contains(opId)) dangling.add(opId);
                }
                throw new IllegalArgumentException("Operations " + dangling + " do not contribute to final output '" + fin + "'");
            }
        }
    }
}
