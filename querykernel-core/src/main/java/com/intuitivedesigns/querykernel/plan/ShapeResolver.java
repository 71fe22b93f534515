/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plan;

import com.intuitivedesigns.querykernel.model.AggregateFunction;
import com.intuitivedesigns.querykernel.model.AggregateTerm;
import com.intuitivedesigns.querykernel.model.FieldRole;
import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.SemanticType;
import com.intuitivedesigns.querykernel.registry.Violation;
import com.intuitivedesigns.querykernel.registry.ViolationKind;
import com.intuitivedesigns.querykernel.types.TypeCoercion;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Derives the output shape of every operation from declared fetch fields.
 *
 * <p>The same rules drive validation and row merging, so both agree on column names:
 * <ul>
 *   <li>join: all left fields, then right fields minus the right key; a right field whose
 *       name is already taken is renamed {@code <rightLabel>.<name>};</li>
 *   <li>union: first occurrence of a name wins; a later input declaring the same name with
 *       a different type contributes {@code <inputLabel>.<name>} instead;</li>
 *   <li>aggregate: group-by fields, then one column per term alias.</li>
 * </ul>
 * The label of a fetch is its source id; a join carries the label of its left input;
 * other operations are labelled by their id.</p>
 */
public final class ShapeResolver {

    private final Plan plan;
    private final Map<String, Shape> shapes = new HashMap<>();
    private final Map<String, JoinLayout> joins = new HashMap<>();
    private final Map<String, UnionLayout> unions = new HashMap<>();
    private final List<Violation> violations = new ArrayList<>();

    private ShapeResolver(Plan plan) {
        this.plan = plan;
    }

    public static ShapeResolver resolve(Plan plan) {
        ShapeResolver r = new ShapeResolver(plan);
        for (String opId : plan.dag().topologicalOrder()) {
            r.resolveOne(plan.require(opId));
        }
        return r;
    }

    public Shape shape(String opId) {
        Shape s = shapes.get(opId);
        if (s == null) throw new IllegalArgumentException("Unknown operation '" + opId + "'");
        return s;
    }

    public JoinLayout joinLayout(String opId) {
        return joins.get(opId);
    }

    public UnionLayout unionLayout(String opId) {
        return unions.get(opId);
    }

    /**
     * Structural problems of local operations (missing keys, incompatible key types,
     * unknown aggregate fields, union collisions).
     */
    public List<Violation> violations() {
        return List.copyOf(violations);
    }

    public String label(String opId) {
        Operation op = plan.require(opId);
        if (op instanceof FetchOperation f) return f.sourceId();
        if (op instanceof JoinOperation j) return label(j.leftInput());
        return op.id();
    }

    private void resolveOne(Operation op) {
        if (op instanceof FetchOperation f) {
            shapes.put(f.id(), new Shape(f.fields()));
        } else if (op instanceof JoinOperation j) {
            JoinLayout layout = join(j, shape(j.leftInput()), shape(j.rightInput()), label(j.rightInput()), violations::add);
            joins.put(j.id(), layout);
            shapes.put(j.id(), layout.output());
        } else if (op instanceof UnionOperation u) {
            List<Shape> inputs = new ArrayList<>();
            List<String> labels = new ArrayList<>();
            for (String in : u.inputs()) {
                inputs.add(shape(in));
                labels.add(label(in));
            }
            UnionLayout layout = union(u.id(), inputs, labels, violations::add);
            unions.put(u.id(), layout);
            shapes.put(u.id(), layout.output());
        } else if (op instanceof AggregateOperation a) {
            shapes.put(a.id(), aggregate(a, shape(a.input()), violations::add));
        } else {
            throw new IllegalStateException("Unhandled operation type: " + op.getClass().getName());
        }
    }

    // --- rules, usable on partial plans by the planner ---

    public static JoinLayout join(JoinOperation op, Shape left, Shape right, String rightLabel, Consumer<Violation> sink) {
        Optional<FieldSpec> lk = left.field(op.leftKey());
        Optional<FieldSpec> rk = right.field(op.rightKey());
        SemanticType keyType = null;

        if (lk.isEmpty()) {
            sink.accept(new Violation(op.id(), ViolationKind.MISSING_JOIN_KEY, op.leftKey(), null, null,
                    "Join key '" + op.leftKey() + "' is not produced by left input '" + op.leftInput() + "'"));
        }
        if (rk.isEmpty()) {
            sink.accept(new Violation(op.id(), ViolationKind.MISSING_JOIN_KEY, op.rightKey(), null, null,
                    "Join key '" + op.rightKey() + "' is not produced by right input '" + op.rightInput() + "'"));
        }
        if (lk.isPresent() && rk.isPresent()) {
            Optional<SemanticType> common = TypeCoercion.joinKeyType(lk.get().type(), rk.get().type());
            if (common.isPresent()) {
                keyType = common.get();
            } else {
                sink.accept(new Violation(op.id(), ViolationKind.INCOMPATIBLE_KEY_TYPE, op.leftKey(),
                        lk.get().type().name(), rk.get().type().name(),
                        "Join keys " + op.leftKey() + ":" + lk.get().type() + " and " + op.rightKey() + ":"
                                + rk.get().type() + " have no common comparable type"));
            }
        }

        boolean outer = op.mode() == JoinMode.LEFT;
        List<FieldSpec> out = new ArrayList<>(left.fields());
        Set<String> taken = new HashSet<>(left.names());
        Map<String, String> rightColumns = new LinkedHashMap<>();
        for (FieldSpec f : right.fields()) {
            if (f.name().equals(op.rightKey())) continue;
            String name = taken.contains(f.name()) ? uniqueName(rightLabel + "." + f.name(), taken) : f.name();
            taken.add(name);
            rightColumns.put(f.name(), name);
            FieldRole role = f.role() == FieldRole.KEY ? FieldRole.VALUE : f.role();
            out.add(new FieldSpec(name, f.type(), f.nullable() || outer, role));
        }
        return new JoinLayout(keyType, new Shape(out), rightColumns);
    }

    public static UnionLayout union(String opId, List<Shape> inputs, List<String> labels, Consumer<Violation> sink) {
        Map<String, FieldSpec> out = new LinkedHashMap<>();
        Map<String, Integer> contributors = new HashMap<>();
        List<Map<String, String>> renames = new ArrayList<>(inputs.size());

        for (int i = 0; i < inputs.size(); i++) {
            Map<String, String> mapping = new LinkedHashMap<>();
            for (FieldSpec f : inputs.get(i).fields()) {
                String name = f.name();
                FieldSpec existing = out.get(name);
                if (existing != null && existing.type() != f.type()) {
                    String prefixed = labels.get(i) + "." + f.name();
                    FieldSpec clash = out.get(prefixed);
                    if (clash != null && clash.type() != f.type()) {
                        sink.accept(new Violation(opId, ViolationKind.UNION_SHAPE_MISMATCH, f.name(),
                                clash.type().name(), f.type().name(),
                                "Union input '" + labels.get(i) + "' declares '" + f.name() + "' as " + f.type()
                                        + ", conflicting with " + clash.type() + " from the same label"));
                        continue;
                    }
                    name = prefixed;
                    existing = clash;
                }
                if (existing == null) {
                    out.put(name, new FieldSpec(name, f.type(), f.nullable(), f.role()));
                } else if (f.nullable() && !existing.nullable()) {
                    out.put(name, new FieldSpec(name, existing.type(), true, existing.role()));
                }
                mapping.put(f.name(), name);
                contributors.merge(name, 1, Integer::sum);
            }
            renames.add(mapping);
        }

        List<FieldSpec> fields = new ArrayList<>(out.size());
        for (FieldSpec f : out.values()) {
            boolean everywhere = contributors.getOrDefault(f.name(), 0) == inputs.size();
            fields.add(everywhere ? f : new FieldSpec(f.name(), f.type(), true, f.role()));
        }
        return new UnionLayout(new Shape(fields), renames);
    }

    public static Shape aggregate(AggregateOperation op, Shape input, Consumer<Violation> sink) {
        List<FieldSpec> out = new ArrayList<>();
        for (String g : op.groupBy()) {
            Optional<FieldSpec> f = input.field(g);
            if (f.isEmpty()) {
                sink.accept(new Violation(op.id(), ViolationKind.UNKNOWN_FIELD, g, null, null,
                        "Group-by field '" + g + "' is not produced by input '" + op.input() + "'"));
                out.add(FieldSpec.value(g, SemanticType.TEXT));
            } else {
                out.add(new FieldSpec(g, f.get().type(), f.get().nullable(), FieldRole.KEY));
            }
        }
        for (AggregateTerm t : op.terms()) {
            out.add(termField(op, t, input, sink));
        }
        return new Shape(out);
    }

    private static FieldSpec termField(AggregateOperation op, AggregateTerm t, Shape input, Consumer<Violation> sink) {
        if (t.function() == AggregateFunction.COUNT && t.field() == null) {
            return new FieldSpec(t.alias(), SemanticType.INTEGER, false, FieldRole.VALUE);
        }
        Optional<FieldSpec> src = input.field(t.field());
        if (src.isEmpty()) {
            sink.accept(new Violation(op.id(), ViolationKind.UNKNOWN_FIELD, t.field(), null, null,
                    t.function() + " field '" + t.field() + "' is not produced by input '" + op.input() + "'"));
            return FieldSpec.value(t.alias(), SemanticType.FLOAT);
        }
        SemanticType type = src.get().type();
        switch (t.function()) {
            case COUNT:
                return new FieldSpec(t.alias(), SemanticType.INTEGER, false, FieldRole.VALUE);
            case SUM:
            case AVG:
                if (!type.isNumeric()) {
                    sink.accept(new Violation(op.id(), ViolationKind.FIELD_TYPE_MISMATCH, t.field(),
                            "INTEGER|FLOAT", type.name(), t.function() + " needs a numeric field, '" + t.field() + "' is " + type));
                    return FieldSpec.value(t.alias(), SemanticType.FLOAT);
                }
                SemanticType result = (t.function() == AggregateFunction.SUM) ? type : SemanticType.FLOAT;
                return FieldSpec.value(t.alias(), result);
            case MIN:
            case MAX:
            default:
                if (type == SemanticType.VECTOR) {
                    sink.accept(new Violation(op.id(), ViolationKind.FIELD_TYPE_MISMATCH, t.field(),
                            "comparable", type.name(), t.function() + " cannot order VECTOR field '" + t.field() + "'"));
                }
                return FieldSpec.value(t.alias(), type);
        }
    }

    private static String uniqueName(String base, Set<String> taken) {
        if (!taken.contains(base)) return base;
        int n = 2;
        while (taken.contains(base + "_" + n)) n++;
        return base + "_" + n;
    }
}
