/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.aggregate;

import com.intuitivedesigns.querykernel.error.AggregationException;
import com.intuitivedesigns.querykernel.error.ErrorKind;
import com.intuitivedesigns.querykernel.model.AggregateTerm;
import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.SemanticType;
import com.intuitivedesigns.querykernel.plan.AggregateOperation;
import com.intuitivedesigns.querykernel.plan.Shape;
import com.intuitivedesigns.querykernel.types.TypeCoercion;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups rows in first-seen order and folds each term.
 *
 * <p>Without group-by fields there is exactly one group, even over zero rows; SUM, AVG, MIN
 * and MAX of an empty group are null and COUNT is 0.</p>
 */
final class GroupAggregator {

    private GroupAggregator() {}

    static List<ResultRow> aggregate(AggregateOperation op, Shape output, List<ResultRow> rows) {
        Map<List<Object>, Group> groups = new LinkedHashMap<>();
        if (op.groupBy().isEmpty()) {
            groups.put(List.of(), new Group(op.terms().size()));
        }

        for (ResultRow row : rows) {
            List<Object> key = new ArrayList<>(op.groupBy().size());
            for (String g : op.groupBy()) key.add(row.get(g));
            Group group = groups.computeIfAbsent(key, k -> new Group(op.terms().size()));
            group.provenance.addAll(row.provenance());
            for (int t = 0; t < op.terms().size(); t++) {
                AggregateTerm term = op.terms().get(t);
                group.accumulators[t].add(term, (term.field() == null) ? null : row.get(term.field()));
            }
        }

        List<ResultRow> out = new ArrayList<>(groups.size());
        for (Map.Entry<List<Object>, Group> e : groups.entrySet()) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (int g = 0; g < op.groupBy().size(); g++) {
                values.put(op.groupBy().get(g), e.getKey().get(g));
            }
            for (int t = 0; t < op.terms().size(); t++) {
                AggregateTerm term = op.terms().get(t);
                SemanticType type = output.field(term.alias()).map(FieldSpec::type).orElse(SemanticType.FLOAT);
                values.put(term.alias(), e.getValue().accumulators[t].result(term, type));
            }
            out.add(new ResultRow(values, new ArrayList<>(e.getValue().provenance)));
        }
        return out;
    }

    private static final class Group {
        final Accumulator[] accumulators;
        final Set<String> provenance = new LinkedHashSet<>();

        Group(int terms) {
            accumulators = new Accumulator[terms];
            for (int i = 0; i < terms; i++) accumulators[i] = new Accumulator();
        }
    }

    private static final class Accumulator {
        long rows;
        long nonNull;
        long longSum;
        boolean longOverflow;
        double doubleSum;
        Object best;

        void add(AggregateTerm term, Object value) {
            rows++;
            if (value == null) return;
            nonNull++;
            switch (term.function()) {
                case SUM:
                case AVG:
                    if (!(value instanceof Number n)) {
                        throw new AggregationException(ErrorKind.UNSUPPORTED_COERCION,
                                term.function() + " over non-numeric value of '" + term.field() + "'");
                    }
                    if (!longOverflow) {
                        try {
                            longSum = Math.addExact(longSum, n.longValue());
                        } catch (ArithmeticException e) {
                            longOverflow = true;
                        }
                    }
                    doubleSum += n.doubleValue();
                    break;
                case MIN:
                    if (best == null || TypeCoercion.compare(value, best) < 0) best = value;
                    break;
                case MAX:
                    if (best == null || TypeCoercion.compare(value, best) > 0) best = value;
                    break;
                default:
                    break;
            }
        }

        Object result(AggregateTerm term, SemanticType type) {
            switch (term.function()) {
                case COUNT:
                    return (term.field() == null) ? rows : nonNull;
                case SUM:
                    if (nonNull == 0) return null;
                    if (type != SemanticType.INTEGER) return doubleSum;
                    if (longOverflow) {
                        throw new AggregationException(ErrorKind.UNSUPPORTED_COERCION,
                                "SUM of '" + term.field() + "' overflows INTEGER");
                    }
                    return longSum;
                case AVG:
                    return (nonNull == 0) ? null : doubleSum / nonNull;
                case MIN:
                case MAX:
                default:
                    return best;
            }
        }
    }
}
