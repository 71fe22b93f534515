/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.aggregate;

import com.intuitivedesigns.querykernel.error.AggregationException;
import com.intuitivedesigns.querykernel.error.ErrorKind;
import com.intuitivedesigns.querykernel.model.SemanticType;
import com.intuitivedesigns.querykernel.plan.JoinLayout;
import com.intuitivedesigns.querykernel.plan.JoinMode;
import com.intuitivedesigns.querykernel.plan.JoinOperation;
import com.intuitivedesigns.querykernel.types.TypeCoercion;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Equi-join of two row lists.
 *
 * <p>The hash index is built over the smaller side. Output is always left-major: rows of
 * the left input in their original order, each followed by its matches in right order.
 * Null keys never match.</p>
 */
final class HashJoiner {

    private HashJoiner() {}

    static List<ResultRow> join(JoinOperation op, JoinLayout layout, List<ResultRow> left, List<ResultRow> right) {
        if (!layout.joinable()) {
            throw new AggregationException(op.id(), ErrorKind.UNSUPPORTED_COERCION,
                    "Join keys " + op.leftKey() + "/" + op.rightKey() + " have no common comparable type");
        }
        SemanticType keyType = layout.keyType();
        Object[] leftKeys = keys(op, op.leftKey(), left, keyType, "left");
        Object[] rightKeys = keys(op, op.rightKey(), right, keyType, "right");

        // matches.get(i) = right row indexes matching left row i, ascending
        List<List<Integer>> matches = new ArrayList<>(left.size());
        for (int i = 0; i < left.size(); i++) matches.add(new ArrayList<>(1));

        if (left.size() <= right.size()) {
            Map<Object, List<Integer>> index = index(leftKeys);
            for (int r = 0; r < rightKeys.length; r++) {
                if (rightKeys[r] == null) continue;
                List<Integer> hits = index.get(rightKeys[r]);
                if (hits == null) continue;
                for (int l : hits) matches.get(l).add(r);
            }
        } else {
            Map<Object, List<Integer>> index = index(rightKeys);
            for (int l = 0; l < leftKeys.length; l++) {
                if (leftKeys[l] == null) continue;
                List<Integer> hits = index.get(leftKeys[l]);
                if (hits != null) matches.get(l).addAll(hits);
            }
        }

        boolean outer = op.mode() == JoinMode.LEFT;
        List<ResultRow> out = new ArrayList<>();
        for (int l = 0; l < left.size(); l++) {
            ResultRow lr = left.get(l);
            List<Integer> hits = matches.get(l);
            if (hits.isEmpty()) {
                if (outer) out.add(combine(lr, null, layout));
                continue;
            }
            for (int r : hits) out.add(combine(lr, right.get(r), layout));
        }
        return out;
    }

    private static Object[] keys(JoinOperation op, String key, List<ResultRow> rows, SemanticType keyType, String side) {
        Object[] out = new Object[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            ResultRow row = rows.get(i);
            if (!row.has(key)) {
                throw new AggregationException(op.id(), ErrorKind.MISSING_KEY_FIELD,
                        "Row " + i + " of " + side + " input lacks join key '" + key + "'");
            }
            try {
                out[i] = TypeCoercion.joinKey(row.get(key), keyType);
            } catch (AggregationException e) {
                throw e.at(op.id());
            }
        }
        return out;
    }

    private static Map<Object, List<Integer>> index(Object[] keys) {
        Map<Object, List<Integer>> index = new HashMap<>();
        for (int i = 0; i < keys.length; i++) {
            if (keys[i] == null) continue;
            index.computeIfAbsent(keys[i], k -> new ArrayList<>(1)).add(i);
        }
        return index;
    }

    private static ResultRow combine(ResultRow left, ResultRow right, JoinLayout layout) {
        Map<String, Object> values = new LinkedHashMap<>(left.values());
        for (Map.Entry<String, String> col : layout.rightColumns().entrySet()) {
            values.put(col.getValue(), (right == null) ? null : right.get(col.getKey()));
        }
        List<String> prov = (right == null) ? left.provenance() : ResultRow.mergeProvenance(left.provenance(), right.provenance());
        return new ResultRow(values, prov);
    }
}
