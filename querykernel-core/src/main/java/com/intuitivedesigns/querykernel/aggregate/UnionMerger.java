/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.aggregate;

import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.plan.UnionLayout;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Concatenates union inputs in declaration order, renaming per the resolved layout and
 * null-filling fields an input does not produce.
 */
final class UnionMerger {

    private UnionMerger() {}

    /**
     * @param inputs one entry per declared input; null marks an input that is skipped
     */
    static List<ResultRow> merge(UnionLayout layout, List<List<ResultRow>> inputs, boolean distinct) {
        List<FieldSpec> fields = layout.output().fields();
        List<ResultRow> out = new ArrayList<>();
        Set<List<Object>> seen = distinct ? new HashSet<>() : null;

        for (int i = 0; i < inputs.size(); i++) {
            List<ResultRow> rows = inputs.get(i);
            if (rows == null) continue;
            Map<String, String> renames = layout.renames().get(i);

            for (ResultRow row : rows) {
                Map<String, Object> renamed = new LinkedHashMap<>();
                for (Map.Entry<String, Object> e : row.values().entrySet()) {
                    String target = renames.get(e.getKey());
                    if (target != null) renamed.put(target, e.getValue());
                }
                Map<String, Object> values = new LinkedHashMap<>();
                List<Object> identity = new ArrayList<>(fields.size());
                for (FieldSpec f : fields) {
                    Object v = renamed.get(f.name());
                    values.put(f.name(), v);
                    identity.add(v);
                }
                if (seen != null && !seen.add(identity)) continue;
                out.add(new ResultRow(values, row.provenance()));
            }
        }
        return out;
    }
}
