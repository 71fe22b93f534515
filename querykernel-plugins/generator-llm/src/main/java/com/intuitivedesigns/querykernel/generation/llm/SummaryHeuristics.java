/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.generation.llm;

import com.intuitivedesigns.querykernel.generation.AggregateSpec;
import com.intuitivedesigns.querykernel.model.AggregateFunction;
import com.intuitivedesigns.querykernel.model.AggregateTerm;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Keyword summary detection for mock mode: "how many ... by region", "average amount", etc.
 */
final class SummaryHeuristics {

    private SummaryHeuristics() {}

    static Optional<AggregateSpec> detect(String question, List<String> availableFields) {
        Set<String> tokens = PayloadTemplates.tokens(question);
        List<String> words = new ArrayList<>(tokens);

        AggregateFunction fn = null;
        if (tokens.contains("average") || tokens.contains("avg") || tokens.contains("mean")) fn = AggregateFunction.AVG;
        else if (tokens.contains("total") || tokens.contains("sum")) fn = AggregateFunction.SUM;
        else if (tokens.contains("maximum") || tokens.contains("highest") || tokens.contains("max")) fn = AggregateFunction.MAX;
        else if (tokens.contains("minimum") || tokens.contains("lowest") || tokens.contains("min")) fn = AggregateFunction.MIN;
        else if (tokens.contains("count") || (tokens.contains("how") && tokens.contains("many"))) fn = AggregateFunction.COUNT;
        if (fn == null) return Optional.empty();

        List<String> groupBy = new ArrayList<>();
        int by = words.indexOf("by");
        if (by >= 0 && by + 1 < words.size()) {
            String target = fieldFor(Set.of(words.get(by + 1)), availableFields, null);
            if (target != null) groupBy.add(target);
        }

        if (fn == AggregateFunction.COUNT) {
            return Optional.of(new AggregateSpec(groupBy, List.of(new AggregateTerm(fn, null, "count"))));
        }
        String field = fieldFor(tokens, availableFields, groupBy.isEmpty() ? null : groupBy.get(0));
        if (field == null) return Optional.empty();
        return Optional.of(new AggregateSpec(groupBy, List.of(new AggregateTerm(fn, field, null))));
    }

    private static String fieldFor(Set<String> tokens, List<String> fields, String exclude) {
        Iterator<String> it = fields.iterator();
        while (it.hasNext()) {
            String f = it.next();
            if (f.equals(exclude)) continue;
            if (PayloadTemplates.mentions(tokens, f)) return f;
        }
        return null;
    }
}
