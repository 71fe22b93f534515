/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.registry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ValidationReport(List<Violation> violations) {

    public ValidationReport {
        violations = (violations == null) ? List.of() : List.copyOf(violations);
    }

    public static ValidationReport ok() {
        return new ValidationReport(List.of());
    }

    public boolean valid() {
        return violations.isEmpty();
    }

    /**
     * Violations grouped per operation, in the order operations were first reported.
     */
    public Map<String, List<Violation>> byOperation() {
        Map<String, List<Violation>> out = new LinkedHashMap<>();
        for (Violation v : violations) {
            out.computeIfAbsent(v.operationId(), k -> new ArrayList<>()).add(v);
        }
        return out;
    }

    public List<Violation> forOperation(String operationId) {
        List<Violation> out = new ArrayList<>();
        for (Violation v : violations) {
            if (v.operationId().equals(operationId)) out.add(v);
        }
        return out;
    }
}
