/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.planner;

import com.intuitivedesigns.querykernel.plan.Plan;

import java.util.List;
import java.util.Objects;

/**
 * @param diagnostics sources dropped, repairs applied and similar notes; never fatal
 */
public record PlanningResult(Plan plan, List<String> diagnostics) {

    public PlanningResult {
        Objects.requireNonNull(plan, "plan");
        diagnostics = (diagnostics == null) ? List.of() : List.copyOf(diagnostics);
    }
}
