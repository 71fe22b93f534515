/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.planner;

import com.intuitivedesigns.querykernel.config.KernelConfig;
import com.intuitivedesigns.querykernel.plan.JoinMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Immutable planner tuning.
 *
 * @param maxTables          tables per schema context
 * @param maxFieldsPerTable  fields per table in a schema context
 * @param maxContextChars    upper bound on the rendered context
 * @param joinMode           mode used for joins the planner assembles
 * @param maxCandidates      sources the classifier may return
 * @param summarize          whether multi-source plans may get an AGGREGATE step
 */
public record PlannerSettings(int maxTables,
                              int maxFieldsPerTable,
                              int maxContextChars,
                              JoinMode joinMode,
                              int maxCandidates,
                              boolean summarize) {

    private static final Logger log = LoggerFactory.getLogger(PlannerSettings.class);

    public static final String MAX_TABLES_KEY = "planner.context.max.tables";
    public static final String MAX_FIELDS_KEY = "planner.context.max.fields";
    public static final String MAX_CHARS_KEY = "planner.context.max.chars";
    public static final String JOIN_MODE_KEY = "planner.join.mode";
    public static final String MAX_CANDIDATES_KEY = "planner.max.candidates";
    public static final String SUMMARIZE_KEY = "planner.summarize.enabled";

    public PlannerSettings {
        if (maxTables < 1) throw new IllegalArgumentException("maxTables must be >= 1");
        if (maxFieldsPerTable < 1) throw new IllegalArgumentException("maxFieldsPerTable must be >= 1");
        if (maxContextChars < 64) throw new IllegalArgumentException("maxContextChars must be >= 64");
        if (maxCandidates < 1) throw new IllegalArgumentException("maxCandidates must be >= 1");
        if (joinMode == null) joinMode = JoinMode.INNER;
    }

    public static PlannerSettings defaults() {
        return new PlannerSettings(20, 40, 4_000, JoinMode.INNER, 8, true);
    }

    public static PlannerSettings from(KernelConfig config) {
        PlannerSettings d = defaults();
        String rawMode = config.getString(JOIN_MODE_KEY, d.joinMode().name()).trim().toUpperCase(Locale.ROOT);
        JoinMode mode;
        try {
            mode = JoinMode.valueOf(rawMode);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid {}='{}'; using {}", JOIN_MODE_KEY, rawMode, d.joinMode());
            mode = d.joinMode();
        }
        return new PlannerSettings(
                Math.max(1, config.getInt(MAX_TABLES_KEY, d.maxTables())),
                Math.max(1, config.getInt(MAX_FIELDS_KEY, d.maxFieldsPerTable())),
                Math.max(64, config.getInt(MAX_CHARS_KEY, d.maxContextChars())),
                mode,
                Math.max(1, config.getInt(MAX_CANDIDATES_KEY, d.maxCandidates())),
                config.getBoolean(SUMMARIZE_KEY, d.summarize()));
    }
}
