/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.model;

import java.time.temporal.Temporal;
import java.util.Date;
import java.util.List;
import java.util.Locale;

/**
 * Source-independent field types. Every value the kernel reconciles is coerced into
 * the canonical Java representation listed per constant.
 */
public enum SemanticType {
    /** {@link String} */
    TEXT,
    /** {@link Long} */
    INTEGER,
    /** {@link Double} */
    FLOAT,
    /** {@link Boolean} */
    BOOLEAN,
    /** UTC epoch millis as {@link Long} */
    TIMESTAMP,
    /** {@code List<Double>} */
    VECTOR;

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }

    public static SemanticType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Semantic type must not be blank");
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Best guess for a sampled value, used by adapters that introspect schemaless stores.
     * Null and unrecognized values map to TEXT.
     */
    public static SemanticType infer(Object value) {
        if (value instanceof Boolean) return BOOLEAN;
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) return INTEGER;
        if (value instanceof Number) return FLOAT;
        if (value instanceof Date || value instanceof Temporal) return TIMESTAMP;
        if (value instanceof List<?> l && !l.isEmpty() && l.get(0) instanceof Number) return VECTOR;
        if (value instanceof double[] || value instanceof float[]) return VECTOR;
        return TEXT;
    }
}
