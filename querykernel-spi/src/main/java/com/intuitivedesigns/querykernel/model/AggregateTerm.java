/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.model;

import java.util.Locale;
import java.util.Objects;

/**
 * One aggregate column: {@code function(field) AS alias}. COUNT may omit the field.
 */
public record AggregateTerm(AggregateFunction function, String field, String alias) {

    public AggregateTerm {
        Objects.requireNonNull(function, "function");
        if (field != null && field.isBlank()) field = null;
        if (field == null && function != AggregateFunction.COUNT) {
            throw new IllegalArgumentException(function + " requires a field");
        }
        if (alias == null || alias.isBlank()) {
            alias = function.name().toLowerCase(Locale.ROOT) + (field == null ? "" : "_" + field);
        }
    }
}
