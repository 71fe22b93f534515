/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.model;

import java.util.Objects;

/**
 * One field of a table or collection.
 */
public record FieldSpec(String name, SemanticType type, boolean nullable, FieldRole role) {

    public FieldSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        name = name.trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Field name must not be blank");
        }
        if (role == null) role = FieldRole.VALUE;
    }

    public static FieldSpec key(String name, SemanticType type) {
        return new FieldSpec(name, type, false, FieldRole.KEY);
    }

    public static FieldSpec value(String name, SemanticType type) {
        return new FieldSpec(name, type, true, FieldRole.VALUE);
    }

    public static FieldSpec timestamp(String name) {
        return new FieldSpec(name, SemanticType.TIMESTAMP, true, FieldRole.TIMESTAMP);
    }

    public boolean isKey() {
        return role == FieldRole.KEY;
    }
}
