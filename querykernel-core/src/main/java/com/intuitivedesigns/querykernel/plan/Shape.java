/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plan;

import com.intuitivedesigns.querykernel.model.FieldSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered output fields of one operation.
 */
public record Shape(List<FieldSpec> fields) {

    public Shape {
        fields = (fields == null) ? List.of() : List.copyOf(fields);
    }

    public Optional<FieldSpec> field(String name) {
        for (FieldSpec f : fields) {
            if (f.name().equals(name)) return Optional.of(f);
        }
        return Optional.empty();
    }

    public boolean has(String name) {
        return field(name).isPresent();
    }

    public List<String> names() {
        List<String> out = new ArrayList<>(fields.size());
        for (FieldSpec f : fields) out.add(f.name());
        return out;
    }
}
