/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plan;

import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.SemanticType;

import java.util.List;
import java.util.Map;

/**
 * Resolved column mapping of a join.
 *
 * @param keyType      common key type, or null when the declared keys are missing or incompatible
 * @param rightColumns right input field name to output field name; the right key is not carried
 */
public record JoinLayout(SemanticType keyType, Shape output, Map<String, String> rightColumns) {

    public JoinLayout {
        rightColumns = Map.copyOf(rightColumns);
    }

    public boolean joinable() {
        return keyType != null;
    }

    public List<FieldSpec> fields() {
        return output.fields();
    }
}
