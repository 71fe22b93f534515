/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plan;

import java.util.List;
import java.util.Map;

/**
 * Resolved column mapping of a union.
 *
 * @param renames per input (declaration order): input field name to output field name
 */
public record UnionLayout(Shape output, List<Map<String, String>> renames) {

    public UnionLayout {
        renames = List.copyOf(renames);
    }
}
