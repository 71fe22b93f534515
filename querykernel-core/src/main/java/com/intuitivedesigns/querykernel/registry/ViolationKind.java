/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.registry;

public enum ViolationKind {
    UNKNOWN_SOURCE,
    SOURCE_DISABLED,
    UNKNOWN_TABLE,
    UNKNOWN_FIELD,
    FIELD_TYPE_MISMATCH,
    MISSING_JOIN_KEY,
    INCOMPATIBLE_KEY_TYPE,
    UNION_SHAPE_MISMATCH
}
