/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plan;

public enum JoinMode {
    INNER,
    /** Unmatched left rows are kept with right-side fields set to null. */
    LEFT
}
