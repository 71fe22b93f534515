/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.model;

public enum FieldRole {
    KEY,
    VALUE,
    TIMESTAMP
}
