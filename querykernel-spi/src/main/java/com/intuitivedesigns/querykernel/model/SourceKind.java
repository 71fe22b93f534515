/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.model;

/**
 * Storage family of a source. Drives adapter selection, per-kind concurrency limits
 * and the shape of the query payload a generator must produce.
 */
public enum SourceKind {
    RELATIONAL,
    DOCUMENT,
    VECTOR,
    MESSAGE_LOG
}
