/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.spi;

public enum PluginKind {
    SOURCE_ADAPTER,
    GENERATOR,
    CACHE
}
