/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.registry;

import java.util.Objects;

public record TableRef(String sourceId, String table) implements Comparable<TableRef> {

    public TableRef {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(table, "table");
    }

    public static TableRef parse(String key) {
        int slash = (key == null) ? -1 : key.indexOf('/');
        if (slash <= 0 || slash == key.length() - 1) {
            throw new IllegalArgumentException("Expected 'source/table', got '" + key + "'");
        }
        return new TableRef(key.substring(0, slash), key.substring(slash + 1));
    }

    public String key() {
        return sourceId + "/" + table;
    }

    @Override
    public int compareTo(TableRef o) {
        int c = sourceId.compareTo(o.sourceId);
        return (c != 0) ? c : table.compareTo(o.table);
    }

    @Override
    public String toString() {
        return key();
    }
}
