/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plan;

import java.util.Objects;

/**
 * Field-contract version observed when a plan was built.
 */
public record ContractStamp(long version, String hash) {

    public ContractStamp {
        Objects.requireNonNull(hash, "hash");
    }

    public static String key(String sourceId, String table) {
        return sourceId + "/" + table;
    }
}
