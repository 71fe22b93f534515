/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plan;

import java.util.regex.Pattern;

final class OperationIds {

    private static final Pattern VALID = Pattern.compile("[A-Za-z0-9_.:-]{1,128}");

    private OperationIds() {}

    static String require(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " must not be blank");
        }
        String t = value.trim();
        if (!VALID.matcher(t).matches()) {
            throw new IllegalArgumentException(what + " has invalid characters: '" + value + "'");
        }
        return t;
    }

    static String requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " must not be blank");
        }
        return value.trim();
    }

    static String outputOr(String outputName, String id) {
        return (outputName == null || outputName.isBlank()) ? id : outputName.trim();
    }
}
