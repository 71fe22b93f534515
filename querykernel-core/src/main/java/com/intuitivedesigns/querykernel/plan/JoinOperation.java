/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plan;

import java.util.List;

public record JoinOperation(
        String id,
        String leftInput,
        String rightInput,
        String leftKey,
        String rightKey,
        JoinMode mode,
        String outputName
) implements Operation {

    public JoinOperation {
        id = OperationIds.require(id, "Operation id");
        leftInput = OperationIds.require(leftInput, "Left input of '" + id + "'");
        rightInput = OperationIds.require(rightInput, "Right input of '" + id + "'");
        if (leftInput.equals(rightInput)) {
            throw new IllegalArgumentException("Join '" + id + "' must combine two distinct inputs");
        }
        leftKey = OperationIds.requireText(leftKey, "Left key of '" + id + "'");
        rightKey = (rightKey == null || rightKey.isBlank()) ? leftKey : rightKey.trim();
        if (mode == null) mode = JoinMode.INNER;
        outputName = OperationIds.outputOr(outputName, id);
    }

    @Override
    public OperationKind kind() {
        return OperationKind.JOIN;
    }

    @Override
    public List<String> inputs() {
        return List.of(leftInput, rightInput);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private String left;
        private String right;
        private String leftKey;
        private String rightKey;
        private JoinMode mode = JoinMode.INNER;
        private String outputName;

        private Builder(String id) {
            this.id = id;
        }

        public Builder left(String inputId) {
            this.left = inputId;
            return this;
        }

        public Builder right(String inputId) {
            this.right = inputId;
            return this;
        }

        /** Same key name on both sides. */
        public Builder on(String key) {
            this.leftKey = key;
            this.rightKey = key;
            return this;
        }

        public Builder on(String leftKey, String rightKey) {
            this.leftKey = leftKey;
            this.rightKey = rightKey;
            return this;
        }

        public Builder mode(JoinMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder output(String outputName) {
            this.outputName = outputName;
            return this;
        }

        public JoinOperation build() {
            return new JoinOperation(id, left, right, leftKey, rightKey, mode, outputName);
        }
    }
}
