/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.adapter;

/**
 * Failure raised by a {@link SourceAdapter}. The adapter owns the retryable/fatal split.
 */
public class SourceAdapterException extends Exception {

    public enum Reason {
        TIMEOUT(true),
        TRANSIENT(true),
        PERMISSION_DENIED(false),
        MALFORMED_QUERY(false),
        NOT_FOUND(false),
        CANCELLED(false),
        UNKNOWN(false);

        private final boolean retryableByDefault;

        Reason(boolean retryableByDefault) {
            this.retryableByDefault = retryableByDefault;
        }

        public boolean retryableByDefault() {
            return retryableByDefault;
        }
    }

    private final Reason reason;
    private final boolean retryable;

    public SourceAdapterException(Reason reason, String message) {
        this(reason, message, null);
    }

    public SourceAdapterException(Reason reason, String message, Throwable cause) {
        this(reason, reason != null && reason.retryableByDefault(), message, cause);
    }

    public SourceAdapterException(Reason reason, boolean retryable, String message, Throwable cause) {
        super(message, cause);
        this.reason = (reason == null) ? Reason.UNKNOWN : reason;
        this.retryable = retryable;
    }

    public static SourceAdapterException retryable(String message, Throwable cause) {
        return new SourceAdapterException(Reason.TRANSIENT, true, message, cause);
    }

    public static SourceAdapterException fatal(Reason reason, String message) {
        return new SourceAdapterException(reason, false, message, null);
    }

    public Reason reason() {
        return reason;
    }

    public boolean retryable() {
        return retryable;
    }
}
