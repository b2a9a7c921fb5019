package com.tradescheduler.backend.model;

import java.util.Locale;

/**
 * Classification of a failed order submission. The lower-case name is what
 * ends up in the execution record reason, e.g. {@code failed: timeout}.
 */
public enum FailureKind {
    TIMEOUT,
    REJECTED,
    RATE_LIMITED,
    UNAVAILABLE,
    ERROR;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
