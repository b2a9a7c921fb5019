package com.tradescheduler.backend.exception;

/**
 * The scheduling engine refused, failed or timed out on a trigger operation.
 */
public class ReconciliationException extends RuntimeException {

    private final boolean timeout;

    public ReconciliationException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public ReconciliationException(String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.timeout = timeout;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
