package com.tradescheduler.backend.model;

public enum ExecutionOutcome {
    SUCCESS,
    FAILED,
    SKIPPED
}
