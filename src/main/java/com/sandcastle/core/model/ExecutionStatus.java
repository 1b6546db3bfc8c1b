package com.sandcastle.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a single execution within a session.
 */
public enum ExecutionStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    TIMED_OUT;

    @JsonValue
    public String wire() {
        return name().toLowerCase();
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == TIMED_OUT;
    }
}
