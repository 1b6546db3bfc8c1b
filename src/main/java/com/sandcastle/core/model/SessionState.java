package com.sandcastle.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a session. {@code CRASHED} and {@code CLOSED} are final.
 */
public enum SessionState {
    INITIALIZING,
    READY,
    BUSY,
    CRASHED,
    CLOSED;

    @JsonValue
    public String wire() {
        return name().toLowerCase();
    }

    public boolean acceptsWork() {
        return this == READY;
    }
}
