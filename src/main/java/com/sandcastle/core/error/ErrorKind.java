package com.sandcastle.core.error;

/**
 * Stable error categories reported to callers. The {@link #tag()} value is
 * part of the wire contract and must not change.
 */
public enum ErrorKind {
    VALIDATION("validation_error"),
    SESSION_NOT_FOUND("session_not_found"),
    SESSION_BUSY("session_busy"),
    TIMEOUT("timeout"),
    PROCESS_CRASH("process_crash"),
    SPAWN("spawn_error"),
    STORAGE("storage_error"),
    SECURITY_VIOLATION("security_violation"),
    CAPACITY_EXCEEDED("capacity_exceeded");

    private final String tag;

    ErrorKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
