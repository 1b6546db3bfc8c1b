package com.sandcastle.core.error;

/**
 * Base class for all failures surfaced by the session manager.
 * Each subclass maps to exactly one {@link ErrorKind}.
 */
public abstract class SandcastleException extends RuntimeException {

    private final ErrorKind kind;

    protected SandcastleException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected SandcastleException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
