package com.sandcastle.core.error;

/**
 * Thrown when a runtime process cannot be started or does not become ready in time.
 */
public class SpawnException extends SandcastleException {

    public SpawnException(String message) {
        super(ErrorKind.SPAWN, message);
    }

    public SpawnException(String message, Throwable cause) {
        super(ErrorKind.SPAWN, message, cause);
    }
}
