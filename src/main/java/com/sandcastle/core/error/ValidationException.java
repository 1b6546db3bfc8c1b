package com.sandcastle.core.error;

/**
 * Thrown when a request is malformed or exceeds a configured limit.
 */
public class ValidationException extends SandcastleException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
