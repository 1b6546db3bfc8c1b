package com.sandcastle.core.error;

/**
 * Thrown when submitted code is rejected by a security policy.
 */
public class SecurityViolationException extends SandcastleException {

    public SecurityViolationException(String message) {
        super(ErrorKind.SECURITY_VIOLATION, message);
    }

    public SecurityViolationException(String message, Throwable cause) {
        super(ErrorKind.SECURITY_VIOLATION, message, cause);
    }
}
