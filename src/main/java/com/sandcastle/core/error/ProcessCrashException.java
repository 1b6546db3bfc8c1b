package com.sandcastle.core.error;

/**
 * Thrown when work is submitted to a session whose runtime process has died
 * or was killed after a timeout.
 */
public class ProcessCrashException extends SandcastleException {

    public ProcessCrashException(String message) {
        super(ErrorKind.PROCESS_CRASH, message);
    }

    public ProcessCrashException(String message, Throwable cause) {
        super(ErrorKind.PROCESS_CRASH, message, cause);
    }
}
