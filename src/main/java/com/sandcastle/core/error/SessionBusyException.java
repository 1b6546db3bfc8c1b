package com.sandcastle.core.error;

/**
 * Thrown when a submission arrives while the session is still running
 * another execution. Submissions are never queued.
 */
public class SessionBusyException extends SandcastleException {

    public SessionBusyException(String sessionId) {
        super(ErrorKind.SESSION_BUSY, "Session " + sessionId + " is busy with another execution");
    }
}
