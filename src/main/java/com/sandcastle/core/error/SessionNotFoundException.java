package com.sandcastle.core.error;

public class SessionNotFoundException extends SandcastleException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super(ErrorKind.SESSION_NOT_FOUND, "Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
