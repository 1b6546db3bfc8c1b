package com.sandcastle.core.error;

public class CapacityExceededException extends SandcastleException {

    public CapacityExceededException(int maxSessions) {
        super(ErrorKind.CAPACITY_EXCEEDED, "Session limit reached (" + maxSessions + ")");
    }
}
