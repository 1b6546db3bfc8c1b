package com.sandcastle.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Sandcastle-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setExecution(String sessionId, int executionIndex) {
        MDC.put("sessionId", sessionId);
        MDC.put("executionIndex", String.valueOf(executionIndex));
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("executionIndex");
    }
}
