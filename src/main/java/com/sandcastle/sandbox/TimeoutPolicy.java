package com.sandcastle.sandbox;

import com.sandcastle.core.error.ValidationException;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Resolves caller-supplied timeouts. Absent values take the class default;
 * values above the ceiling are clamped to it.
 */
@Component
public class TimeoutPolicy {

    private final SandboxProperties properties;

    public TimeoutPolicy(SandboxProperties properties) {
        this.properties = properties;
    }

    /**
     * @param requestedMs caller's timeout in milliseconds, or null for the default
     * @throws ValidationException if {@code requestedMs} is zero or negative
     */
    public Duration resolve(TimeoutClass timeoutClass, Long requestedMs) {
        SandboxProperties.Window window = window(timeoutClass);
        if (requestedMs == null) {
            return Duration.ofMillis(window.getDefaultMs());
        }
        if (requestedMs <= 0) {
            throw new ValidationException("timeout_ms must be positive, got " + requestedMs);
        }
        return Duration.ofMillis(Math.min(requestedMs, window.getMaxMs()));
    }

    public Duration ceiling(TimeoutClass timeoutClass) {
        return Duration.ofMillis(window(timeoutClass).getMaxMs());
    }

    private SandboxProperties.Window window(TimeoutClass timeoutClass) {
        return switch (timeoutClass) {
            case AD_HOC -> properties.getTimeouts().getAdHoc();
            case LONG_RUNNING -> properties.getTimeouts().getLongRunning();
            case INSTALL -> properties.getTimeouts().getInstall();
        };
    }
}
