package com.sandcastle.core.health;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of probing one dependency of the session service: the interpreter,
 * the scratch root or the blob store.
 *
 * @param component short name used as the key in health reports
 * @param status    probe outcome
 * @param detail    one line for operators
 * @param metadata  extra facts such as the probed path; never null
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {

    /**
     * DOWN means sessions cannot be served at all. DEGRADED means they can,
     * with reduced output handling.
     */
    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static HealthStatus up(String component, String detail) {
        return new HealthStatus(component, Status.UP, detail, Map.of());
    }

    public static HealthStatus degraded(String component, String detail) {
        return new HealthStatus(component, Status.DEGRADED, detail, Map.of());
    }

    public static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of());
    }

    public HealthStatus with(String key, String value) {
        var extended = new LinkedHashMap<>(metadata);
        extended.put(key, value);
        return new HealthStatus(component, status, detail, extended);
    }

    /**
     * Worst status among {@code checks}; UP when there are none.
     */
    public static Status overall(Collection<HealthStatus> checks) {
        Status worst = Status.UP;
        for (HealthStatus check : checks) {
            if (check.status().compareTo(worst) > 0) {
                worst = check.status();
            }
        }
        return worst;
    }
}
