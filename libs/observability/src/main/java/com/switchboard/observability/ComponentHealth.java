package com.switchboard.observability;

import java.util.Map;

/**
 * Health result for a single component.
 *
 * @param name      component name (e.g., "registry", "store-pools")
 * @param status    health status of this component
 * @param message   optional human-readable message (e.g., error details)
 * @param latencyMs time taken to check this component (in milliseconds)
 * @param details   component-specific details (pool counts, exhausted tenants)
 */
public record ComponentHealth(
        String name,
        HealthStatus status,
        String message,
        long latencyMs,
        Map<String, Object> details
) {

    public ComponentHealth {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    /** Creates a healthy component result. */
    public static ComponentHealth healthy(String name, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.HEALTHY, null, latencyMs, Map.of());
    }

    /** Creates a degraded component result. */
    public static ComponentHealth degraded(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.DEGRADED, message, latencyMs, Map.of());
    }

    /** Creates an unhealthy component result. */
    public static ComponentHealth unhealthy(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.UNHEALTHY, message, latencyMs, Map.of());
    }

    /** Returns a copy carrying the given details. */
    public ComponentHealth withDetails(Map<String, Object> details) {
        return new ComponentHealth(name, status, message, latencyMs, details);
    }
}
