package com.switchboard.observability;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate health result from all registered health checks.
 *
 * @param status    overall status
 * @param checks    individual component results keyed by component name
 * @param timestamp when the checks were run
 */
public record HealthResult(
        HealthStatus status,
        Map<String, ComponentHealth> checks,
        Instant timestamp
) {

    public HealthResult {
        checks = Map.copyOf(checks);
    }
}
