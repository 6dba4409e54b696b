package com.switchboard.gateway.infrastructure.health;

import com.switchboard.observability.ComponentHealth;
import com.switchboard.observability.HealthCheckRegistry;
import com.switchboard.observability.HealthResult;
import com.switchboard.observability.HealthStatus;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Bridges the switchboard's {@link HealthCheckRegistry} into {@code /actuator/health} as the
 * {@code switchboard} component.
 *
 * <p>A degraded switchboard stays {@code UP}: saturated pools affect single tenants, and taking
 * the gateway out of rotation would fail every other tenant too.
 */
@Component("switchboard")
public class SwitchboardHealthIndicator implements HealthIndicator {

    private final HealthCheckRegistry checks;

    public SwitchboardHealthIndicator(HealthCheckRegistry checks) {
        this.checks = checks;
    }

    @Override
    public Health health() {
        HealthResult result = checks.checkAll();
        Health.Builder builder =
                result.status() == HealthStatus.UNHEALTHY ? Health.down() : Health.up();
        builder.withDetail("status", result.status().name());
        result.checks().forEach((name, component) -> builder.withDetail(name, describe(component)));
        return builder.build();
    }

    private static Map<String, Object> describe(ComponentHealth component) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("status", component.status().name());
        if (component.message() != null) {
            detail.put("message", component.message());
        }
        detail.put("latencyMs", component.latencyMs());
        detail.putAll(component.details());
        return detail;
    }
}
