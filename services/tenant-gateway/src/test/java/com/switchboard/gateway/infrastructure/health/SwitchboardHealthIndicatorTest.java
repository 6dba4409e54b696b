package com.switchboard.gateway.infrastructure.health;

import static org.assertj.core.api.Assertions.assertThat;

import com.switchboard.observability.ComponentHealth;
import com.switchboard.observability.HealthCheckRegistry;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

@DisplayName("SwitchboardHealthIndicator")
class SwitchboardHealthIndicatorTest {

    private final HealthCheckRegistry checks = new HealthCheckRegistry();
    private final SwitchboardHealthIndicator indicator = new SwitchboardHealthIndicator(checks);

    @Test
    @DisplayName("UP with component details when all checks pass")
    void upWhenHealthy() {
        checks.register(
                "registry",
                () -> CompletableFuture.completedFuture(
                        ComponentHealth.healthy("registry", 3).withDetails(Map.of("provisioning", 0))));

        var health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("status", "HEALTHY").containsKey("registry");
    }

    @Test
    @DisplayName("stays UP when only a non-critical check fails")
    void upWhenDegraded() {
        checks.register("registry", () -> CompletableFuture.completedFuture(ComponentHealth.healthy("registry", 1)));
        checks.register(
                "store-pools",
                () -> CompletableFuture.completedFuture(ComponentHealth.unhealthy("store-pools", "saturated", 0)),
                false);

        var health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("status", "DEGRADED");
    }

    @Test
    @DisplayName("DOWN when the registry check fails")
    void downWhenRegistryFails() {
        checks.register(
                "registry",
                () -> CompletableFuture.completedFuture(ComponentHealth.unhealthy("registry", "refused", 2)));

        var health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
    }
}
