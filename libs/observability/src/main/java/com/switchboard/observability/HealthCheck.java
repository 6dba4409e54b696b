package com.switchboard.observability;

import java.util.concurrent.CompletableFuture;

/**
 * A single health check.
 * <p>
 * Implementations perform a lightweight check of a dependency (the tenant registry, the pool
 * set) and return the result asynchronously. {@link HealthCheckRegistry} runs all checks
 * concurrently.
 * <pre>{@code
 * HealthCheck registryCheck = () -> CompletableFuture.supplyAsync(() -> {
 *     long start = System.currentTimeMillis();
 *     registry.findByStatus(Set.of(TenantStatus.ACTIVE));
 *     return ComponentHealth.healthy("registry", System.currentTimeMillis() - start);
 * });
 * }</pre>
 */
@FunctionalInterface
public interface HealthCheck {

    /**
     * Performs a health check and returns the result asynchronously.
     *
     * @return a future that completes with the component health result
     */
    CompletableFuture<ComponentHealth> check();
}
