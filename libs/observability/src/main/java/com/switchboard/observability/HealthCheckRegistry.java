package com.switchboard.observability;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Aggregates {@link HealthCheck} instances and runs them concurrently to produce one
 * {@link HealthResult}.
 * <p>
 * Checks are registered as <em>critical</em> or <em>non-critical</em>. A failing critical check
 * (the tenant registry) makes the aggregate {@link HealthStatus#UNHEALTHY}. A failing
 * non-critical check (one tenant's store) only degrades it, because other tenants keep being
 * served. Checks that exceed the timeout count as failed.
 */
public final class HealthCheckRegistry {

    /** Default timeout for individual health checks (5 seconds). */
    public static final long DEFAULT_TIMEOUT_MS = 5000;

    private record Registration(HealthCheck check, boolean critical) {}

    private final Map<String, Registration> checks = new ConcurrentHashMap<>();
    private final long timeoutMs;

    /**
     * Creates a registry with the default timeout.
     */
    public HealthCheckRegistry() {
        this(DEFAULT_TIMEOUT_MS);
    }

    /**
     * Creates a registry with a custom timeout.
     *
     * @param timeoutMs timeout in milliseconds for each individual health check
     */
    public HealthCheckRegistry(long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        this.timeoutMs = timeoutMs;
    }

    /**
     * Registers a critical health check. Replaces any existing check for the same name.
     */
    public void register(String name, HealthCheck check) {
        register(name, check, true);
    }

    /**
     * Registers a health check under the given component name.
     *
     * @param name     component name (e.g., "registry", "store-pools")
     * @param check    the health check to register
     * @param critical whether a failure makes the whole gateway unhealthy
     */
    public void register(String name, HealthCheck check, boolean critical) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, new Registration(check, critical));
    }

    /**
     * Runs all registered checks concurrently and aggregates the results.
     *
     * @return the aggregate health result ({@link HealthStatus#HEALTHY} when nothing is registered)
     */
    public HealthResult checkAll() {
        Map<String, CompletableFuture<ComponentHealth>> futures = new LinkedHashMap<>();
        Map<String, Boolean> criticality = new LinkedHashMap<>();
        checks.forEach((name, registration) -> {
            criticality.put(name, registration.critical());
            futures.put(name, startCheck(name, registration.check()));
        });

        Map<String, ComponentHealth> results = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.HEALTHY;
        for (Map.Entry<String, CompletableFuture<ComponentHealth>> entry : futures.entrySet()) {
            String name = entry.getKey();
            ComponentHealth result;
            try {
                result = entry.getValue().orTimeout(timeoutMs, TimeUnit.MILLISECONDS).join();
            } catch (RuntimeException e) {
                result = ComponentHealth.unhealthy(name, "Timeout or error: " + e.getMessage(), timeoutMs);
            }
            results.put(name, result);
            overall = overall.worst(contribution(result.status(), criticality.get(name)));
        }
        return new HealthResult(overall, results, Instant.now());
    }

    /**
     * Returns the number of registered health checks.
     */
    public int size() {
        return checks.size();
    }

    private static CompletableFuture<ComponentHealth> startCheck(String name, HealthCheck check) {
        try {
            CompletableFuture<ComponentHealth> future = check.check();
            return future != null
                    ? future
                    : CompletableFuture.completedFuture(ComponentHealth.unhealthy(name, "check returned null", 0));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static HealthStatus contribution(HealthStatus status, boolean critical) {
        if (status == HealthStatus.UNHEALTHY && !critical) {
            return HealthStatus.DEGRADED;
        }
        return status;
    }
}
