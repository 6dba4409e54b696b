package com.switchboard.tenancy.registry;

import com.switchboard.tenancy.Tenant;
import com.switchboard.tenancy.TenantStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The shared tenant registry. Never tenant-scoped: every method sees every tenant.
 * <p>
 * Status writes go exclusively through {@link #compareAndSetStatus}, which is atomic per tenant.
 * Two concurrent transitions from the same observed status cannot both succeed.
 */
public interface TenantRegistry {

    Optional<Tenant> findByRoutingKey(String routingKey);

    Optional<Tenant> findById(String tenantId);

    /**
     * Lists tenants whose status is one of {@code statuses}, ordered by creation time.
     */
    List<Tenant> findByStatus(Set<TenantStatus> statuses);

    /**
     * Inserts a new tenant.
     *
     * @throws DuplicateTenantException if the id, routing key or store name is taken
     */
    Tenant create(Tenant tenant);

    /**
     * Atomically moves a tenant from {@code expected} to {@code next}. Entering
     * {@link TenantStatus#RETIRED} also stamps the retirement time.
     *
     * @return the updated tenant, or empty if the tenant is absent or no longer in
     *         {@code expected}
     */
    Optional<Tenant> compareAndSetStatus(String tenantId, TenantStatus expected, TenantStatus next, Instant at);

    /**
     * Records provisioning bookkeeping without touching the status.
     */
    Optional<Tenant> updateProvisioningAttempts(String tenantId, int attempts, String lastError, Instant at);

    /**
     * Records that a retired tenant's store has been destroyed. Only a retired tenant can be
     * marked.
     *
     * @return the updated tenant, or empty if the tenant is absent or not retired
     */
    Optional<Tenant> markStoreDestroyed(String tenantId, Instant at);
}
