package com.switchboard.tenancy;

import java.time.Instant;
import java.util.Objects;

/**
 * A customer organisation as recorded in the tenant registry.
 * <p>
 * Records are snapshots: a status change produces a new instance through the registry, never a
 * mutation of this one. The registry is the only place tenants live; tenant stores hold no copy.
 *
 * @param tenantId             unique tenant identifier
 * @param routingKey           subdomain label or custom host the tenant is reached through
 * @param displayName          human-readable organisation name
 * @param storeName            name of the physical store the tenant owns
 * @param status               lifecycle status
 * @param provisioningAttempts failed provisioning attempts since the last success or restart
 * @param lastError            last provisioning or destruction error (nullable)
 * @param createdAt            registration time
 * @param updatedAt            time of the last registry write
 * @param retiredAt            retirement time (null unless {@link TenantStatus#RETIRED})
 * @param storeDestroyedAt     time the retired tenant's store was destroyed (null until then)
 */
public record Tenant(
        String tenantId,
        String routingKey,
        String displayName,
        String storeName,
        TenantStatus status,
        int provisioningAttempts,
        String lastError,
        Instant createdAt,
        Instant updatedAt,
        Instant retiredAt,
        Instant storeDestroyedAt
) {

    public Tenant {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(routingKey, "routingKey");
        Objects.requireNonNull(storeName, "storeName");
        Objects.requireNonNull(status, "status");
    }

    /**
     * Creates a freshly registered tenant in {@link TenantStatus#PENDING}.
     */
    public static Tenant pending(String tenantId, String routingKey, String displayName,
                                 String storeName, Instant now) {
        return new Tenant(tenantId, routingKey, displayName, storeName, TenantStatus.PENDING,
                0, null, now, now, null, null);
    }

    /**
     * Returns a copy in the given status, stamped at {@code at}. Entering
     * {@link TenantStatus#RETIRED} also stamps {@code retiredAt}.
     */
    public Tenant withStatus(TenantStatus next, Instant at) {
        return new Tenant(tenantId, routingKey, displayName, storeName, next, provisioningAttempts,
                lastError, createdAt, at, next == TenantStatus.RETIRED ? at : retiredAt, storeDestroyedAt);
    }

    /**
     * Returns a copy with updated provisioning bookkeeping.
     */
    public Tenant withProvisioningAttempts(int attempts, String error, Instant at) {
        return new Tenant(tenantId, routingKey, displayName, storeName, status, attempts, error,
                createdAt, at, retiredAt, storeDestroyedAt);
    }

    /**
     * Returns a copy recording that the tenant's store no longer exists.
     */
    public Tenant withStoreDestroyed(Instant at) {
        return new Tenant(tenantId, routingKey, displayName, storeName, status, provisioningAttempts,
                lastError, createdAt, at, retiredAt, at);
    }
}
