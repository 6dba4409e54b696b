package com.switchboard.tenancy;

import com.switchboard.tenancy.routing.TenantBinding;

/**
 * Compares the tenant a request is bound to against the tenant a resource belongs to.
 * <p>
 * Called wherever a request carries a tenant id of its own, such as the tenant header on the
 * tenant API, so a client can never act on one tenant while bound to another.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * Verifies that the binding's tenant matches the resource's tenant.
     *
     * @param binding          the request's tenant binding
     * @param resourceTenantId the tenant id of the resource being accessed
     * @throws TenantMismatchException if the tenants do not match
     */
    public static void enforce(TenantBinding binding, String resourceTenantId) {
        enforce(binding.tenant().tenantId(), resourceTenantId);
    }

    /**
     * Verifies that two tenant ids are the same tenant.
     *
     * @throws TenantMismatchException if they differ or the resource id is null
     */
    public static void enforce(String boundTenantId, String resourceTenantId) {
        if (!boundTenantId.equals(resourceTenantId)) {
            throw new TenantMismatchException(boundTenantId, resourceTenantId);
        }
    }
}
