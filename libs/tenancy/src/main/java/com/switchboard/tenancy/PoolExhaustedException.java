package com.switchboard.tenancy;

import java.time.Duration;

/**
 * Every session in the tenant's pool stayed checked out for the whole acquire timeout.
 */
public class PoolExhaustedException extends TenantAccessException {

    private final String tenantId;
    private final Duration waited;

    public PoolExhaustedException(String tenantId, Duration waited) {
        super(TenantFailure.POOL_EXHAUSTED,
                "Pool for tenant '%s' exhausted after waiting %d ms".formatted(tenantId, waited.toMillis()));
        this.tenantId = tenantId;
        this.waited = waited;
    }

    public String tenantId() {
        return tenantId;
    }

    public Duration waited() {
        return waited;
    }
}
