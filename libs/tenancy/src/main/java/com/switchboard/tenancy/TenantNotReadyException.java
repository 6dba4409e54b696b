package com.switchboard.tenancy;

/**
 * The tenant exists but its store is still being provisioned.
 */
public class TenantNotReadyException extends TenantAccessException {

    private final String tenantId;
    private final TenantStatus status;

    public TenantNotReadyException(String tenantId, TenantStatus status) {
        super(TenantFailure.NOT_READY, "Tenant '%s' is not ready (status %s)".formatted(tenantId, status));
        this.tenantId = tenantId;
        this.status = status;
    }

    public String tenantId() {
        return tenantId;
    }

    public TenantStatus status() {
        return status;
    }
}
