package com.switchboard.tenancy;

public class TenantSuspendedException extends TenantAccessException {

    private final String tenantId;

    public TenantSuspendedException(String tenantId) {
        super(TenantFailure.SUSPENDED, "Tenant '%s' is suspended".formatted(tenantId));
        this.tenantId = tenantId;
    }

    public String tenantId() {
        return tenantId;
    }
}
