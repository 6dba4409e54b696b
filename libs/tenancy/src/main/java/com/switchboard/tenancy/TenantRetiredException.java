package com.switchboard.tenancy;

/**
 * The tenant has been retired, or is sealed for retirement in the switchboard.
 */
public class TenantRetiredException extends TenantAccessException {

    private final String tenantId;

    public TenantRetiredException(String tenantId) {
        super(TenantFailure.RETIRED, "Tenant '%s' is retired".formatted(tenantId));
        this.tenantId = tenantId;
    }

    public String tenantId() {
        return tenantId;
    }
}
