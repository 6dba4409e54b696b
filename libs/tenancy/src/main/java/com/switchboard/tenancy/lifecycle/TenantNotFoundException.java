package com.switchboard.tenancy.lifecycle;

/**
 * An administrative operation named a tenant id the registry does not know.
 */
public class TenantNotFoundException extends RuntimeException {

    private final String tenantId;

    public TenantNotFoundException(String tenantId) {
        super("Tenant '%s' not found".formatted(tenantId));
        this.tenantId = tenantId;
    }

    public String tenantId() {
        return tenantId;
    }
}
