package com.switchboard.tenancy.lifecycle;

/**
 * A provisioning executor could not create or destroy a tenant store.
 */
public class ProvisioningFailedException extends RuntimeException {

    private final String tenantId;

    public ProvisioningFailedException(String tenantId, String message) {
        super(message);
        this.tenantId = tenantId;
    }

    public ProvisioningFailedException(String tenantId, String message, Throwable cause) {
        super(message, cause);
        this.tenantId = tenantId;
    }

    public String tenantId() {
        return tenantId;
    }
}
