package com.switchboard.tenancy;

/**
 * The tenant's store could not be reached after all open attempts.
 */
public class StoreUnavailableException extends TenantAccessException {

    private final String tenantId;

    public StoreUnavailableException(String tenantId, Throwable cause) {
        super(TenantFailure.STORE_UNAVAILABLE,
                "Store for tenant '%s' is unavailable".formatted(tenantId), cause);
        this.tenantId = tenantId;
    }

    public String tenantId() {
        return tenantId;
    }
}
