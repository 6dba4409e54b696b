package com.switchboard.tenancy;

/**
 * Thrown when a request bound to one tenant touches a resource belonging to another.
 * <p>
 * A mismatch is a programming error in the caller, never a recoverable condition.
 */
public class TenantMismatchException extends RuntimeException {

    private final String boundTenantId;
    private final String resourceTenantId;

    public TenantMismatchException(String boundTenantId, String resourceTenantId) {
        super("Tenant mismatch: request bound to tenant '%s' cannot access resource of tenant '%s'"
                .formatted(boundTenantId, resourceTenantId));
        this.boundTenantId = boundTenantId;
        this.resourceTenantId = resourceTenantId;
    }

    public String boundTenantId() {
        return boundTenantId;
    }

    public String resourceTenantId() {
        return resourceTenantId;
    }
}
