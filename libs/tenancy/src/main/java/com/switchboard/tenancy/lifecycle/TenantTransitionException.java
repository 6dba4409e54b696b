package com.switchboard.tenancy.lifecycle;

import com.switchboard.tenancy.TenantStatus;

/**
 * A lifecycle transition was refused: the tenant was not in the status the transition starts
 * from, or another writer moved it first.
 */
public class TenantTransitionException extends IllegalStateException {

    private final String tenantId;
    private final TenantStatus target;
    private final TenantStatus actual;

    public TenantTransitionException(String tenantId, TenantStatus target, TenantStatus actual) {
        super("Tenant '%s' cannot move to %s from %s".formatted(tenantId, target, actual));
        this.tenantId = tenantId;
        this.target = target;
        this.actual = actual;
    }

    public String tenantId() {
        return tenantId;
    }

    public TenantStatus target() {
        return target;
    }

    /** Status the registry held when the transition was refused. */
    public TenantStatus actual() {
        return actual;
    }
}
