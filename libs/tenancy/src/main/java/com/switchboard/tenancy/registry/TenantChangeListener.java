package com.switchboard.tenancy.registry;

import com.switchboard.tenancy.Tenant;

/**
 * Notified after a tenant's registry record changed on this node.
 */
@FunctionalInterface
public interface TenantChangeListener {

    void tenantChanged(Tenant tenant);
}
