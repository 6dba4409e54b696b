package com.switchboard.tenancy.lifecycle;

import com.switchboard.tenancy.Tenant;

/**
 * Final result of a provisioning run.
 *
 * @param tenant    registry record at the end of the run
 * @param status    whether the tenant became active or was escalated to an operator
 * @param attempts  attempts made in this run
 * @param lastError last failure message (null when active)
 */
public record ProvisioningOutcome(Tenant tenant, Status status, int attempts, String lastError) {

    public enum Status {
        ACTIVE,
        ESCALATED
    }

    public static ProvisioningOutcome active(Tenant tenant, int attempts) {
        return new ProvisioningOutcome(tenant, Status.ACTIVE, attempts, null);
    }

    public static ProvisioningOutcome escalated(Tenant tenant, int attempts, String lastError) {
        return new ProvisioningOutcome(tenant, Status.ESCALATED, attempts, lastError);
    }

    public boolean isActive() {
        return status == Status.ACTIVE;
    }
}
