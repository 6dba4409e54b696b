package com.switchboard.tenancy.lifecycle;

import com.switchboard.tenancy.Tenant;

import java.util.concurrent.CompletableFuture;

/**
 * A provisioning run in progress.
 *
 * @param tenant  registry record when the run was started
 * @param outcome completes when the tenant is active or escalated
 */
public record ProvisioningTask(Tenant tenant, CompletableFuture<ProvisioningOutcome> outcome) {
}
