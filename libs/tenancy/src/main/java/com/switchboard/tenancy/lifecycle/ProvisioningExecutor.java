package com.switchboard.tenancy.lifecycle;

import com.switchboard.tenancy.Tenant;

import java.util.concurrent.CompletableFuture;

/**
 * Creates and destroys physical tenant stores. Both operations run asynchronously and must be
 * safe to repeat: the state machine retries them after failures.
 */
public interface ProvisioningExecutor {

    /**
     * Creates the tenant's store (if absent) and migrates it to the target schema.
     *
     * @return completes with the reached schema version, or exceptionally on failure
     */
    CompletableFuture<ProvisioningResult> provision(Tenant tenant);

    /**
     * Destroys the tenant's store. Destroying a store that does not exist succeeds.
     */
    CompletableFuture<Void> destroy(Tenant tenant);

    /**
     * Schema version a store must report before its tenant may become active.
     */
    int targetSchemaVersion();
}
