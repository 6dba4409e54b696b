package com.switchboard.database.provisioning;

import com.switchboard.database.migration.TenantSchemaMigrator;
import com.switchboard.tenancy.Tenant;
import com.switchboard.tenancy.lifecycle.ProvisioningExecutor;
import com.switchboard.tenancy.lifecycle.ProvisioningFailedException;
import com.switchboard.tenancy.lifecycle.ProvisioningResult;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provisions tenant stores on a real database server: create the store through the
 * {@link StoreAdmin}, then migrate it to the target schema.
 *
 * <p>Both steps are idempotent, so a retried attempt picks up wherever the failed one stopped.
 * Work runs on the supplied executor; callers get a future and never block on DDL.
 */
public class JdbcProvisioningExecutor implements ProvisioningExecutor {

    private static final Logger log = LoggerFactory.getLogger(JdbcProvisioningExecutor.class);

    private final StoreAdmin storeAdmin;
    private final TenantSchemaMigrator migrator;
    private final Executor executor;

    public JdbcProvisioningExecutor(
            StoreAdmin storeAdmin, TenantSchemaMigrator migrator, Executor executor) {
        if (storeAdmin == null || migrator == null || executor == null) {
            throw new IllegalArgumentException("storeAdmin, migrator and executor are required");
        }
        this.storeAdmin = storeAdmin;
        this.migrator = migrator;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<ProvisioningResult> provision(Tenant tenant) {
        return CompletableFuture.supplyAsync(
                () -> {
                    String store = tenant.storeName();
                    try {
                        storeAdmin.create(store);
                        int version = migrator.migrate(store);
                        return new ProvisioningResult(store, version);
                    } catch (RuntimeException e) {
                        log.warn(
                                "Provisioning store {} for tenant {} failed: {}",
                                store,
                                tenant.tenantId(),
                                e.getMessage());
                        throw new ProvisioningFailedException(
                                tenant.tenantId(),
                                "Provisioning store " + store + " failed: " + e.getMessage(),
                                e);
                    }
                },
                executor);
    }

    @Override
    public CompletableFuture<Void> destroy(Tenant tenant) {
        return CompletableFuture.runAsync(
                () -> {
                    String store = tenant.storeName();
                    try {
                        storeAdmin.drop(store);
                    } catch (RuntimeException e) {
                        throw new ProvisioningFailedException(
                                tenant.tenantId(),
                                "Dropping store " + store + " failed: " + e.getMessage(),
                                e);
                    }
                },
                executor);
    }

    @Override
    public int targetSchemaVersion() {
        return migrator.targetVersion();
    }
}
