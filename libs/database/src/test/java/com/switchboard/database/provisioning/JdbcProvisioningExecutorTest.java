package com.switchboard.database.provisioning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import com.switchboard.database.H2Databases;
import com.switchboard.database.config.TenantDatabaseProperties;
import com.switchboard.database.migration.TenantSchemaMigrator;
import com.switchboard.tenancy.Tenant;
import com.switchboard.tenancy.lifecycle.ProvisioningFailedException;
import com.switchboard.tenancy.lifecycle.ProvisioningResult;
import com.switchboard.tenancy.TenantStatus;
import com.switchboard.tenancy.testing.TestTenantFactory;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JdbcProvisioningExecutor")
class JdbcProvisioningExecutorTest {

    private static final Executor DIRECT = Runnable::run;

    private SchemaStoreAdmin admin;
    private TenantSchemaMigrator migrator;
    private JdbcProvisioningExecutor executor;
    private Tenant tenant;

    @BeforeEach
    void setUp() {
        TenantDatabaseProperties.StoreConfig stores = H2Databases.schemaStores();
        admin = new SchemaStoreAdmin(H2Databases.admin(stores));
        migrator = new TenantSchemaMigrator(stores, null);
        executor = new JdbcProvisioningExecutor(admin, migrator, DIRECT);
        tenant = TestTenantFactory.withStatus("t-1", "acme", TenantStatus.PROVISIONING);
    }

    @Test
    @DisplayName("creates and migrates the store")
    void provisions() {
        ProvisioningResult result = executor.provision(tenant).join();

        assertThat(result.storeName()).isEqualTo(tenant.storeName());
        assertThat(result.schemaVersion()).isEqualTo(executor.targetSchemaVersion());
        assertThat(admin.exists(tenant.storeName())).isTrue();
    }

    @Test
    @DisplayName("a repeated attempt finishes the job instead of failing")
    void repeatable() {
        executor.provision(tenant).join();

        assertThat(executor.provision(tenant).join().schemaVersion()).isEqualTo(2);
    }

    @Test
    @DisplayName("failures complete the future with ProvisioningFailedException")
    void failuresAreWrapped() {
        StoreAdmin failing = mock(StoreAdmin.class);
        doThrow(new IllegalStateException("permission denied")).when(failing).create(tenant.storeName());
        var broken = new JdbcProvisioningExecutor(failing, migrator, DIRECT);

        assertThatThrownBy(() -> broken.provision(tenant).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(ProvisioningFailedException.class)
                .hasMessageContaining("permission denied");
    }

    @Test
    @DisplayName("destroy drops the store and tolerates a missing one")
    void destroys() {
        executor.provision(tenant).join();

        executor.destroy(tenant).join();
        executor.destroy(tenant).join();

        assertThat(admin.exists(tenant.storeName())).isFalse();
    }
}
