package com.switchboard.database.config;

import com.switchboard.database.migration.TenantSchemaMigrator;
import com.switchboard.database.provisioning.DatabaseStoreAdmin;
import com.switchboard.database.provisioning.JdbcProvisioningExecutor;
import com.switchboard.database.provisioning.SchemaStoreAdmin;
import com.switchboard.database.provisioning.StoreAdmin;
import com.switchboard.database.registry.JdbcTenantRegistry;
import com.switchboard.database.store.JdbcStoreConnector;
import com.switchboard.observability.SensitiveDataRedactor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SimpleDriverDataSource;

/**
 * JDBC wiring for the switchboard: the registry database with its Flyway schema, and everything
 * needed to reach, create and migrate tenant stores.
 *
 * <p>Spring Boot's Flyway auto-configuration only knows a single datasource. Here the registry
 * gets its own Flyway bean and every tenant store is migrated on demand by the
 * {@link TenantSchemaMigrator}, so services must exclude {@link FlywayAutoConfiguration}:
 *
 * <pre>{@code
 * spring:
 *   flyway:
 *     enabled: false
 * }</pre>
 *
 * <h2>Bean Names</h2>
 *
 * <ul>
 *   <li>{@link #REGISTRY_DATA_SOURCE_BEAN} pooled connections to the registry
 *   <li>{@link #REGISTRY_FLYWAY_BEAN} registry schema migrations
 *   <li>{@link #PROVISIONING_EXECUTOR_BEAN} threads running store DDL and migrations
 * </ul>
 *
 * @see TenantDatabaseProperties
 */
@Configuration
@EnableConfigurationProperties(TenantDatabaseProperties.class)
@ConditionalOnProperty(prefix = "switchboard.database", name = "enabled", havingValue = "true")
public class TenantDatabaseConfig {

    private static final Logger log = LoggerFactory.getLogger(TenantDatabaseConfig.class);

    /** Bean name for the registry data source. */
    public static final String REGISTRY_DATA_SOURCE_BEAN = "registryDataSource";

    /** Bean name for the registry Flyway instance. */
    public static final String REGISTRY_FLYWAY_BEAN = "registryFlyway";

    /** Bean name for the executor provisioning work runs on. */
    public static final String PROVISIONING_EXECUTOR_BEAN = "provisioningExecutorService";

    private static final int PROVISIONING_THREADS = 4;

    @Bean(name = REGISTRY_DATA_SOURCE_BEAN)
    public DataSource registryDataSource(TenantDatabaseProperties properties) {
        var registry = properties.registry();
        return DataSourceBuilder.create()
                .url(registry.url())
                .username(registry.username())
                .password(registry.password())
                .build();
    }

    /**
     * Flyway for the registry schema. Migrates immediately when
     * {@code switchboard.database.registry.migrate-on-startup} is set, so the registry is usable
     * before the first request is routed.
     */
    @Bean(name = REGISTRY_FLYWAY_BEAN)
    public Flyway registryFlyway(
            @Qualifier(REGISTRY_DATA_SOURCE_BEAN) DataSource dataSource,
            TenantDatabaseProperties properties) {
        Flyway flyway =
                Flyway.configure()
                        .dataSource(dataSource)
                        .locations(properties.registry().locations())
                        .baselineOnMigrate(true)
                        .cleanDisabled(true)
                        .load();
        if (properties.registry().migrateOnStartup()) {
            var result = flyway.migrate();
            log.info(
                    "Registry schema migrated ({} migrations executed)", result.migrationsExecuted);
        }
        return flyway;
    }

    @Bean
    public JdbcTenantRegistry tenantRegistry(
            @Qualifier(REGISTRY_DATA_SOURCE_BEAN) DataSource dataSource,
            @Qualifier(REGISTRY_FLYWAY_BEAN) Flyway registryFlyway) {
        return new JdbcTenantRegistry(new JdbcTemplate(dataSource));
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }

    @Bean
    public JdbcStoreConnector storeConnector(
            TenantDatabaseProperties properties, SensitiveDataRedactor redactor) {
        log.info(
                "Tenant stores at {} ({} layout)",
                redactor.redactUrl(properties.stores().urlTemplate()),
                properties.stores().layout());
        return new JdbcStoreConnector(properties.stores(), redactor);
    }

    @Bean
    public TenantSchemaMigrator tenantSchemaMigrator(
            TenantDatabaseProperties properties, SensitiveDataRedactor redactor) {
        return new TenantSchemaMigrator(properties.stores(), redactor);
    }

    @Bean
    public StoreAdmin storeAdmin(TenantDatabaseProperties properties) {
        return createStoreAdmin(properties.stores());
    }

    @Bean(name = PROVISIONING_EXECUTOR_BEAN, destroyMethod = "shutdown")
    public ExecutorService provisioningExecutorService() {
        return Executors.newFixedThreadPool(PROVISIONING_THREADS);
    }

    @Bean
    public JdbcProvisioningExecutor provisioningExecutor(
            StoreAdmin storeAdmin,
            TenantSchemaMigrator migrator,
            @Qualifier(PROVISIONING_EXECUTOR_BEAN) ExecutorService executor) {
        return new JdbcProvisioningExecutor(storeAdmin, migrator, executor);
    }

    // ── Private Helpers ──

    /**
     * Admin connections are unpooled: DDL is rare, and {@code CREATE DATABASE} must not run on a
     * connection a pool might hand out inside a transaction.
     */
    static StoreAdmin createStoreAdmin(TenantDatabaseProperties.StoreConfig stores) {
        DataSource admin =
                DataSourceBuilder.create()
                        .type(SimpleDriverDataSource.class)
                        .url(stores.adminUrl())
                        .username(stores.username())
                        .password(stores.password())
                        .build();
        var jdbc = new JdbcTemplate(admin);
        return switch (stores.layout()) {
            case DATABASE -> new DatabaseStoreAdmin(jdbc);
            case SCHEMA -> new SchemaStoreAdmin(jdbc);
        };
    }
}
