package com.switchboard.database.config;

import com.switchboard.database.provisioning.StoreLayout;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized configuration for the registry database and the tenant stores.
 *
 * <p>Bound from {@code switchboard.database.*}:
 *
 * <pre>{@code
 * switchboard:
 *   database:
 *     registry:
 *       url: jdbc:postgresql://localhost:5432/switchboard
 *       username: switchboard
 *       password: secret
 *     stores:
 *       url-template: jdbc:postgresql://localhost:5432/{store}
 *       admin-url: jdbc:postgresql://localhost:5432/postgres
 *       layout: DATABASE
 * }</pre>
 *
 * @param enabled whether the JDBC beans are created at all (tests switch them off to run on the
 *     in-memory doubles)
 * @param registry connection to the shared registry database
 * @param stores how tenant stores are located, created and migrated
 */
@Validated
@ConfigurationProperties(prefix = "switchboard.database")
public record TenantDatabaseProperties(
        boolean enabled, @NotNull @Valid RegistryConfig registry, @NotNull @Valid StoreConfig stores) {

    /** Placeholder replaced by the store name in {@link StoreConfig#urlTemplate()}. */
    public static final String STORE_PLACEHOLDER = "{store}";

    /**
     * The shared registry database.
     *
     * @param url JDBC URL
     * @param username database user
     * @param password database password (nullable for embedded databases)
     * @param locations Flyway locations of the registry schema
     * @param migrateOnStartup whether the registry schema is migrated when the context starts
     */
    public record RegistryConfig(
            @NotBlank String url,
            @NotBlank String username,
            String password,
            String locations,
            boolean migrateOnStartup) {

        public RegistryConfig {
            if (locations == null || locations.isBlank()) {
                locations = "classpath:db/registry";
            }
        }
    }

    /**
     * The tenant stores.
     *
     * @param urlTemplate JDBC URL of one store, with {@value #STORE_PLACEHOLDER} where the store
     *     name goes
     * @param username database user for store sessions
     * @param password database password (nullable for embedded databases)
     * @param adminUrl JDBC URL the stores are created and dropped through
     * @param layout whether a store is a whole database or a schema
     * @param locations Flyway locations of the per-tenant schema
     */
    public record StoreConfig(
            @NotBlank @Pattern(regexp = ".*\\{store\\}.*", message = "must contain {store}")
                    String urlTemplate,
            @NotBlank String username,
            String password,
            @NotBlank String adminUrl,
            StoreLayout layout,
            String locations) {

        public StoreConfig {
            if (layout == null) {
                layout = StoreLayout.DATABASE;
            }
            if (locations == null || locations.isBlank()) {
                locations = "classpath:db/tenant";
            }
        }

        /** JDBC URL of the named store. */
        public String urlFor(String storeName) {
            return urlTemplate.replace(STORE_PLACEHOLDER, storeName);
        }
    }
}
