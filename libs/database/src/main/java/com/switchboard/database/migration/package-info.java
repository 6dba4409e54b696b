/**
 * Flyway migrations for the tenant stores.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.switchboard.database.migration.TenantSchemaMigrator} migrates one store and
 *       reports its version
 *   <li>{@link com.switchboard.database.migration.StoreMigrationStatus} applied and pending
 *       migrations of a store, for the admin API
 * </ul>
 *
 * <p>The registry schema is migrated once at startup by
 * {@link com.switchboard.database.config.TenantDatabaseConfig}.
 */
package com.switchboard.database.migration;
