/**
 * JDBC persistence for the tenant switchboard.
 *
 * <p>Two kinds of database are involved and they never mix:
 *
 * <ul>
 *   <li>the <strong>registry</strong>, one shared database holding every tenant record, migrated
 *       from {@code classpath:db/registry}
 *   <li>the <strong>tenant stores</strong>, one physical store per tenant, each migrated from
 *       {@code classpath:db/tenant} when the tenant is provisioned
 * </ul>
 *
 * @see com.switchboard.database.config.TenantDatabaseConfig
 * @see com.switchboard.database.config.TenantDatabaseProperties
 */
package com.switchboard.database;
