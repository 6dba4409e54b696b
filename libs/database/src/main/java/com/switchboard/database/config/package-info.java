/**
 * Spring configuration for the JDBC side of the switchboard.
 *
 * <ul>
 *   <li>{@link com.switchboard.database.config.TenantDatabaseProperties} externalized
 *       connection and migration settings
 *   <li>{@link com.switchboard.database.config.TenantDatabaseConfig} beans for the registry,
 *       the store connector and provisioning
 * </ul>
 */
package com.switchboard.database.config;
