/**
 * Creation and destruction of physical tenant stores.
 *
 * <p>A store is either a database ({@link com.switchboard.database.provisioning.StoreLayout#DATABASE})
 * or a schema ({@link com.switchboard.database.provisioning.StoreLayout#SCHEMA}); the
 * {@link com.switchboard.database.provisioning.JdbcProvisioningExecutor} does not care which.
 */
package com.switchboard.database.provisioning;
