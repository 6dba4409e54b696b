package com.switchboard.database.provisioning;

import org.springframework.jdbc.core.JdbcTemplate;

/**
 * One schema per tenant inside a shared database. Works on PostgreSQL and H2; the store URL
 * template selects the schema ({@code currentSchema={store}} on PostgreSQL,
 * {@code SCHEMA={store}} on H2).
 */
public class SchemaStoreAdmin extends AbstractStoreAdmin {

    public SchemaStoreAdmin(JdbcTemplate admin) {
        super(admin);
    }

    @Override
    protected String existsQuery() {
        return "SELECT COUNT(*) FROM INFORMATION_SCHEMA.SCHEMATA WHERE LOWER(SCHEMA_NAME) = ?";
    }

    @Override
    protected String createStatement(String storeName) {
        return "CREATE SCHEMA " + storeName;
    }

    @Override
    protected String dropStatement(String storeName) {
        return "DROP SCHEMA IF EXISTS " + storeName + " CASCADE";
    }

    @Override
    public StoreLayout layout() {
        return StoreLayout.SCHEMA;
    }
}
