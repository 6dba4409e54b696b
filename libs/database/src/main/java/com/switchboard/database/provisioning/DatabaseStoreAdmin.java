package com.switchboard.database.provisioning;

import org.springframework.jdbc.core.JdbcTemplate;

/**
 * One PostgreSQL database per tenant.
 *
 * <p>{@code CREATE DATABASE} cannot run inside a transaction, so the admin template must be
 * backed by an auto-commit connection to a maintenance database ({@code postgres}).
 */
public class DatabaseStoreAdmin extends AbstractStoreAdmin {

    public DatabaseStoreAdmin(JdbcTemplate admin) {
        super(admin);
    }

    @Override
    protected String existsQuery() {
        return "SELECT COUNT(*) FROM pg_database WHERE datname = ?";
    }

    @Override
    protected String createStatement(String storeName) {
        return "CREATE DATABASE " + storeName;
    }

    @Override
    protected String dropStatement(String storeName) {
        return "DROP DATABASE IF EXISTS " + storeName + " WITH (FORCE)";
    }

    @Override
    public StoreLayout layout() {
        return StoreLayout.DATABASE;
    }
}
