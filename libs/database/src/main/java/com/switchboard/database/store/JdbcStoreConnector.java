package com.switchboard.database.store;

import com.switchboard.database.config.TenantDatabaseProperties;
import com.switchboard.observability.SensitiveDataRedactor;
import com.switchboard.tenancy.TenantValidator;
import com.switchboard.tenancy.store.StoreConnector;
import com.switchboard.tenancy.store.StoreSession;
import com.switchboard.tenancy.store.StoreSessionException;
import java.sql.Connection;
import java.sql.SQLException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

/**
 * Opens one JDBC connection per store session. The URL comes from the configured template with
 * the store name substituted; pooling happens one level up, in the switchboard, so this class
 * holds no connections of its own.
 */
public class JdbcStoreConnector implements StoreConnector {

    private static final Logger log = LoggerFactory.getLogger(JdbcStoreConnector.class);

    private final TenantDatabaseProperties.StoreConfig config;
    private final SensitiveDataRedactor redactor;

    public JdbcStoreConnector(
            TenantDatabaseProperties.StoreConfig config, SensitiveDataRedactor redactor) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        this.config = config;
        this.redactor = redactor == null ? new SensitiveDataRedactor() : redactor;
    }

    @Override
    public StoreSession open(String storeName) {
        if (!TenantValidator.isValidStoreName(storeName)) {
            throw new IllegalArgumentException("Invalid store name: " + storeName);
        }
        String url = config.urlFor(storeName);
        var dataSource =
                new SingleConnectionDataSource(url, config.username(), config.password(), true);
        try {
            Connection connection = dataSource.getConnection();
            if (!connection.getAutoCommit()) {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            dataSource.destroy();
            log.warn("Cannot open store {} at {}: {}", storeName, redactor.redactUrl(url), e.getMessage());
            throw new StoreSessionException(
                    storeName, "Cannot connect to store " + storeName + ": " + e.getMessage(), e);
        }
        log.debug("Opened session on store {}", storeName);
        return new JdbcStoreSession(storeName, dataSource);
    }

    /** Store URL with credentials removed, for logs and the admin API. */
    public String describe(String storeName) {
        return redactor.redactUrl(config.urlFor(storeName));
    }
}
