package com.switchboard.database.store;

import com.switchboard.tenancy.store.StoreSession;
import com.switchboard.tenancy.store.StoreSessionException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

/**
 * A store session on one dedicated JDBC connection.
 *
 * <p>Connection-level failures are reported as {@link StoreSessionException} so the handle is
 * marked broken and the connection never returns to the pool. Statement errors (syntax,
 * constraint violations) propagate as Spring {@code DataAccessException}s and leave the session
 * usable.
 *
 * <p>Result maps from {@link #query} are case-insensitive on column name, because databases
 * differ in how they fold unquoted identifiers.
 */
class JdbcStoreSession implements StoreSession {

    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final String storeName;
    private final SingleConnectionDataSource dataSource;
    private final JdbcTemplate jdbc;
    private volatile boolean closed;

    JdbcStoreSession(String storeName, SingleConnectionDataSource dataSource) {
        this.storeName = storeName;
        this.dataSource = dataSource;
        this.jdbc = new JdbcTemplate(dataSource);
    }

    @Override
    public String storeName() {
        return storeName;
    }

    @Override
    public List<Map<String, Object>> query(String sql, Object... args) {
        return run(() -> jdbc.queryForList(sql, args));
    }

    @Override
    public int update(String sql, Object... args) {
        return run(() -> jdbc.update(sql, args));
    }

    @Override
    public boolean isValid() {
        if (closed) {
            return false;
        }
        try {
            Connection connection = dataSource.getConnection();
            return !connection.isClosed() && connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            return false;
        }
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            dataSource.destroy();
        }
    }

    private <T> T run(Supplier<T> statement) {
        if (closed) {
            throw new StoreSessionException(storeName, "session is closed");
        }
        try {
            return statement.get();
        } catch (DataAccessResourceFailureException
                | TransientDataAccessResourceException
                | RecoverableDataAccessException e) {
            throw new StoreSessionException(
                    storeName, "Connection to store " + storeName + " failed: " + e.getMessage(), e);
        }
    }
}
