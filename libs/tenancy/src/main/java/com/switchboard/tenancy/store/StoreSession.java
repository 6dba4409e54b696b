package com.switchboard.tenancy.store;

import java.util.List;
import java.util.Map;

/**
 * An open session against exactly one physical store.
 * <p>
 * Infrastructure failures (lost connection, unreachable store) surface as
 * {@link StoreSessionException}; errors in the statement itself propagate as whatever the
 * backend throws.
 */
public interface StoreSession extends AutoCloseable {

    /** Name of the store this session is connected to. */
    String storeName();

    /**
     * Runs a query and returns its rows as column-name maps, in result order.
     */
    List<Map<String, Object>> query(String sql, Object... args);

    /**
     * Runs an insert, update or delete and returns the affected row count.
     */
    int update(String sql, Object... args);

    /**
     * Whether the session can still be used. Called before an idle session is reused.
     */
    boolean isValid();

    @Override
    void close();
}
