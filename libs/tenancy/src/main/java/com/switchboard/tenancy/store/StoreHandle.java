package com.switchboard.tenancy.store;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A session checked out from one tenant's pool.
 * <p>
 * Usable until released. {@link #release()} is idempotent and safe from any thread; the session
 * goes back to the pool unless it failed, in which case it is closed.
 */
public final class StoreHandle implements AutoCloseable {

    private final String tenantId;
    private final TenantPool pool;
    private final StoreSession session;
    private final AtomicBoolean released = new AtomicBoolean();
    private volatile boolean broken;

    StoreHandle(String tenantId, TenantPool pool, StoreSession session) {
        this.tenantId = tenantId;
        this.pool = pool;
        this.session = session;
    }

    public String tenantId() {
        return tenantId;
    }

    public String storeName() {
        return session.storeName();
    }

    public List<Map<String, Object>> query(String sql, Object... args) {
        ensureUsable();
        try {
            return session.query(sql, args);
        } catch (StoreSessionException e) {
            broken = true;
            throw e;
        }
    }

    public int update(String sql, Object... args) {
        ensureUsable();
        try {
            return session.update(sql, args);
        } catch (StoreSessionException e) {
            broken = true;
            throw e;
        }
    }

    /**
     * Marks the session as unusable so that release closes it.
     */
    public void markBroken() {
        broken = true;
    }

    public boolean isBroken() {
        return broken;
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * Returns the session to its pool. Only the first call has an effect.
     */
    public void release() {
        if (released.compareAndSet(false, true)) {
            pool.release(session, broken);
        }
    }

    @Override
    public void close() {
        release();
    }

    private void ensureUsable() {
        if (released.get()) {
            throw new IllegalStateException("Store handle for tenant '" + tenantId + "' was already released");
        }
    }
}
