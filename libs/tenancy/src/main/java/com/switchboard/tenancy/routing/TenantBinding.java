package com.switchboard.tenancy.routing;

import com.switchboard.tenancy.RequestKind;
import com.switchboard.tenancy.Tenant;
import com.switchboard.tenancy.store.StoreHandle;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One request's binding to one tenant and one store handle.
 * <p>
 * A binding is created by {@link TenantRouter} and never changes tenant: there is no way to
 * swap the tenant or the handle after construction. All tenant data access for the request goes
 * through {@link #query} and {@link #update}. Closing the binding releases the handle; closing
 * twice is harmless.
 */
public final class TenantBinding implements AutoCloseable {

    private final Tenant tenant;
    private final RequestKind kind;
    private final StoreHandle handle;
    private final Instant boundAt;

    TenantBinding(Tenant tenant, RequestKind kind, StoreHandle handle, Instant boundAt) {
        if (!tenant.tenantId().equals(handle.tenantId())) {
            throw new IllegalArgumentException("handle belongs to tenant '%s', not '%s'"
                    .formatted(handle.tenantId(), tenant.tenantId()));
        }
        this.tenant = tenant;
        this.kind = kind;
        this.handle = handle;
        this.boundAt = boundAt;
    }

    public Tenant tenant() {
        return tenant;
    }

    public String tenantId() {
        return tenant.tenantId();
    }

    public RequestKind kind() {
        return kind;
    }

    public Instant boundAt() {
        return boundAt;
    }

    public StoreHandle handle() {
        return handle;
    }

    public List<Map<String, Object>> query(String sql, Object... args) {
        return handle.query(sql, args);
    }

    /**
     * Runs a write statement.
     *
     * @throws IllegalStateException if the binding was made for a read request
     */
    public int update(String sql, Object... args) {
        if (kind != RequestKind.MUTATION) {
            throw new IllegalStateException("Read binding for tenant '" + tenant.tenantId() + "' cannot write");
        }
        return handle.update(sql, args);
    }

    public boolean isClosed() {
        return handle.isReleased();
    }

    @Override
    public void close() {
        handle.release();
    }

    @Override
    public String toString() {
        return "TenantBinding[tenant=" + tenant.tenantId() + ", kind=" + kind + ", boundAt=" + boundAt + "]";
    }
}
