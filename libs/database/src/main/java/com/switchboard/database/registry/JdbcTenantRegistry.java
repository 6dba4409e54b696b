package com.switchboard.database.registry;

import com.switchboard.tenancy.Tenant;
import com.switchboard.tenancy.TenantStatus;
import com.switchboard.tenancy.registry.DuplicateTenantException;
import com.switchboard.tenancy.registry.TenantRegistry;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * {@link TenantRegistry} over the shared registry database.
 *
 * <p>Status changes are a single conditional {@code UPDATE ... WHERE status = ?}: the database
 * row lock decides which of two concurrent transitions wins, and the loser sees zero rows
 * updated.
 */
public class JdbcTenantRegistry implements TenantRegistry {

    private static final String COLUMNS =
            "tenant_id, routing_key, display_name, store_name, status, provisioning_attempts,"
                    + " last_error, created_at, updated_at, retired_at, store_destroyed_at";

    private static final int MAX_ERROR_LENGTH = 2000;

    private static final RowMapper<Tenant> TENANT_ROW =
            (rs, rowNum) ->
                    new Tenant(
                            rs.getString("tenant_id"),
                            rs.getString("routing_key"),
                            rs.getString("display_name"),
                            rs.getString("store_name"),
                            TenantStatus.valueOf(rs.getString("status")),
                            rs.getInt("provisioning_attempts"),
                            rs.getString("last_error"),
                            instant(rs, "created_at"),
                            instant(rs, "updated_at"),
                            instant(rs, "retired_at"),
                            instant(rs, "store_destroyed_at"));

    private final JdbcTemplate jdbc;

    public JdbcTenantRegistry(JdbcTemplate jdbc) {
        if (jdbc == null) {
            throw new IllegalArgumentException("jdbc must not be null");
        }
        this.jdbc = jdbc;
    }

    @Override
    public Optional<Tenant> findByRoutingKey(String routingKey) {
        return single("SELECT " + COLUMNS + " FROM tenants WHERE routing_key = ?", routingKey);
    }

    @Override
    public Optional<Tenant> findById(String tenantId) {
        return single("SELECT " + COLUMNS + " FROM tenants WHERE tenant_id = ?", tenantId);
    }

    @Override
    public List<Tenant> findByStatus(Set<TenantStatus> statuses) {
        if (statuses == null || statuses.isEmpty()) {
            return List.of();
        }
        List<Object> args = new ArrayList<>();
        statuses.forEach(s -> args.add(s.name()));
        String placeholders = String.join(", ", Collections.nCopies(statuses.size(), "?"));
        return jdbc.query(
                "SELECT " + COLUMNS + " FROM tenants WHERE status IN (" + placeholders + ")"
                        + " ORDER BY created_at, tenant_id",
                TENANT_ROW,
                args.toArray());
    }

    @Override
    public Tenant create(Tenant tenant) {
        try {
            jdbc.update(
                    "INSERT INTO tenants (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    tenant.tenantId(),
                    tenant.routingKey(),
                    tenant.displayName(),
                    tenant.storeName(),
                    tenant.status().name(),
                    tenant.provisioningAttempts(),
                    truncate(tenant.lastError()),
                    timestamp(tenant.createdAt()),
                    timestamp(tenant.updatedAt()),
                    timestamp(tenant.retiredAt()),
                    timestamp(tenant.storeDestroyedAt()));
        } catch (DuplicateKeyException e) {
            throw new DuplicateTenantException(
                    tenant.routingKey(),
                    "Tenant id, routing key or store name already registered: "
                            + tenant.routingKey(),
                    e);
        }
        return tenant;
    }

    @Override
    public Optional<Tenant> compareAndSetStatus(
            String tenantId, TenantStatus expected, TenantStatus next, Instant at) {
        int updated;
        if (next == TenantStatus.RETIRED) {
            updated =
                    jdbc.update(
                            "UPDATE tenants SET status = ?, updated_at = ?, retired_at = ?"
                                    + " WHERE tenant_id = ? AND status = ?",
                            next.name(),
                            timestamp(at),
                            timestamp(at),
                            tenantId,
                            expected.name());
        } else {
            updated =
                    jdbc.update(
                            "UPDATE tenants SET status = ?, updated_at = ?"
                                    + " WHERE tenant_id = ? AND status = ?",
                            next.name(),
                            timestamp(at),
                            tenantId,
                            expected.name());
        }
        return updated == 1 ? findById(tenantId) : Optional.empty();
    }

    @Override
    public Optional<Tenant> updateProvisioningAttempts(
            String tenantId, int attempts, String lastError, Instant at) {
        int updated =
                jdbc.update(
                        "UPDATE tenants SET provisioning_attempts = ?, last_error = ?, updated_at = ?"
                                + " WHERE tenant_id = ?",
                        attempts,
                        truncate(lastError),
                        timestamp(at),
                        tenantId);
        return updated == 1 ? findById(tenantId) : Optional.empty();
    }

    @Override
    public Optional<Tenant> markStoreDestroyed(String tenantId, Instant at) {
        int updated =
                jdbc.update(
                        "UPDATE tenants SET store_destroyed_at = ?, updated_at = ?"
                                + " WHERE tenant_id = ? AND status = ?",
                        timestamp(at),
                        timestamp(at),
                        tenantId,
                        TenantStatus.RETIRED.name());
        return updated == 1 ? findById(tenantId) : Optional.empty();
    }

    private Optional<Tenant> single(String sql, Object arg) {
        return jdbc.query(sql, TENANT_ROW, arg).stream().findFirst();
    }

    private static String truncate(String error) {
        return error == null || error.length() <= MAX_ERROR_LENGTH
                ? error
                : error.substring(0, MAX_ERROR_LENGTH);
    }

    private static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }
}
