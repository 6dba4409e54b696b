package com.switchboard.tenancy.testing;

import com.switchboard.tenancy.Tenant;
import com.switchboard.tenancy.TenantStatus;
import com.switchboard.tenancy.TenantValidator;

import java.time.Instant;

/**
 * Factory for {@link Tenant} records in tests.
 * <p>
 * Lives in the main source set so other modules can use it from their test scope.
 */
public final class TestTenantFactory {

    public static final Instant CREATED_AT = Instant.parse("2026-01-05T09:00:00Z");

    private TestTenantFactory() {
        // utility class
    }

    /**
     * An active tenant whose store name is derived from the routing key.
     */
    public static Tenant active(String tenantId, String routingKey) {
        return withStatus(tenantId, routingKey, TenantStatus.ACTIVE);
    }

    public static Tenant withStatus(String tenantId, String routingKey, TenantStatus status) {
        return new Tenant(tenantId, routingKey, displayName(routingKey),
                TenantValidator.deriveStoreName(routingKey), status, 0, null, CREATED_AT, CREATED_AT,
                status == TenantStatus.RETIRED ? CREATED_AT : null, null);
    }

    private static String displayName(String routingKey) {
        return Character.toUpperCase(routingKey.charAt(0)) + routingKey.substring(1) + " Ltd";
    }
}
