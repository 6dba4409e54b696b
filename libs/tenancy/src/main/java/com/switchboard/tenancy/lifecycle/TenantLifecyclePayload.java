package com.switchboard.tenancy.lifecycle;

import com.switchboard.tenancy.TenantStatus;

/**
 * Payload of every tenant lifecycle event.
 *
 * @param routingKey routing key of the tenant
 * @param storeName  physical store name
 * @param fromStatus status before the transition (null on registration)
 * @param toStatus   status after the transition
 * @param attempt    provisioning or destruction attempt number, 0 when not applicable
 * @param reason     operator reason or failure message (nullable)
 */
public record TenantLifecyclePayload(
        String routingKey,
        String storeName,
        TenantStatus fromStatus,
        TenantStatus toStatus,
        int attempt,
        String reason
) {
}
