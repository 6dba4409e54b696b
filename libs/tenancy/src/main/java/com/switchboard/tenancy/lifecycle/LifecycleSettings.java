package com.switchboard.tenancy.lifecycle;

import com.switchboard.tenancy.RetryBackoff;

import java.time.Duration;

/**
 * @param maxProvisioningAttempts attempts before provisioning is escalated
 * @param provisioningBackoff     delay schedule between provisioning attempts
 * @param retentionWindow         how long a retired tenant's store is kept before destruction
 * @param maxDestroyAttempts      attempts before store destruction is escalated
 * @param destroyBackoff          delay schedule between destruction attempts
 */
public record LifecycleSettings(
        int maxProvisioningAttempts,
        RetryBackoff provisioningBackoff,
        Duration retentionWindow,
        int maxDestroyAttempts,
        RetryBackoff destroyBackoff
) {

    public LifecycleSettings {
        if (maxProvisioningAttempts < 1) {
            throw new IllegalArgumentException("maxProvisioningAttempts must be >= 1");
        }
        if (maxDestroyAttempts < 1) {
            throw new IllegalArgumentException("maxDestroyAttempts must be >= 1");
        }
        if (retentionWindow == null || retentionWindow.isNegative()) {
            throw new IllegalArgumentException("retentionWindow must be non-negative");
        }
        if (provisioningBackoff == null || destroyBackoff == null) {
            throw new IllegalArgumentException("backoff schedules must not be null");
        }
    }
}
