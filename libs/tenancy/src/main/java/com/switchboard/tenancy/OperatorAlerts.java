package com.switchboard.tenancy;

/**
 * Escalation channel for conditions a human has to look at: stores that stay unreachable,
 * provisioning that ran out of attempts, destruction that keeps failing.
 */
public interface OperatorAlerts {

    /**
     * Raises an alert.
     *
     * @param tenantId tenant concerned (never null)
     * @param kind     short machine-readable kind, e.g. {@code provisioning_escalated}
     * @param message  human-readable detail
     * @param cause    underlying failure, may be null
     */
    void raise(String tenantId, String kind, String message, Throwable cause);
}
