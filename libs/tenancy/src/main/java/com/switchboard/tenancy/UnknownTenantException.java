package com.switchboard.tenancy;

/**
 * No tenant is registered for the routing key, or the host carried no routing key at all.
 */
public class UnknownTenantException extends TenantAccessException {

    private final String routingKey;

    public UnknownTenantException(String routingKey) {
        super(TenantFailure.NOT_FOUND, routingKey == null || routingKey.isEmpty()
                ? "No routing key in request host"
                : "No tenant registered for routing key '%s'".formatted(routingKey));
        this.routingKey = routingKey;
    }

    /** The routing key that failed to resolve; empty when the host carried none. */
    public String routingKey() {
        return routingKey;
    }
}
