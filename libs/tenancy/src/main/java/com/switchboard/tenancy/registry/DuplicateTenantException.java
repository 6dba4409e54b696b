package com.switchboard.tenancy.registry;

/**
 * A tenant with the same routing key, store name or id already exists.
 */
public class DuplicateTenantException extends RuntimeException {

    private final String routingKey;

    public DuplicateTenantException(String routingKey, String message) {
        super(message);
        this.routingKey = routingKey;
    }

    public DuplicateTenantException(String routingKey, String message, Throwable cause) {
        super(message, cause);
        this.routingKey = routingKey;
    }

    public String routingKey() {
        return routingKey;
    }
}
