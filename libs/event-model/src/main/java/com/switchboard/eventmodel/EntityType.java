package com.switchboard.eventmodel;

/** Aggregates that lifecycle events are about. */
public enum EntityType {
    TENANT("Tenant"),
    TENANT_STORE("TenantStore");

    private final String value;

    EntityType(String value) {
        this.value = value;
    }

    /** Canonical string representation. */
    public String value() {
        return value;
    }
}
