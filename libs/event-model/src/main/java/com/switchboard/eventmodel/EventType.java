package com.switchboard.eventmodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Tenant lifecycle events emitted by the provisioning state machine.
 *
 * <p>The {@code value} is the canonical name written to JSON. Intents ({@code *Requested}) are
 * emitted before work is handed to the provisioning executor; the matching completion or failure
 * event follows once the executor reports back.
 */
public enum EventType {

    // ---- Registration ----
    TENANT_REGISTERED("TenantRegistered"),

    // ---- Provisioning ----
    PROVISIONING_REQUESTED("ProvisioningRequested"),
    PROVISIONING_FAILED("ProvisioningFailed"),
    PROVISIONING_ESCALATED("ProvisioningEscalated"),
    TENANT_ACTIVATED("TenantActivated"),

    // ---- Access policy ----
    TENANT_SUSPENDED("TenantSuspended"),
    TENANT_REACTIVATED("TenantReactivated"),

    // ---- Offboarding ----
    TENANT_RETIRED("TenantRetired"),
    STORE_DESTROY_REQUESTED("StoreDestroyRequested"),
    STORE_DESTROYED("StoreDestroyed"),
    STORE_DESTROY_FAILED("StoreDestroyFailed");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    /** The canonical string representation used in JSON (e.g. "TenantActivated"). */
    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Looks up an EventType by its canonical string value.
     *
     * @param value the string to match (e.g. "TenantSuspended")
     * @return the matching EventType, or empty if not found
     */
    public static Optional<EventType> fromString(String value) {
        for (EventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static EventType fromJson(String value) {
        return fromString(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + value));
    }

    /** Whether this event reports a failure that an operator may need to look at. */
    public boolean isFailure() {
        return this == PROVISIONING_FAILED || this == PROVISIONING_ESCALATED || this == STORE_DESTROY_FAILED;
    }
}
