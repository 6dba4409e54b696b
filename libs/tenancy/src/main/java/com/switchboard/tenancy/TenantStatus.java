package com.switchboard.tenancy;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a tenant as stored in the registry.
 *
 * <pre>
 * PENDING → PROVISIONING → ACTIVE ⇄ SUSPENDED
 *    ↑            │          │          │
 *    └── failed ──┘          └─ RETIRED ┘
 * </pre>
 *
 * {@link #RETIRED} is terminal. Only {@link #ACTIVE} tenants are routable.
 */
public enum TenantStatus {

    PENDING,
    PROVISIONING,
    ACTIVE,
    SUSPENDED,
    RETIRED;

    /**
     * Whether the state machine allows moving from this status to {@code next}.
     */
    public boolean canTransitionTo(TenantStatus next) {
        return allowedTargets().contains(next);
    }

    /**
     * Statuses reachable from this one in a single transition.
     */
    public Set<TenantStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(PROVISIONING);
            case PROVISIONING -> EnumSet.of(ACTIVE, PENDING);
            case ACTIVE -> EnumSet.of(SUSPENDED, RETIRED);
            case SUSPENDED -> EnumSet.of(ACTIVE, RETIRED);
            case RETIRED -> EnumSet.noneOf(TenantStatus.class);
        };
    }

    /** Whether no further transition is possible. */
    public boolean isTerminal() {
        return this == RETIRED;
    }

    /** Whether requests may be routed to a tenant in this status. */
    public boolean isRoutable() {
        return this == ACTIVE;
    }
}
