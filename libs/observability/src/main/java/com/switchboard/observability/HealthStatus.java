package com.switchboard.observability;

/**
 * Health status for an individual component or the aggregate gateway.
 */
public enum HealthStatus {

    /** The component is serving normally. */
    HEALTHY,

    /** The component is impaired (e.g. a tenant pool is saturated) but requests are served. */
    DEGRADED,

    /** The component is down; requests depending on it fail. */
    UNHEALTHY;

    /**
     * Returns the worse of this status and {@code other}.
     */
    public HealthStatus worst(HealthStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
