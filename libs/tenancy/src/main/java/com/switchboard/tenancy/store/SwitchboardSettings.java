package com.switchboard.tenancy.store;

import java.time.Duration;

/**
 * @param pool           per-tenant pool settings
 * @param maxPools       most tenant pools kept open at once before the least recently used are evicted
 * @param idleEvictAfter a pool unused for this long is evicted by {@link StoreSwitchboard#evictIdle()}
 */
public record SwitchboardSettings(PoolSettings pool, int maxPools, Duration idleEvictAfter) {

    public SwitchboardSettings {
        if (pool == null) {
            throw new IllegalArgumentException("pool must not be null");
        }
        if (maxPools < 1) {
            throw new IllegalArgumentException("maxPools must be >= 1");
        }
        if (idleEvictAfter == null || idleEvictAfter.isNegative()) {
            throw new IllegalArgumentException("idleEvictAfter must be non-negative");
        }
    }
}
