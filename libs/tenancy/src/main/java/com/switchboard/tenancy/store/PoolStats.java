package com.switchboard.tenancy.store;

import java.time.Instant;

/**
 * Point-in-time view of one tenant pool.
 */
public record PoolStats(
        String tenantId,
        String storeName,
        int maxSize,
        int checkedOut,
        int idle,
        long opened,
        long closed,
        Instant lastUsedAt,
        boolean draining
) {
}
