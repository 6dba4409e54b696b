package com.switchboard.tenancy.store;

import com.switchboard.tenancy.RetryBackoff;

import java.time.Duration;

/**
 * Sizing and retry settings applied to every per-tenant pool.
 *
 * @param maxSize        most sessions a tenant may have checked out at once
 * @param acquireTimeout how long a request waits for a free slot
 * @param openAttempts   attempts to open a new session before giving up
 * @param openBackoff    delay schedule between open attempts
 */
public record PoolSettings(int maxSize, Duration acquireTimeout, int openAttempts, RetryBackoff openBackoff) {

    public PoolSettings {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be >= 1");
        }
        if (acquireTimeout == null || acquireTimeout.isNegative()) {
            throw new IllegalArgumentException("acquireTimeout must be non-negative");
        }
        if (openAttempts < 1) {
            throw new IllegalArgumentException("openAttempts must be >= 1");
        }
        if (openBackoff == null) {
            throw new IllegalArgumentException("openBackoff must not be null");
        }
    }
}
