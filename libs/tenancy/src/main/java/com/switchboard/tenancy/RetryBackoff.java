package com.switchboard.tenancy;

import java.time.Duration;

/**
 * Exponential backoff schedule shared by store opens, provisioning retries and store
 * destruction retries.
 *
 * @param initial    delay before the second attempt
 * @param max        upper bound for any single delay
 * @param multiplier growth factor per attempt (at least 1.0)
 */
public record RetryBackoff(Duration initial, Duration max, double multiplier) {

    public RetryBackoff {
        if (initial == null || initial.isNegative()) {
            throw new IllegalArgumentException("initial must be non-negative");
        }
        if (max == null || max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("max must be >= initial");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    /**
     * A schedule with no delay at all, for tests.
     */
    public static RetryBackoff none() {
        return new RetryBackoff(Duration.ZERO, Duration.ZERO, 1.0);
    }

    /**
     * Delay to wait after the given failed attempt (1-based).
     */
    public Duration delayAfter(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("failedAttempt must be >= 1");
        }
        double millis = initial.toMillis() * Math.pow(multiplier, failedAttempt - 1);
        long capped = (long) Math.min(millis, max.toMillis());
        return Duration.ofMillis(capped);
    }
}
