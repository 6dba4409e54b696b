package com.switchboard.gateway.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the tenant gateway.
 *
 * <p>Spring Boot binds {@code switchboard.*} to this record at startup and validates it; invalid
 * config fails the context before a single request is routed. Compact constructors apply the
 * defaults, so every section may be omitted:
 *
 * <pre>
 * switchboard:
 *   service-name: tenant-gateway
 *   base-domains: [example.com]
 *   cache:
 *     read-ttl: 30s
 *     mutation-revalidate-after: 2s
 *   pool:
 *     max-size: 10
 *     acquire-timeout: 2s
 *   provisioning:
 *     max-attempts: 5
 *     retention-window: 30d
 * </pre>
 *
 * @param serviceName name used for metrics tags and the admin info endpoint
 * @param baseDomains domains whose subdomains are tenant routing keys
 * @param retryAfter value of the {@code Retry-After} header on retryable failures
 * @param cache tenant record cache
 * @param pool per-tenant store pools
 * @param provisioning provisioning and destruction retries
 * @param maintenance background housekeeping
 */
@ConfigurationProperties(prefix = "switchboard")
@Validated
public record SwitchboardProperties(
        @NotBlank String serviceName,
        @NotEmpty List<@NotBlank String> baseDomains,
        Duration retryAfter,
        @Valid Cache cache,
        @Valid Pool pool,
        @Valid Provisioning provisioning,
        @Valid Maintenance maintenance) {

    public SwitchboardProperties {
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = "tenant-gateway";
        }
        if (retryAfter == null || retryAfter.isNegative() || retryAfter.isZero()) {
            retryAfter = Duration.ofSeconds(2);
        }
        if (cache == null) {
            cache = new Cache(null, null, 0);
        }
        if (pool == null) {
            pool = new Pool(0, null, 0, null, null, 0, null);
        }
        if (provisioning == null) {
            provisioning = new Provisioning(0, null, null, null, 0);
        }
        if (maintenance == null) {
            maintenance = new Maintenance(null, true);
        }
    }

    /**
     * @param readTtl how long reads trust a cached tenant record
     * @param mutationRevalidateAfter age after which mutations reload the record first
     * @param maxEntries cache capacity
     */
    public record Cache(Duration readTtl, Duration mutationRevalidateAfter, int maxEntries) {

        public Cache {
            if (readTtl == null) {
                readTtl = Duration.ofSeconds(30);
            }
            if (mutationRevalidateAfter == null) {
                mutationRevalidateAfter = Duration.ofSeconds(2);
            }
            if (maxEntries <= 0) {
                maxEntries = 10_000;
            }
        }
    }

    /**
     * @param maxSize sessions per tenant pool
     * @param acquireTimeout how long a request waits for a free session
     * @param openAttempts attempts to open a new session before the store counts as unavailable
     * @param openBackoff delay after the first failed open, doubled per attempt
     * @param openBackoffMax cap on the open backoff
     * @param maxPools pools kept open before the least recently used are evicted
     * @param idleEvictAfter unused time after which a pool is evicted
     */
    public record Pool(
            int maxSize,
            Duration acquireTimeout,
            int openAttempts,
            Duration openBackoff,
            Duration openBackoffMax,
            int maxPools,
            Duration idleEvictAfter) {

        public Pool {
            if (maxSize <= 0) {
                maxSize = 10;
            }
            if (acquireTimeout == null) {
                acquireTimeout = Duration.ofSeconds(2);
            }
            if (openAttempts <= 0) {
                openAttempts = 3;
            }
            if (openBackoff == null) {
                openBackoff = Duration.ofMillis(100);
            }
            if (openBackoffMax == null) {
                openBackoffMax = Duration.ofSeconds(2);
            }
            if (maxPools <= 0) {
                maxPools = 200;
            }
            if (idleEvictAfter == null) {
                idleEvictAfter = Duration.ofMinutes(15);
            }
        }
    }

    /**
     * @param maxAttempts provisioning attempts before the tenant is escalated to an operator
     * @param backoff delay after the first failed attempt, doubled per attempt
     * @param backoffMax cap on the provisioning backoff
     * @param retentionWindow how long a retired tenant's store is kept
     * @param maxDestroyAttempts destruction attempts before escalation
     */
    public record Provisioning(
            int maxAttempts,
            Duration backoff,
            Duration backoffMax,
            Duration retentionWindow,
            int maxDestroyAttempts) {

        public Provisioning {
            if (maxAttempts <= 0) {
                maxAttempts = 5;
            }
            if (backoff == null) {
                backoff = Duration.ofSeconds(1);
            }
            if (backoffMax == null) {
                backoffMax = Duration.ofMinutes(1);
            }
            if (retentionWindow == null) {
                retentionWindow = Duration.ofDays(30);
            }
            if (maxDestroyAttempts <= 0) {
                maxDestroyAttempts = 5;
            }
        }
    }

    /**
     * @param evictInterval how often idle pools are swept
     * @param resumeOnStartup whether unfinished provisioning restarts when the gateway starts
     */
    public record Maintenance(Duration evictInterval, boolean resumeOnStartup) {

        public Maintenance {
            if (evictInterval == null) {
                evictInterval = Duration.ofMinutes(1);
            }
        }
    }
}
