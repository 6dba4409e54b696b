package com.switchboard.tenancy.resolver;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.switchboard.tenancy.Tenant;
import com.switchboard.tenancy.registry.TenantChangeListener;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Node-local cache of registry records keyed by routing key.
 * <p>
 * Only hits are stored; a routing key that was not found is looked up again on the next
 * request. Lifecycle transitions on this node invalidate entries through
 * {@link #tenantChanged(Tenant)}; other nodes converge within the read TTL.
 * <p>
 * A reload runs inside the map's per-key compute, so an invalidation of the same key waits for
 * the reload to finish and then removes what it stored. A registry read that started before a
 * status change can therefore never outlive the invalidation that change triggers.
 */
public final class TenantCache implements TenantChangeListener {

    /** A cached record and the time it was loaded. */
    public record Entry(Tenant tenant, Instant loadedAt) {

        public Duration age(Instant now) {
            return Duration.between(loadedAt, now);
        }

        boolean youngerThan(Duration maxAge, Instant now) {
            return age(now).compareTo(maxAge) < 0;
        }
    }

    private final Cache<String, Entry> entries;
    private final Clock clock;

    public TenantCache(Clock clock, Duration readTtl, int maxEntries) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (readTtl == null || readTtl.isNegative()) {
            throw new IllegalArgumentException("readTtl must be non-negative");
        }
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1");
        }
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(readTtl)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    public Optional<Entry> get(String routingKey) {
        return Optional.ofNullable(entries.getIfPresent(routingKey));
    }

    /**
     * Returns the cached entry if it is younger than {@code maxAge}, otherwise asks the loader
     * and caches what it finds. An empty load drops the key.
     */
    public Optional<Entry> getOrLoad(String routingKey, Duration maxAge,
                                     Function<String, Optional<Tenant>> loader) {
        Entry cached = entries.getIfPresent(routingKey);
        if (cached != null && cached.youngerThan(maxAge, clock.instant())) {
            return Optional.of(cached);
        }
        Entry loaded = entries.asMap().compute(routingKey, (key, current) -> {
            if (current != null && current.youngerThan(maxAge, clock.instant())) {
                return current;
            }
            return loader.apply(key)
                    .map(tenant -> new Entry(tenant, clock.instant()))
                    .orElse(null);
        });
        return Optional.ofNullable(loaded);
    }

    public Entry put(Tenant tenant) {
        Entry entry = new Entry(tenant, clock.instant());
        entries.put(tenant.routingKey(), entry);
        return entry;
    }

    public void invalidate(String routingKey) {
        entries.invalidate(routingKey);
    }

    /**
     * Drops every entry for the tenant, matching on tenant id as well as routing key.
     */
    public void invalidateTenant(String tenantId) {
        entries.asMap().values().removeIf(e -> e.tenant().tenantId().equals(tenantId));
    }

    @Override
    public void tenantChanged(Tenant tenant) {
        invalidate(tenant.routingKey());
        invalidateTenant(tenant.tenantId());
    }

    public void clear() {
        entries.invalidateAll();
    }

    public long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }
}
