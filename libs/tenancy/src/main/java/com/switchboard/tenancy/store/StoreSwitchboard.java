package com.switchboard.tenancy.store;

import com.switchboard.observability.MetricFactory;
import com.switchboard.tenancy.OperatorAlerts;
import com.switchboard.tenancy.PoolExhaustedException;
import com.switchboard.tenancy.StoreUnavailableException;
import com.switchboard.tenancy.Tenant;
import com.switchboard.tenancy.TenantRetiredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;

/**
 * Hands out store handles from one bounded pool per tenant.
 * <p>
 * Pools are created on first use and evicted least-recently-used when more than
 * {@link SwitchboardSettings#maxPools()} exist or when unused for
 * {@link SwitchboardSettings#idleEvictAfter()}. An evicted pool drains in the background; a
 * request racing with eviction gets a fresh pool. A tenant that is being retired is sealed and
 * can never acquire again.
 * <p>
 * Each tenant's bound is a semaphore shared by its live pool and any pool still draining. The
 * semaphore is dropped once the tenant has no pool and no handle checked out.
 * <p>
 * Failures stay with the tenant that caused them: an unreachable store or an exhausted pool
 * never affects another tenant's pool.
 */
public final class StoreSwitchboard {

    private static final Logger log = LoggerFactory.getLogger(StoreSwitchboard.class);

    private final Map<String, TenantPool> pools = new ConcurrentHashMap<>();
    private final Map<String, Semaphore> slots = new ConcurrentHashMap<>();
    private final Set<String> sealed = ConcurrentHashMap.newKeySet();
    private final StoreConnector connector;
    private final SwitchboardSettings settings;
    private final Clock clock;
    private final MetricFactory metrics;
    private final OperatorAlerts alerts;

    public StoreSwitchboard(StoreConnector connector, SwitchboardSettings settings, Clock clock,
                            MetricFactory metrics, OperatorAlerts alerts) {
        if (connector == null || settings == null || clock == null || metrics == null || alerts == null) {
            throw new IllegalArgumentException("all switchboard collaborators are required");
        }
        this.connector = connector;
        this.settings = settings;
        this.clock = clock;
        this.metrics = metrics;
        this.alerts = alerts;
        metrics.gauge("switchboard.pools", "Open tenant pools", pools::size);
        metrics.gauge("switchboard.handles.checked_out", "Store handles currently checked out",
                this::totalCheckedOut);
    }

    /**
     * Checks out a handle on the tenant's store. The caller owns the handle and must release it.
     *
     * @param tenant an active tenant
     * @throws TenantRetiredException    the tenant is sealed for retirement
     * @throws PoolExhaustedException    the tenant's pool stayed full for the acquire timeout
     * @throws StoreUnavailableException the tenant's store could not be opened
     * @throws com.switchboard.tenancy.AcquisitionCancelledException the caller was interrupted
     */
    public StoreHandle acquire(Tenant tenant) {
        String tenantId = tenant.tenantId();
        while (true) {
            if (sealed.contains(tenantId)) {
                throw new TenantRetiredException(tenantId);
            }
            TenantPool pool = pools.computeIfAbsent(tenantId, id -> new TenantPool(id, tenant.storeName(),
                    connector, settings.pool(), clock, slotsFor(id)));
            StoreHandle handle;
            try {
                handle = pool.acquire();
            } catch (TenantPool.PoolClosedException e) {
                pools.remove(tenantId, pool);
                continue;
            } catch (PoolExhaustedException e) {
                metrics.tenantCounter("switchboard.pool.exhausted", "Acquisitions that timed out", tenantId)
                        .increment();
                throw e;
            } catch (StoreUnavailableException e) {
                metrics.tenantCounter("switchboard.store.unavailable", "Stores that could not be opened", tenantId)
                        .increment();
                alerts.raise(tenantId, "store_unavailable",
                        "Store '%s' unreachable after %d attempts".formatted(tenant.storeName(),
                                settings.pool().openAttempts()),
                        e.getCause());
                throw e;
            }

            if (sealed.contains(tenantId)) {
                // retire() ran after the first check and may have missed this pool
                handle.release();
                if (pools.remove(tenantId, pool)) {
                    drain(pool);
                }
                throw new TenantRetiredException(tenantId);
            }
            enforcePoolLimit(tenantId);
            return handle;
        }
    }

    /**
     * Seals the tenant so it can never acquire again and drains its pool.
     *
     * @return completes when every in-flight handle is released and the pool's sessions are closed
     */
    public CompletableFuture<Void> retire(String tenantId) {
        sealed.add(tenantId);
        TenantPool pool = pools.remove(tenantId);
        if (pool == null) {
            return CompletableFuture.completedFuture(null);
        }
        log.info("Sealed tenant '{}', draining {} checked-out handle(s)", tenantId, pool.checkedOut());
        return drain(pool);
    }

    /**
     * Drops the seal and the bound of a retired tenant whose store no longer exists.
     */
    public void forget(String tenantId) {
        evict(tenantId);
        sealed.remove(tenantId);
        dropIdleSlots(tenantId);
    }

    /**
     * Removes and drains one tenant's pool without sealing it. A later acquisition opens a new pool.
     */
    public CompletableFuture<Void> evict(String tenantId) {
        TenantPool pool = pools.remove(tenantId);
        if (pool == null) {
            return CompletableFuture.completedFuture(null);
        }
        return drain(pool);
    }

    /**
     * Evicts pools unused for longer than the idle threshold, then the least recently used pools
     * while more than the maximum remain.
     *
     * @return number of pools evicted
     */
    public int evictIdle() {
        Instant cutoff = clock.instant().minus(settings.idleEvictAfter());
        int evicted = 0;
        for (TenantPool pool : new ArrayList<>(pools.values())) {
            if (pool.checkedOut() == 0 && pool.lastUsedAt().isBefore(cutoff) && evict(pool, "idle")) {
                evicted++;
            }
        }
        evicted += enforcePoolLimit(null);
        return evicted;
    }

    private Semaphore slotsFor(String tenantId) {
        return slots.computeIfAbsent(tenantId, id -> new Semaphore(settings.pool().maxSize(), true));
    }

    private int enforcePoolLimit(String keepTenantId) {
        int evicted = 0;
        while (pools.size() > settings.maxPools()) {
            Optional<TenantPool> lru = pools.values().stream()
                    .filter(p -> !p.tenantId().equals(keepTenantId))
                    .min(Comparator.comparing(TenantPool::lastUsedAt));
            if (lru.isEmpty()) {
                break;
            }
            if (evict(lru.get(), "lru")) {
                evicted++;
            }
        }
        return evicted;
    }

    private boolean evict(TenantPool pool, String reason) {
        if (!pools.remove(pool.tenantId(), pool)) {
            return false;
        }
        log.debug("Evicting pool for tenant '{}' ({})", pool.tenantId(), reason);
        metrics.counter("switchboard.pool.evicted", "Tenant pools evicted", "reason", reason).increment();
        drain(pool);
        return true;
    }

    private CompletableFuture<Void> drain(TenantPool pool) {
        CompletableFuture<Void> drained = pool.drain();
        drained.whenComplete((ignored, error) -> dropIdleSlots(pool.tenantId()));
        return drained;
    }

    // runs under the pool map's lock for the key, so no pool can pick up the semaphore meanwhile
    private void dropIdleSlots(String tenantId) {
        pools.compute(tenantId, (id, current) -> {
            if (current == null) {
                slots.computeIfPresent(id, (key, permits) ->
                        permits.availablePermits() == settings.pool().maxSize() ? null : permits);
            }
            return current;
        });
    }

    /**
     * Drains every pool. Used on shutdown.
     */
    public CompletableFuture<Void> drainAll() {
        List<CompletableFuture<Void>> drains = new ArrayList<>();
        for (String tenantId : new ArrayList<>(pools.keySet())) {
            drains.add(evict(tenantId));
        }
        return CompletableFuture.allOf(drains.toArray(new CompletableFuture[0]));
    }

    public boolean isSealed(String tenantId) {
        return sealed.contains(tenantId);
    }

    public int poolCount() {
        return pools.size();
    }

    /** Number of tenants holding a bound semaphore. */
    int boundedTenants() {
        return slots.size();
    }

    public int checkedOut(String tenantId) {
        TenantPool pool = pools.get(tenantId);
        return pool == null ? 0 : pool.checkedOut();
    }

    public int totalCheckedOut() {
        return pools.values().stream().mapToInt(TenantPool::checkedOut).sum();
    }

    public Optional<PoolStats> stats(String tenantId) {
        return Optional.ofNullable(pools.get(tenantId)).map(TenantPool::stats);
    }

    public List<PoolStats> stats() {
        return pools.values().stream()
                .map(TenantPool::stats)
                .sorted(Comparator.comparing(PoolStats::tenantId))
                .toList();
    }

    public SwitchboardSettings settings() {
        return settings;
    }
}
