package com.switchboard.tenancy.routing;

import com.switchboard.tenancy.RequestKind;
import com.switchboard.tenancy.TenantAccessException;
import com.switchboard.tenancy.store.PoolStats;
import com.switchboard.tenancy.store.StoreSessionException;
import com.switchboard.tenancy.testing.InMemoryTenancy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.switchboard.tenancy.testing.InMemoryTenancy.host;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Many concurrent requests across tenants with injected faults: every handle must come back,
 * no pool may exceed its bound, and each request sees only its own tenant's rows.
 */
@DisplayName("TenantRouter under concurrency")
class TenantRouterConcurrencyTest {

    private static final int POOL_SIZE = 3;
    private static final List<String> KEYS = List.of("acme", "globex", "initech", "hooli");

    private InMemoryTenancy tenancy;
    private ExecutorService workers;

    @BeforeEach
    void setUp() {
        tenancy = InMemoryTenancy.builder()
                .poolSize(POOL_SIZE)
                .acquireTimeout(Duration.ofMillis(50))
                .maxPools(3)
                .build();
        for (int i = 0; i < KEYS.size(); i++) {
            tenancy.addActive("T" + (i + 1), KEYS.get(i));
        }
        workers = Executors.newFixedThreadPool(16);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
        tenancy.close();
    }

    @Test
    @DisplayName("no handle leaks and no cross-tenant rows under faults")
    void noLeaksUnderFaults() throws Exception {
        tenancy.connector().failNextOpens("tenant_globex", 5);
        Map<String, AtomicInteger> maxConcurrent = new ConcurrentHashMap<>();
        Map<String, AtomicInteger> concurrent = new ConcurrentHashMap<>();
        AtomicInteger crossTenantRows = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);

        List<Callable<Void>> requests = new ArrayList<>();
        for (int i = 0; i < 400; i++) {
            int n = i;
            requests.add(() -> {
                start.await();
                String key = KEYS.get(n % KEYS.size());
                try {
                    router().execute(host(key), RequestKind.MUTATION, binding -> {
                        String tenantId = binding.tenantId();
                        int now = concurrent.computeIfAbsent(tenantId, k -> new AtomicInteger()).incrementAndGet();
                        maxConcurrent.computeIfAbsent(tenantId, k -> new AtomicInteger())
                                .accumulateAndGet(now, Math::max);
                        try {
                            binding.update("INSERT INTO employees (id, tenant) VALUES (?, ?)", "e" + n, tenantId);
                            for (Map<String, Object> row : binding.query("SELECT * FROM employees")) {
                                if (!tenantId.equals(row.get("tenant"))) {
                                    crossTenantRows.incrementAndGet();
                                }
                            }
                            if (n % 7 == 0) {
                                throw new IllegalStateException("handler failure");
                            }
                            if (n % 11 == 0) {
                                binding.handle().markBroken();
                            }
                            return null;
                        } finally {
                            concurrent.get(tenantId).decrementAndGet();
                        }
                    });
                } catch (TenantAccessException | IllegalStateException | StoreSessionException expected) {
                    // failures are part of the scenario; leaks are asserted afterwards
                }
                return null;
            });
        }

        List<Future<Void>> futures = new ArrayList<>();
        for (Callable<Void> request : requests) {
            futures.add(workers.submit(request));
        }
        start.countDown();
        for (Future<Void> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }

        assertThat(crossTenantRows).hasValue(0);
        assertThat(maxConcurrent.values()).allSatisfy(max -> assertThat(max.get()).isLessThanOrEqualTo(POOL_SIZE));
        assertThat(tenancy.switchboard().totalCheckedOut()).isZero();
        int idle = tenancy.switchboard().stats().stream().mapToInt(PoolStats::idle).sum();
        assertThat(tenancy.connector().liveSessions()).isEqualTo(idle);
        assertThat(tenancy.switchboard().poolCount()).isLessThanOrEqualTo(3);
    }

    private TenantRouter router() {
        return tenancy.router();
    }
}
