package com.switchboard.tenancy.resolver;

import com.switchboard.tenancy.RequestKind;
import com.switchboard.tenancy.Tenant;
import com.switchboard.tenancy.TenantFailure;
import com.switchboard.tenancy.TenantNotReadyException;
import com.switchboard.tenancy.TenantRetiredException;
import com.switchboard.tenancy.TenantStatus;
import com.switchboard.tenancy.TenantSuspendedException;
import com.switchboard.tenancy.UnknownTenantException;
import com.switchboard.tenancy.registry.TenantRegistry;
import com.switchboard.tenancy.testing.InMemoryTenantRegistry;
import com.switchboard.tenancy.testing.MutableClock;
import com.switchboard.tenancy.testing.TestTenantFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("TenantResolver")
class TenantResolverTest {

    private MutableClock clock;
    private InMemoryTenantRegistry registry;
    private TenantCache cache;
    private TenantResolver resolver;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-02T08:00:00Z");
        registry = new InMemoryTenantRegistry();
        cache = new TenantCache(clock, Duration.ofSeconds(30), 100);
        resolver = new TenantResolver(new RoutingKeyExtractor(List.of("example.com")), registry, cache,
                Duration.ofSeconds(30), Duration.ofSeconds(2));
    }

    @Nested
    @DisplayName("status mapping")
    class StatusMapping {

        @Test
        @DisplayName("acme.example.com resolves to active T1")
        void activeTenantResolves() {
            registry.put(TestTenantFactory.active("T1", "acme"));
            Tenant tenant = resolver.resolve("acme.example.com", RequestKind.READ);
            assertThat(tenant.tenantId()).isEqualTo("T1");
        }

        @Test
        @DisplayName("ghost.example.com fails with not_found")
        void unknownTenant() {
            assertThatThrownBy(() -> resolver.resolve("ghost.example.com", RequestKind.READ))
                    .isInstanceOf(UnknownTenantException.class)
                    .satisfies(e -> assertThat(((UnknownTenantException) e).failure()).isEqualTo(TenantFailure.NOT_FOUND))
                    .hasMessageContaining("ghost");
        }

        @Test
        @DisplayName("apex host fails with not_found")
        void apexHost() {
            assertThatThrownBy(() -> resolver.resolve("example.com", RequestKind.READ))
                    .isInstanceOf(UnknownTenantException.class);
        }

        @Test
        @DisplayName("pending and provisioning tenants are not ready, never not_found")
        void provisioningTenantsNotReady() {
            registry.put(TestTenantFactory.withStatus("T4", "initech", TenantStatus.PENDING));
            registry.put(TestTenantFactory.withStatus("T5", "hooli", TenantStatus.PROVISIONING));

            assertThatThrownBy(() -> resolver.resolve("initech.example.com", RequestKind.READ))
                    .isInstanceOf(TenantNotReadyException.class);
            assertThatThrownBy(() -> resolver.resolve("hooli.example.com", RequestKind.MUTATION))
                    .isInstanceOf(TenantNotReadyException.class)
                    .satisfies(e -> assertThat(((TenantNotReadyException) e).status()).isEqualTo(TenantStatus.PROVISIONING));
        }

        @Test
        void suspendedTenant() {
            registry.put(TestTenantFactory.withStatus("T2", "globex", TenantStatus.SUSPENDED));
            assertThatThrownBy(() -> resolver.resolve("globex.example.com", RequestKind.READ))
                    .isInstanceOf(TenantSuspendedException.class);
        }

        @Test
        void retiredTenant() {
            registry.put(TestTenantFactory.withStatus("T9", "umbrella", TenantStatus.RETIRED));
            assertThatThrownBy(() -> resolver.resolve("umbrella.example.com", RequestKind.READ))
                    .isInstanceOf(TenantRetiredException.class);
        }

        @Test
        @DisplayName("custom hosts resolve by the whole host")
        void customHost() {
            registry.put(TestTenantFactory.active("T7", "payroll.acme.co.uk"));
            assertThat(resolver.resolve("payroll.acme.co.uk:443", RequestKind.READ).tenantId()).isEqualTo("T7");
        }
    }

    @Nested
    @DisplayName("caching")
    class Caching {

        @BeforeEach
        void seed() {
            registry.put(TestTenantFactory.active("T1", "acme"));
        }

        @Test
        @DisplayName("reads within the TTL are served from cache")
        void readsServedFromCache() {
            resolver.resolve("acme.example.com", RequestKind.READ);
            clock.advance(Duration.ofSeconds(29));
            resolver.resolve("acme.example.com", RequestKind.READ);

            assertThat(registry.routingKeyLookups()).isEqualTo(1);
        }

        @Test
        @DisplayName("reads after the TTL reload from the registry")
        void readsAfterTtlReload() {
            resolver.resolve("acme.example.com", RequestKind.READ);
            clock.advance(Duration.ofSeconds(30));
            resolver.resolve("acme.example.com", RequestKind.READ);

            assertThat(registry.routingKeyLookups()).isEqualTo(2);
        }

        @Test
        @DisplayName("mutations revalidate stale-ish entries")
        void mutationsRevalidate() {
            resolver.resolve("acme.example.com", RequestKind.READ);
            registry.put(TestTenantFactory.withStatus("T1", "acme", TenantStatus.SUSPENDED));
            clock.advance(Duration.ofSeconds(3));

            assertThat(resolver.resolve("acme.example.com", RequestKind.READ).status()).isEqualTo(TenantStatus.ACTIVE);
            assertThatThrownBy(() -> resolver.resolve("acme.example.com", RequestKind.MUTATION))
                    .isInstanceOf(TenantSuspendedException.class);
        }

        @Test
        @DisplayName("invalidation makes the next read see the registry")
        void invalidation() {
            resolver.resolve("acme.example.com", RequestKind.READ);
            Tenant suspended = TestTenantFactory.withStatus("T1", "acme", TenantStatus.SUSPENDED);
            registry.put(suspended);
            cache.tenantChanged(suspended);

            assertThatThrownBy(() -> resolver.resolve("acme.example.com", RequestKind.READ))
                    .isInstanceOf(TenantSuspendedException.class);
        }

        /**
         * WHY: a lookup that read the registry just before a suspension must not put the old
         * ACTIVE record back after the suspension cleared the cache, or reads keep binding to
         * the suspended tenant for the whole read TTL.
         */
        @Test
        @DisplayName("a registry read in flight during a suspension does not re-cache the active record")
        void inFlightReadDoesNotOutliveSuspension() throws Exception {
            Tenant active = TestTenantFactory.active("T2", "globex");
            Tenant suspended = TestTenantFactory.withStatus("T2", "globex", TenantStatus.SUSPENDED);
            var current = new AtomicReference<>(active);
            var readStarted = new CountDownLatch(1);
            var releaseRead = new CountDownLatch(1);

            TenantRegistry slowRegistry = mock(TenantRegistry.class);
            when(slowRegistry.findByRoutingKey("globex")).thenAnswer(invocation -> {
                Tenant snapshot = current.get();
                readStarted.countDown();
                releaseRead.await(5, TimeUnit.SECONDS);
                return Optional.of(snapshot);
            });
            var slowCache = new TenantCache(clock, Duration.ofSeconds(30), 100);
            var slowResolver = new TenantResolver(new RoutingKeyExtractor(List.of("example.com")),
                    slowRegistry, slowCache, Duration.ofSeconds(30), Duration.ofSeconds(2));

            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                Future<Tenant> inFlight = executor.submit(
                        () -> slowResolver.resolve("globex.example.com", RequestKind.READ));
                assertThat(readStarted.await(5, TimeUnit.SECONDS)).isTrue();

                current.set(suspended);
                Future<?> invalidation = executor.submit(() -> slowCache.tenantChanged(suspended));
                finishesWithin(invalidation, Duration.ofMillis(200));
                releaseRead.countDown();

                assertThat(inFlight.get(5, TimeUnit.SECONDS).status()).isEqualTo(TenantStatus.ACTIVE);
                invalidation.get(5, TimeUnit.SECONDS);
                clock.advance(Duration.ofSeconds(10));

                assertThatThrownBy(() -> slowResolver.resolve("globex.example.com", RequestKind.READ))
                        .isInstanceOf(TenantSuspendedException.class);
            } finally {
                executor.shutdownNow();
            }
        }

        private boolean finishesWithin(Future<?> future, Duration wait)
                throws InterruptedException, ExecutionException {
            try {
                future.get(wait.toMillis(), TimeUnit.MILLISECONDS);
                return true;
            } catch (TimeoutException stillBlocked) {
                return false;
            }
        }

        @Test
        @DisplayName("misses are not cached")
        void missesNotCached() {
            assertThatThrownBy(() -> resolver.resolve("ghost.example.com", RequestKind.READ))
                    .isInstanceOf(UnknownTenantException.class);
            registry.put(TestTenantFactory.active("T8", "ghost"));

            assertThat(resolver.resolve("ghost.example.com", RequestKind.READ).tenantId()).isEqualTo("T8");
        }

        @Test
        @DisplayName("resolution is idempotent")
        void idempotent() {
            Tenant first = resolver.resolve("acme.example.com", RequestKind.READ);
            Tenant second = resolver.resolve("acme.example.com", RequestKind.READ);
            clock.advance(Duration.ofMinutes(5));
            Tenant third = resolver.resolve("acme.example.com", RequestKind.MUTATION);

            assertThat(first).isEqualTo(second).isEqualTo(third);
            assertThat(registry.size()).isEqualTo(1);
        }
    }
}
