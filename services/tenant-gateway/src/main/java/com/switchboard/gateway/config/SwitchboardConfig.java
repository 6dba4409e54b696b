package com.switchboard.gateway.config;

import com.switchboard.database.config.TenantDatabaseConfig;
import com.switchboard.gateway.infrastructure.events.LoggingTenantEventPublisher;
import com.switchboard.observability.ComponentHealth;
import com.switchboard.observability.HealthCheckRegistry;
import com.switchboard.observability.MetricFactory;
import com.switchboard.observability.SpanHelper;
import com.switchboard.tenancy.LoggingOperatorAlerts;
import com.switchboard.tenancy.OperatorAlerts;
import com.switchboard.tenancy.RetryBackoff;
import com.switchboard.tenancy.TenantStatus;
import com.switchboard.tenancy.lifecycle.LifecycleSettings;
import com.switchboard.tenancy.lifecycle.ProvisioningExecutor;
import com.switchboard.tenancy.lifecycle.TenantEventPublisher;
import com.switchboard.tenancy.lifecycle.TenantLifecycleService;
import com.switchboard.tenancy.registry.TenantRegistry;
import com.switchboard.tenancy.resolver.RoutingKeyExtractor;
import com.switchboard.tenancy.resolver.TenantCache;
import com.switchboard.tenancy.resolver.TenantResolver;
import com.switchboard.tenancy.routing.TenantRouter;
import com.switchboard.tenancy.store.PoolSettings;
import com.switchboard.tenancy.store.PoolStats;
import com.switchboard.tenancy.store.StoreConnector;
import com.switchboard.tenancy.store.StoreSwitchboard;
import com.switchboard.tenancy.store.SwitchboardSettings;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * Wires the tenancy core (resolver, switchboard, router, lifecycle) onto the JDBC backend from
 * {@link TenantDatabaseConfig}.
 *
 * <p>The core classes carry no Spring annotations; this is the only place they meet the
 * container.
 */
@Configuration
@EnableConfigurationProperties(SwitchboardProperties.class)
@Import(TenantDatabaseConfig.class)
public class SwitchboardConfig {

    /** Bean name for the scheduler that runs provisioning retries and retention timers. */
    public static final String LIFECYCLE_SCHEDULER_BEAN = "lifecycleScheduler";

    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final int LIFECYCLE_THREADS = 2;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry, SwitchboardProperties properties) {
        return new MetricFactory(meterRegistry, properties.serviceName());
    }

    /**
     * Spans go to whatever SDK the deployment installs globally (the OpenTelemetry Java agent,
     * typically); without one they are discarded.
     */
    @Bean
    public SpanHelper spanHelper(SwitchboardProperties properties) {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(properties.serviceName()));
    }

    @Bean
    public OperatorAlerts operatorAlerts() {
        return new LoggingOperatorAlerts();
    }

    @Bean
    public TenantEventPublisher tenantEventPublisher() {
        return new LoggingTenantEventPublisher();
    }

    @Bean
    public TenantCache tenantCache(Clock clock, SwitchboardProperties properties) {
        return new TenantCache(clock, properties.cache().readTtl(), properties.cache().maxEntries());
    }

    @Bean
    public TenantResolver tenantResolver(
            TenantRegistry registry, TenantCache cache, SwitchboardProperties properties) {
        return new TenantResolver(
                new RoutingKeyExtractor(properties.baseDomains()),
                registry,
                cache,
                properties.cache().readTtl(),
                properties.cache().mutationRevalidateAfter());
    }

    @Bean
    public StoreSwitchboard storeSwitchboard(
            StoreConnector connector,
            Clock clock,
            MetricFactory metrics,
            OperatorAlerts alerts,
            SwitchboardProperties properties) {
        var pool = properties.pool();
        var settings =
                new SwitchboardSettings(
                        new PoolSettings(
                                pool.maxSize(),
                                pool.acquireTimeout(),
                                pool.openAttempts(),
                                new RetryBackoff(
                                        pool.openBackoff(), pool.openBackoffMax(), BACKOFF_MULTIPLIER)),
                        pool.maxPools(),
                        pool.idleEvictAfter());
        return new StoreSwitchboard(connector, settings, clock, metrics, alerts);
    }

    @Bean
    public TenantRouter tenantRouter(
            TenantResolver resolver,
            StoreSwitchboard switchboard,
            Clock clock,
            SpanHelper spans,
            MetricFactory metrics) {
        return new TenantRouter(resolver, switchboard, clock, spans, metrics);
    }

    @Bean(name = LIFECYCLE_SCHEDULER_BEAN, destroyMethod = "shutdownNow")
    public ScheduledExecutorService lifecycleScheduler() {
        return Executors.newScheduledThreadPool(LIFECYCLE_THREADS);
    }

    @Bean
    public TenantLifecycleService tenantLifecycleService(
            TenantRegistry registry,
            ProvisioningExecutor executor,
            StoreSwitchboard switchboard,
            TenantEventPublisher publisher,
            OperatorAlerts alerts,
            ScheduledExecutorService lifecycleScheduler,
            Clock clock,
            TenantCache cache,
            SpanHelper spans,
            MetricFactory metrics,
            SwitchboardProperties properties) {
        var provisioning = properties.provisioning();
        var settings =
                new LifecycleSettings(
                        provisioning.maxAttempts(),
                        new RetryBackoff(
                                provisioning.backoff(), provisioning.backoffMax(), BACKOFF_MULTIPLIER),
                        provisioning.retentionWindow(),
                        provisioning.maxDestroyAttempts(),
                        new RetryBackoff(
                                provisioning.backoff(), provisioning.backoffMax(), BACKOFF_MULTIPLIER));
        var service =
                new TenantLifecycleService(
                        registry, executor, switchboard, publisher, alerts, lifecycleScheduler, clock,
                        settings, spans, metrics);
        service.addChangeListener(cache);
        return service;
    }

    /**
     * The registry is critical: without it no tenant resolves. Pool saturation only degrades,
     * because it concerns single tenants.
     */
    @Bean
    public HealthCheckRegistry switchboardHealthChecks(
            TenantRegistry registry, StoreSwitchboard switchboard) {
        var checks = new HealthCheckRegistry();
        checks.register("registry", () -> CompletableFuture.supplyAsync(() -> checkRegistry(registry)));
        checks.register("store-pools", () -> CompletableFuture.completedFuture(checkPools(switchboard)), false);
        return checks;
    }

    static ComponentHealth checkRegistry(TenantRegistry registry) {
        long start = System.currentTimeMillis();
        try {
            int provisioning = registry.findByStatus(EnumSet.of(TenantStatus.PROVISIONING)).size();
            return ComponentHealth.healthy("registry", System.currentTimeMillis() - start)
                    .withDetails(Map.of("provisioning", provisioning));
        } catch (RuntimeException e) {
            return ComponentHealth.unhealthy(
                    "registry", e.getMessage(), System.currentTimeMillis() - start);
        }
    }

    static ComponentHealth checkPools(StoreSwitchboard switchboard) {
        List<PoolStats> stats = switchboard.stats();
        List<String> saturated =
                stats.stream()
                        .filter(s -> !s.draining() && s.checkedOut() >= s.maxSize())
                        .map(PoolStats::tenantId)
                        .toList();
        Map<String, Object> details =
                Map.of(
                        "pools", stats.size(),
                        "checkedOut", switchboard.totalCheckedOut(),
                        "saturated", saturated);
        ComponentHealth health =
                saturated.isEmpty()
                        ? ComponentHealth.healthy("store-pools", 0)
                        : ComponentHealth.degraded(
                                "store-pools", saturated.size() + " tenant pool(s) saturated", 0);
        return health.withDetails(details);
    }
}
