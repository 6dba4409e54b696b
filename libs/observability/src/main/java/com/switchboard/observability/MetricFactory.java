package com.switchboard.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.function.Supplier;

/**
 * Factory for Micrometer meters with a fixed {@code service} tag and optional tenant
 * segmentation.
 * <p>
 * Tenant tags are always passed explicitly by the caller. Tenant cardinality is bounded by the
 * registry, but callers should only tag per tenant where an operator needs the breakdown
 * (exhausted pools, unreachable stores), not on every request counter.
 */
public final class MetricFactory {

    /** Tag key for tenant segmentation. */
    public static final String TAG_TENANT = "tenant";

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * Creates a MetricFactory bound to the given registry and service name.
     *
     * @param registry    the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     * @param serviceName logical service name included as a default tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Creates (or looks up) a counter tagged with the service name.
     *
     * @param name        metric name (e.g., "switchboard.bind")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     * @return the counter
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Creates (or looks up) a counter segmented by tenant.
     *
     * @param name        metric name
     * @param description human-readable description
     * @param tenantId    tenant the event belongs to
     * @param tags        additional tags (key-value pairs)
     * @return the counter
     */
    public Counter tenantCounter(String name, String description, String tenantId, String... tags) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags).and(TAG_TENANT, tenantId))
                .register(registry);
    }

    /**
     * Creates (or looks up) a timer tagged with the service name.
     *
     * @param name        metric name (e.g., "switchboard.acquire")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     * @return the timer
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Registers a gauge that samples the supplier on every scrape.
     *
     * @param name        metric name (e.g., "switchboard.pools")
     * @param description human-readable description
     * @param supplier    source of the current value
     * @param tags        additional tags (key-value pairs)
     */
    public void gauge(String name, String description, Supplier<Number> supplier, String... tags) {
        Gauge.builder(name, supplier)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Returns the underlying meter registry.
     */
    public MeterRegistry registry() {
        return registry;
    }

    /**
     * Returns the service name used as a default tag.
     */
    public String serviceName() {
        return serviceName;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
