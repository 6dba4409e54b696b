package com.switchboard.tenancy.resolver;

import com.switchboard.tenancy.RequestKind;
import com.switchboard.tenancy.Tenant;
import com.switchboard.tenancy.TenantNotReadyException;
import com.switchboard.tenancy.TenantRetiredException;
import com.switchboard.tenancy.TenantSuspendedException;
import com.switchboard.tenancy.UnknownTenantException;
import com.switchboard.tenancy.registry.TenantRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Maps a request host to an active tenant.
 * <p>
 * Reads trust a cached record for {@code readTtl}. Mutations only trust it for
 * {@code mutationRevalidateAfter}, so a tenant suspended on another node stops accepting writes
 * sooner than it stops serving reads. Resolution never writes to the registry and never retries:
 * the same host and registry state always produce the same outcome.
 */
public final class TenantResolver {

    private static final Logger log = LoggerFactory.getLogger(TenantResolver.class);

    private final RoutingKeyExtractor extractor;
    private final TenantRegistry registry;
    private final TenantCache cache;
    private final Duration readTtl;
    private final Duration mutationRevalidateAfter;

    public TenantResolver(RoutingKeyExtractor extractor, TenantRegistry registry, TenantCache cache,
                          Duration readTtl, Duration mutationRevalidateAfter) {
        if (readTtl.isNegative() || mutationRevalidateAfter.isNegative()) {
            throw new IllegalArgumentException("cache durations must be non-negative");
        }
        this.extractor = extractor;
        this.registry = registry;
        this.cache = cache;
        this.readTtl = readTtl;
        this.mutationRevalidateAfter = mutationRevalidateAfter;
    }

    /**
     * Resolves the tenant addressed by a host.
     *
     * @param host raw request host
     * @param kind read or mutation
     * @return the active tenant
     * @throws UnknownTenantException   no routing key, or no tenant for it
     * @throws TenantNotReadyException  the tenant is still pending or provisioning
     * @throws TenantSuspendedException the tenant is suspended
     * @throws TenantRetiredException   the tenant is retired
     */
    public Tenant resolve(String host, RequestKind kind) {
        String routingKey = extractor.extract(host)
                .orElseThrow(() -> new UnknownTenantException(""));
        return resolveRoutingKey(routingKey, kind);
    }

    /**
     * Resolves an already extracted routing key.
     */
    public Tenant resolveRoutingKey(String routingKey, RequestKind kind) {
        Tenant tenant = lookup(routingKey, kind)
                .orElseThrow(() -> new UnknownTenantException(routingKey));
        return requireActive(tenant);
    }

    /**
     * Maps a registry record to the resolution outcome for its status.
     */
    public static Tenant requireActive(Tenant tenant) {
        return switch (tenant.status()) {
            case ACTIVE -> tenant;
            case PENDING, PROVISIONING -> throw new TenantNotReadyException(tenant.tenantId(), tenant.status());
            case SUSPENDED -> throw new TenantSuspendedException(tenant.tenantId());
            case RETIRED -> throw new TenantRetiredException(tenant.tenantId());
        };
    }

    private Optional<Tenant> lookup(String routingKey, RequestKind kind) {
        Duration maxAge = kind == RequestKind.MUTATION ? mutationRevalidateAfter : readTtl;
        Optional<Tenant> found = cache.getOrLoad(routingKey, maxAge, registry::findByRoutingKey)
                .map(TenantCache.Entry::tenant);
        if (found.isEmpty()) {
            log.debug("No tenant for routing key '{}'", routingKey);
        }
        return found;
    }

    public TenantCache cache() {
        return cache;
    }
}
