package com.switchboard.tenancy.routing;

import com.switchboard.observability.MetricFactory;
import com.switchboard.observability.SpanHelper;
import com.switchboard.tenancy.RequestKind;
import com.switchboard.tenancy.Tenant;
import com.switchboard.tenancy.TenantAccessException;
import com.switchboard.tenancy.resolver.TenantResolver;
import com.switchboard.tenancy.store.StoreHandle;
import com.switchboard.tenancy.store.StoreSwitchboard;
import io.opentelemetry.api.trace.SpanKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.function.Function;

/**
 * Entry point for request routing: resolve the tenant from the host, then check out a handle on
 * its store.
 * <p>
 * Nothing is acquired unless resolution succeeds, and a binding holds exactly one handle.
 * Callers that cannot use try-with-resources should go through {@link #execute}, which releases
 * on every exit path.
 */
public final class TenantRouter {

    private static final Logger log = LoggerFactory.getLogger(TenantRouter.class);

    static final String BIND_METRIC = "switchboard.bind";

    private final TenantResolver resolver;
    private final StoreSwitchboard switchboard;
    private final Clock clock;
    private final SpanHelper spans;
    private final MetricFactory metrics;

    public TenantRouter(TenantResolver resolver, StoreSwitchboard switchboard, Clock clock,
                        SpanHelper spans, MetricFactory metrics) {
        this.resolver = resolver;
        this.switchboard = switchboard;
        this.clock = clock;
        this.spans = spans;
        this.metrics = metrics;
    }

    /**
     * Binds a request to its tenant.
     *
     * @param host request host
     * @param kind read or mutation
     * @return a binding the caller must close
     * @throws TenantAccessException when the tenant cannot be resolved or its store cannot be reached
     */
    public TenantBinding bind(String host, RequestKind kind) {
        return spans.inSpan("tenant.bind", SpanKind.INTERNAL,
                Map.of("request.kind", kind.name()), () -> doBind(host, kind));
    }

    /**
     * Binds, runs {@code work} against the binding, and releases the handle however the work ends.
     */
    public <T> T execute(String host, RequestKind kind, Function<TenantBinding, T> work) {
        try (TenantBinding binding = bind(host, kind)) {
            return work.apply(binding);
        }
    }

    /**
     * Like {@link #bind} but reports failures as a value.
     */
    public BindOutcome tryBind(String host, RequestKind kind) {
        try {
            return BindOutcome.bound(bind(host, kind));
        } catch (TenantAccessException e) {
            return BindOutcome.failed(e);
        }
    }

    private TenantBinding doBind(String host, RequestKind kind) {
        Tenant tenant;
        StoreHandle handle;
        try {
            tenant = resolver.resolve(host, kind);
            handle = switchboard.acquire(tenant);
        } catch (TenantAccessException e) {
            record(e.failure().code());
            log.debug("Bind failed for host '{}': {}", host, e.getMessage());
            throw e;
        }
        record("bound");
        return new TenantBinding(tenant, kind, handle, clock.instant());
    }

    private void record(String outcome) {
        metrics.counter(BIND_METRIC, "Tenant bind attempts by outcome", "outcome", outcome).increment();
    }
}
