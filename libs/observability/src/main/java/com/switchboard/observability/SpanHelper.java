package com.switchboard.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that attaches the current correlation
 * attributes to every span it opens.
 * <p>
 * The helper does NOT configure the SDK. Services wire the tracer they want; libraries that are
 * used without tracing fall back to {@link #noop()}.
 */
public final class SpanHelper {

    private final Tracer tracer;

    /**
     * Creates a SpanHelper backed by the given OTel tracer.
     *
     * @param tracer the OpenTelemetry tracer
     */
    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Returns a helper whose spans are discarded.
     */
    public static SpanHelper noop() {
        return new SpanHelper(OpenTelemetry.noop().getTracer("switchboard"));
    }

    /**
     * Runs the supplier inside a new internal span.
     *
     * @param spanName   name for the span
     * @param attributes additional span attributes
     * @param work       the work to execute within the span
     * @param <T>        return type
     * @return the supplier's result
     */
    public <T> T inSpan(String spanName, Map<String, String> attributes, Supplier<T> work) {
        return inSpan(spanName, SpanKind.INTERNAL, attributes, work);
    }

    /**
     * Runs the supplier inside a new span. Runtime exceptions are recorded on the span and
     * re-thrown unchanged.
     *
     * @param spanName   name for the span
     * @param kind       span kind (INTERNAL, SERVER, CLIENT, PRODUCER, CONSUMER)
     * @param attributes additional span attributes
     * @param work       the work to execute within the span
     * @param <T>        return type
     * @return the supplier's result
     */
    public <T> T inSpan(String spanName, SpanKind kind, Map<String, String> attributes,
                        Supplier<T> work) {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(spanBuilder::setAttribute);

        Span span = spanBuilder.startSpan();
        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute("correlation.id", ctx.correlationId());
            if (ctx.tenantId() != null) {
                span.setAttribute("tenant.id", ctx.tenantId());
            }
            if (ctx.routingKey() != null) {
                span.setAttribute("tenant.routing_key", ctx.routingKey());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
