package com.switchboard.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;

/**
 * Immutable correlation context that flows with a single inbound request.
 * <p>
 * The gateway establishes a {@code CorrelationContext} as soon as a request arrives and enriches
 * it with the tenant identity once the tenant has been resolved. The values are copied into SLF4J
 * MDC for log output only: nothing that touches a tenant store reads the tenant from here. The
 * authoritative tenant for data access is the explicit request binding.
 *
 * @param correlationId unique ID for the business flow (propagated via {@code X-Correlation-ID})
 * @param tenantId      resolved tenant identifier (nullable until resolution succeeds)
 * @param routingKey    routing key the tenant was resolved from (nullable until resolution)
 * @param requestId     unique ID for this specific request
 * @param spanId        current OpenTelemetry span ID (nullable if tracing is not active)
 * @param traceId       current OpenTelemetry trace ID (nullable if tracing is not active)
 */
public record CorrelationContext(
        String correlationId,
        String tenantId,
        String routingKey,
        String requestId,
        String spanId,
        String traceId
) {

    /**
     * MDC key for correlation ID.
     */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /**
     * MDC key for tenant ID.
     */
    public static final String MDC_TENANT_ID = "tenantId";

    /**
     * MDC key for routing key.
     */
    public static final String MDC_ROUTING_KEY = "routingKey";

    /**
     * MDC key for request ID.
     */
    public static final String MDC_REQUEST_ID = "requestId";

    /**
     * MDC key for span ID.
     */
    public static final String MDC_SPAN_ID = "spanId";

    /**
     * MDC key for trace ID.
     */
    public static final String MDC_TRACE_ID = "traceId";

    /**
     * Compact constructor: ensures correlationId is never null.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context for a new request. Span and trace IDs are taken from the current
     * OpenTelemetry span when one is active, and left null otherwise.
     */
    public static CorrelationContext forRequest(String correlationId, String requestId) {
        SpanContext span = Span.current().getSpanContext();
        if (!span.isValid()) {
            return new CorrelationContext(correlationId, null, null, requestId, null, null);
        }
        return new CorrelationContext(correlationId, null, null, requestId, span.getSpanId(), span.getTraceId());
    }

    /**
     * Returns a copy of this context enriched with the resolved tenant.
     *
     * @param tenantId   resolved tenant identifier
     * @param routingKey routing key the tenant was resolved from
     * @return a new context; this instance is unchanged
     */
    public CorrelationContext withTenant(String tenantId, String routingKey) {
        return new CorrelationContext(correlationId, tenantId, routingKey, requestId, spanId, traceId);
    }
}
