package com.switchboard.eventmodel;

import java.time.Instant;

/**
 * Envelope wrapping every tenant lifecycle event.
 *
 * <p>Events are immutable once created. Consumers use {@code eventType} to pick the payload type
 * and {@code causationId} to link a completion back to the intent that triggered it.
 *
 * @param <T> the type of the event payload
 */
public record EventEnvelope<T>(
        /** Unique identifier for this event instance (UUID v4). */
        String eventId,

        /** The kind of lifecycle event. */
        EventType eventType,

        /** Schema version of this event type, starting at 1. */
        int eventVersion,

        /** When the event occurred. */
        Instant occurredAt,

        /** Name of the component that produced the event. */
        String producer,

        /** Tenant the event is about. */
        String tenantId,

        /** Correlation ID of the request or task that caused the event. */
        String correlationId,

        /** Event ID of the intent this event completes, or "direct". */
        String causationId,

        /** The aggregate this event relates to. */
        EventEntity entity,

        /** Event-specific data. */
        T payload) {}
