package com.switchboard.eventmodel;

import java.time.Instant;
import java.util.UUID;

/**
 * Factory methods for {@link EventEnvelope} instances.
 */
public final class EventFactory {

    /** Causation ID used for events that are not caused by another event. */
    public static final String DIRECT_CAUSATION = "direct";

    private EventFactory() {
        // utility class: no instantiation
    }

    /**
     * Creates an envelope with a generated event ID and the current time. A null or blank
     * correlation ID is replaced by a fresh UUID.
     */
    public static <T> EventEnvelope<T> create(
            EventType eventType,
            String producer,
            String tenantId,
            String correlationId,
            EventEntity entity,
            T payload
    ) {
        return new EventEnvelope<>(
                UUID.randomUUID().toString(),
                eventType,
                1,
                Instant.now(),
                producer,
                tenantId,
                correlationId == null || correlationId.isBlank() ? UUID.randomUUID().toString() : correlationId,
                DIRECT_CAUSATION,
                entity,
                payload
        );
    }

    /**
     * Creates an event caused by {@code cause}: same tenant and correlation, causation set to the
     * cause's event ID. Used for completion and failure events that answer an intent.
     */
    public static <T> EventEnvelope<T> createCausedBy(
            EventEnvelope<?> cause,
            EventType eventType,
            String producer,
            EventEntity entity,
            T payload
    ) {
        return new EventEnvelope<>(
                UUID.randomUUID().toString(),
                eventType,
                1,
                Instant.now(),
                producer,
                cause.tenantId(),
                cause.correlationId(),
                cause.eventId(),
                entity,
                payload
        );
    }
}
