package com.switchboard.eventmodel;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks an {@link EventEnvelope} for required fields before it is published. Returns every
 * error at once.
 */
public final class EventValidator {

    private EventValidator() {
        // utility class
    }

    /**
     * Validates that all required fields of the envelope are present and well-formed.
     *
     * @param event the event envelope to validate
     * @return a {@link ValidationResult} with any errors found
     */
    public static ValidationResult validate(EventEnvelope<?> event) {
        List<String> errors = new ArrayList<>();

        if (isBlank(event.eventId())) {
            errors.add("eventId must not be null or blank");
        }
        if (event.eventType() == null) {
            errors.add("eventType must not be null");
        }
        if (event.eventVersion() < 1) {
            errors.add("eventVersion must be >= 1");
        }
        if (event.occurredAt() == null) {
            errors.add("occurredAt must not be null");
        }
        if (isBlank(event.producer())) {
            errors.add("producer must not be null or blank");
        }
        if (isBlank(event.tenantId())) {
            errors.add("tenantId must not be null or blank");
        }
        if (isBlank(event.causationId())) {
            errors.add("causationId must not be null or blank");
        }
        if (event.entity() == null) {
            errors.add("entity must not be null");
        } else {
            if (isBlank(event.entity().entityId())) {
                errors.add("entity.entityId must not be null or blank");
            } else if (event.tenantId() != null
                    && EntityType.TENANT.value().equals(event.entity().entityType())
                    && !event.entity().entityId().equals(event.tenantId())) {
                errors.add("entity.entityId must match tenantId for Tenant events");
            }
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
