package com.switchboard.gateway.infrastructure.events;

import com.switchboard.eventmodel.EventEnvelope;
import com.switchboard.eventmodel.EventSerializer;
import com.switchboard.eventmodel.EventValidator;
import com.switchboard.eventmodel.ValidationResult;
import com.switchboard.tenancy.lifecycle.TenantEventPublisher;
import com.switchboard.tenancy.lifecycle.TenantLifecyclePayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes tenant lifecycle events as JSON log lines on a dedicated logger, so a log shipper
 * can route them to whatever audit sink the deployment uses.
 *
 * <p>Envelopes are validated first; an invalid one is rejected with
 * {@link IllegalArgumentException} and never reaches the log.
 */
public class LoggingTenantEventPublisher implements TenantEventPublisher {

    /** Logger name the events are written to. */
    public static final String EVENT_LOGGER = "switchboard.events";

    private static final Logger events = LoggerFactory.getLogger(EVENT_LOGGER);

    @Override
    public void publish(EventEnvelope<TenantLifecyclePayload> event) {
        ValidationResult validation = EventValidator.validate(event);
        if (!validation.valid()) {
            throw new IllegalArgumentException(
                    "Invalid " + event.eventType() + " event for tenant '" + event.tenantId() + "': "
                            + validation.errors());
        }
        events.info(EventSerializer.serialize(event));
    }
}
