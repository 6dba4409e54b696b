package com.switchboard.tenancy.lifecycle;

import com.switchboard.eventmodel.EventEnvelope;

/**
 * Sink for tenant lifecycle events.
 */
@FunctionalInterface
public interface TenantEventPublisher {

    void publish(EventEnvelope<TenantLifecyclePayload> event);
}
