package com.switchboard.eventmodel;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EventFactory")
class EventFactoryTest {

    @Test
    @DisplayName("create fills identifiers, version and direct causation")
    void createFillsDefaults() {
        var event = EventFactory.create(EventType.TENANT_REGISTERED, "lifecycle", "t-1", "corr-1",
                EventEntity.tenant("t-1", 1), "acme");

        assertThat(event.eventId()).isNotBlank();
        assertThat(event.eventVersion()).isEqualTo(1);
        assertThat(event.occurredAt()).isNotNull();
        assertThat(event.correlationId()).isEqualTo("corr-1");
        assertThat(event.causationId()).isEqualTo(EventFactory.DIRECT_CAUSATION);
    }

    @Test
    @DisplayName("create generates a correlation ID when none is given")
    void createGeneratesCorrelation() {
        var event = EventFactory.create(EventType.TENANT_REGISTERED, "lifecycle", "t-1", null,
                EventEntity.tenant("t-1", 1), "acme");

        assertThat(event.correlationId()).isNotBlank();
    }

    @Test
    @DisplayName("createCausedBy links a completion to its intent")
    void createCausedByLinksIntent() {
        var intent = EventFactory.create(EventType.PROVISIONING_REQUESTED, "lifecycle", "t-1", "corr-1",
                EventEntity.tenant("t-1", 2), "attempt-1");

        var completion = EventFactory.createCausedBy(intent, EventType.TENANT_ACTIVATED, "lifecycle",
                EventEntity.tenant("t-1", 3), "active");

        assertThat(completion.tenantId()).isEqualTo("t-1");
        assertThat(completion.correlationId()).isEqualTo("corr-1");
        assertThat(completion.causationId()).isEqualTo(intent.eventId());
        assertThat(completion.eventId()).isNotEqualTo(intent.eventId());
    }
}
