package com.switchboard.eventmodel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EventSerializer")
class EventSerializerTest {

    record StatusChange(String routingKey, String fromStatus, String toStatus) {}

    private final EventEnvelope<StatusChange> event = EventFactory.create(
            EventType.TENANT_SUSPENDED,
            "tenant-lifecycle",
            "t-1",
            "corr-1",
            EventEntity.tenant("t-1", 3),
            new StatusChange("acme", "ACTIVE", "SUSPENDED"));

    @Test
    @DisplayName("writes canonical event type names and ISO timestamps")
    void writesCanonicalNames() {
        String json = EventSerializer.serialize(event);

        assertThat(json).contains("\"eventType\":\"TenantSuspended\"");
        assertThat(json).contains("\"occurredAt\":\"");
        assertThat(json).doesNotContain("TENANT_SUSPENDED");
    }

    @Test
    @DisplayName("reads back the same envelope and payload")
    void readsBackEnvelope() {
        EventEnvelope<StatusChange> read =
                EventSerializer.deserialize(EventSerializer.serialize(event), StatusChange.class);

        assertThat(read).isEqualTo(event);
        assertThat(read.payload().toStatus()).isEqualTo("SUSPENDED");
    }

    @Test
    @DisplayName("rejects unknown event types")
    void rejectsUnknownEventType() {
        String json = EventSerializer.serialize(event).replace("TenantSuspended", "TenantExploded");

        assertThatThrownBy(() -> EventSerializer.deserialize(json, StatusChange.class))
                .isInstanceOf(EventSerializer.EventSerializationException.class);
        assertThat(EventSerializer.tryDeserialize(json, StatusChange.class)).isEmpty();
    }

    @Test
    @DisplayName("ignores unknown properties")
    void ignoresUnknownProperties() {
        String json = EventSerializer.serialize(event).replaceFirst("\\{", "{\"shard\":\"eu-1\",");

        assertThat(EventSerializer.tryDeserialize(json, StatusChange.class)).isPresent();
    }
}
