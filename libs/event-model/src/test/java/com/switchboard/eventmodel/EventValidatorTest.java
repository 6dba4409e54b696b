package com.switchboard.eventmodel;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("EventValidator")
class EventValidatorTest {

    private static EventEnvelope<String> envelope(String tenantId, EventEntity entity, String producer) {
        return new EventEnvelope<>("evt-1", EventType.TENANT_ACTIVATED, 1, Instant.now(), producer,
                tenantId, "corr-1", EventFactory.DIRECT_CAUSATION, entity, "payload");
    }

    @Test
    @DisplayName("accepts a complete envelope")
    void acceptsCompleteEnvelope() {
        ValidationResult result = EventValidator.validate(envelope("t-1", EventEntity.tenant("t-1", 1), "lifecycle"));

        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
    }

    @Nested
    @DisplayName("rejections")
    class Rejections {

        @Test
        @DisplayName("reports every missing field at once")
        void reportsAllErrors() {
            var broken = new EventEnvelope<>(" ", null, 0, null, null, null, "corr", null, null, "x");

            ValidationResult result = EventValidator.validate(broken);

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).hasSize(8);
        }

        @Test
        @DisplayName("rejects tenant entity that points at another tenant")
        void rejectsForeignTenantEntity() {
            ValidationResult result = EventValidator.validate(envelope("t-1", EventEntity.tenant("t-2", 1), "lifecycle"));

            assertThat(result.errors()).containsExactly("entity.entityId must match tenantId for Tenant events");
        }

        @Test
        @DisplayName("allows store entities with their own identifiers")
        void allowsStoreEntity() {
            var storeEntity = new EventEntity(EntityType.TENANT_STORE.value(), "db_acme", 1);

            assertThat(EventValidator.validate(envelope("t-1", storeEntity, "lifecycle")).valid()).isTrue();
        }
    }
}
