package com.switchboard.gateway.infrastructure.events;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.switchboard.eventmodel.EventEntity;
import com.switchboard.eventmodel.EventEnvelope;
import com.switchboard.eventmodel.EventType;
import com.switchboard.tenancy.lifecycle.TenantLifecyclePayload;
import com.switchboard.tenancy.testing.InMemoryTenancy;
import com.switchboard.tenancy.testing.InMemoryTenantEventPublisher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

@DisplayName("LoggingTenantEventPublisher")
class LoggingTenantEventPublisherTest {

    private final Logger eventLogger = (Logger) LoggerFactory.getLogger(LoggingTenantEventPublisher.EVENT_LOGGER);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attach() {
        appender.start();
        eventLogger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        eventLogger.detachAppender(appender);
    }

    @Test
    @DisplayName("writes each lifecycle event as one JSON line")
    void logsEventAsJson() {
        try (var tenancy = InMemoryTenancy.create()) {
            tenancy.addActive("t-acme", "acme");
            tenancy.lifecycle().suspend("t-acme", "audit");
            InMemoryTenantEventPublisher recorded = tenancy.publisher();

            new LoggingTenantEventPublisher().publish(recorded.eventsFor("t-acme").get(0));
        }

        assertThat(appender.list).hasSize(1);
        String line = appender.list.get(0).getFormattedMessage();
        assertThat(line).startsWith("{").contains(EventType.TENANT_SUSPENDED.value()).contains("t-acme");
    }

    @Test
    @DisplayName("rejects an envelope whose entity belongs to another tenant")
    void rejectsInvalidEnvelope() {
        EventEnvelope<TenantLifecyclePayload> valid;
        try (var tenancy = InMemoryTenancy.create()) {
            tenancy.addActive("t-acme", "acme");
            tenancy.lifecycle().suspend("t-acme", "audit");
            valid = tenancy.publisher().eventsFor("t-acme").get(0);
        }
        var crossTenant = new EventEnvelope<>(valid.eventId(), valid.eventType(), valid.eventVersion(),
                valid.occurredAt(), valid.producer(), valid.tenantId(), valid.correlationId(),
                valid.causationId(), EventEntity.tenant("t-globex", 1), valid.payload());

        assertThatThrownBy(() -> new LoggingTenantEventPublisher().publish(crossTenant))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("entity.entityId must match tenantId");
        assertThat(appender.list).isEmpty();
    }
}
