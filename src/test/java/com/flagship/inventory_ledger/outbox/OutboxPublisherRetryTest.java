package com.flagship.inventory_ledger.outbox;

import com.flagship.inventory_ledger.event.SaleRecorded;
import com.flagship.inventory_ledger.observability.OutboxMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Failure handling of the publisher without a broker.
 */
@ExtendWith(MockitoExtension.class)
class OutboxPublisherRetryTest {

    @Mock
    private OutboxService outboxService;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private OutboxMetrics outboxMetrics;

    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "inventoryEventsTopic", "inventory-events");
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 3);
        ReflectionTestUtils.setField(publisher, "sendTimeoutMs", 1000L);
    }

    private static OutboxEvent pendingEvent(int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), "Sale", UUID.randomUUID(), SaleRecorded.EVENT_TYPE,
                "{}", Instant.now(), null, retryCount, null, 1L);
    }

    @Test
    @DisplayName("A failed send marks the event failed and is not marked published")
    void failedSendMarksFailed() {
        OutboxEvent event = pendingEvent(0);
        when(outboxService.findPublishableEvents(100, 3)).thenReturn(List.of(event));
        when(kafkaTemplate.send(eq("inventory-events"), eq(event.getAggregateId().toString()), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.triggerPublish();

        verify(outboxService).markFailed(eq(event.getId()), anyString());
        verify(outboxService, never()).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublishFailed(SaleRecorded.EVENT_TYPE);
        verify(outboxMetrics, never()).recordEventDeadLettered(anyString());
    }

    @Test
    @DisplayName("The last allowed failure dead-letters the event")
    void lastFailureDeadLetters() {
        OutboxEvent event = pendingEvent(2);
        when(outboxService.findPublishableEvents(100, 3)).thenReturn(List.of(event));
        when(kafkaTemplate.send(eq("inventory-events"), eq(event.getAggregateId().toString()), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.triggerPublish();

        verify(outboxService).markFailed(eq(event.getId()), anyString());
        verify(outboxMetrics).recordEventDeadLettered(SaleRecorded.EVENT_TYPE);
    }

    @Test
    @DisplayName("An empty outbox sends nothing")
    void emptyOutboxSendsNothing() {
        when(outboxService.findPublishableEvents(100, 3)).thenReturn(List.of());

        publisher.triggerPublish();

        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
    }
}
