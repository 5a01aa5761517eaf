package com.flagship.inventory_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.inventory_ledger.IntegrationTestSupport;
import com.flagship.inventory_ledger.catalog.Product;
import com.flagship.inventory_ledger.common.exception.InsufficientStockException;
import com.flagship.inventory_ledger.event.ProductCreated;
import com.flagship.inventory_ledger.event.SaleDeleted;
import com.flagship.inventory_ledger.event.SalePaymentStatusChanged;
import com.flagship.inventory_ledger.event.SaleRecorded;
import com.flagship.inventory_ledger.ledger.TransactionRecorder;
import com.flagship.inventory_ledger.sale.PaymentMethod;
import com.flagship.inventory_ledger.sale.PaymentStatus;
import com.flagship.inventory_ledger.sale.Sale;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox rows are written in the same transaction as the ledger change that
 * produced them.
 */
class OutboxServiceTest extends IntegrationTestSupport {

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private TransactionRecorder transactionRecorder;

    @Autowired
    private ObjectMapper objectMapper;

    private Sale sellTwo(Product product) {
        return transactionRecorder.createSale(product.getId(), 2, new BigDecimal("150"),
                PaymentMethod.CASH, PaymentStatus.PAID, salesClerk);
    }

    @Test
    @DisplayName("Recording a sale writes one SaleRecorded event keyed by the sale id")
    void saleWritesOutboxEvent() throws Exception {
        Product product = createProduct("OBX-1", 10, "100", "150");

        Sale sale = sellTwo(product);

        List<OutboxEvent> events = outboxService.getEventsForAggregate("Sale", sale.getId());
        assertEquals(1, events.size());

        OutboxEvent event = events.get(0);
        assertEquals(SaleRecorded.EVENT_TYPE, event.getEventType());
        assertEquals(sale.getId(), event.getAggregateId());
        assertNull(event.getPublishedAt());
        assertEquals(0, event.getRetryCount());

        JsonNode payload = objectMapper.readTree(event.getPayload());
        assertEquals(sale.getId().toString(), payload.get("saleId").asText());
        assertEquals(product.getId().toString(), payload.get("productId").asText());
        assertEquals(10, payload.get("stockBefore").asInt());
        assertEquals(8, payload.get("stockAfter").asInt());
    }

    @Test
    @DisplayName("Creating a product writes a ProductCreated event")
    void productCreationWritesOutboxEvent() {
        Product product = createProduct("OBX-2", 4, "10", "15");

        List<OutboxEvent> events = outboxService.getEventsForAggregate("Product", product.getId());

        assertTrue(events.stream().anyMatch(e -> e.getEventType().equals(ProductCreated.EVENT_TYPE)));
    }

    @Test
    @DisplayName("Events of one sale keep their order through the sequence number")
    void eventsForAggregateAreOrdered() {
        Product product = createProduct("OBX-3", 10, "100", "150");
        Sale sale = sellTwo(product);

        transactionRecorder.updatePaymentStatus(sale.getId(), PaymentStatus.PENDING, salesClerk);
        transactionRecorder.deleteSale(sale.getId(), salesClerk);

        List<String> types = outboxService.getEventsForAggregate("Sale", sale.getId())
                .stream()
                .map(OutboxEvent::getEventType)
                .toList();

        assertEquals(List.of(SaleRecorded.EVENT_TYPE, SalePaymentStatusChanged.EVENT_TYPE,
                SaleDeleted.EVENT_TYPE), types);
    }

    @Test
    @DisplayName("A rejected sale leaves no outbox event behind")
    void rejectedSaleWritesNothing() {
        Product product = createProduct("OBX-4", 1, "100", "150");
        long before = outboxService.countUnpublished();

        assertThrows(InsufficientStockException.class, () -> sellTwo(product));

        assertEquals(before, outboxService.countUnpublished());
    }

    @Test
    @DisplayName("Saving an event outside a transaction fails")
    void saveEventRequiresTransaction() {
        assertThrows(IllegalTransactionStateException.class, () ->
                outboxService.saveEvent("Sale", UUID.randomUUID(), SaleRecorded.EVENT_TYPE, Map.of("k", "v")));
    }

    @Test
    @DisplayName("Published events leave the unpublished count and the publishable batch")
    void markPublishedRemovesFromBatch() {
        Product product = createProduct("OBX-5", 10, "100", "150");
        Sale sale = sellTwo(product);
        OutboxEvent event = outboxService.getEventsForAggregate("Sale", sale.getId()).get(0);
        long before = outboxService.countUnpublished();

        outboxService.markPublished(event.getId());

        assertEquals(before - 1, outboxService.countUnpublished());
        assertNotNull(outboxEventRepository.findById(event.getId()).orElseThrow().getPublishedAt());
        assertTrue(outboxService.findPublishableEvents(100, 5).stream()
                .noneMatch(e -> e.getId().equals(event.getId())));
    }

    @Test
    @DisplayName("Failures bump the retry count until the event stops being polled")
    void markFailedIncrementsRetryCount() {
        Product product = createProduct("OBX-6", 10, "100", "150");
        Sale sale = sellTwo(product);
        OutboxEvent event = outboxService.getEventsForAggregate("Sale", sale.getId()).get(0);

        outboxService.markFailed(event.getId(), "broker unavailable");
        outboxService.markFailed(event.getId(), "broker unavailable");

        OutboxEventEntity stored = outboxEventRepository.findById(event.getId()).orElseThrow();
        assertEquals(2, stored.getRetryCount());
        assertEquals("broker unavailable", stored.getLastError());
        assertNull(stored.getPublishedAt());

        assertTrue(outboxService.findPublishableEvents(100, 3).stream()
                .anyMatch(e -> e.getId().equals(event.getId())));
        assertTrue(outboxService.findPublishableEvents(100, 2).stream()
                .noneMatch(e -> e.getId().equals(event.getId())));
    }
}
