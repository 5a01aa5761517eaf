package com.flagship.inventory_ledger.audit;

import com.flagship.inventory_ledger.event.ExpenseDeleted;
import com.flagship.inventory_ledger.event.ExpenseRecorded;
import com.flagship.inventory_ledger.event.ExpenseUpdated;
import com.flagship.inventory_ledger.event.InventoryEvent;
import com.flagship.inventory_ledger.event.ProductCreated;
import com.flagship.inventory_ledger.event.ProductDeleted;
import com.flagship.inventory_ledger.event.ProductUpdated;
import com.flagship.inventory_ledger.event.PurchaseDeleted;
import com.flagship.inventory_ledger.event.PurchaseRecorded;
import com.flagship.inventory_ledger.event.PurchaseUpdated;
import com.flagship.inventory_ledger.event.SaleDeleted;
import com.flagship.inventory_ledger.event.SalePaymentStatusChanged;
import com.flagship.inventory_ledger.event.SaleRecorded;
import com.flagship.inventory_ledger.event.SaleUpdated;
import com.flagship.inventory_ledger.event.StockAdjusted;
import com.flagship.inventory_ledger.observability.InventoryMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appends an audit entry for every committed catalog, ledger and expense change.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditTrailListener {

    private final AuditTrail auditTrail;
    private final InventoryMetrics metrics;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onProductCreated(ProductCreated event) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("name", event.getName());
        meta.put("sku", event.getSku());
        meta.put("category", event.getCategory());
        meta.put("openingStock", event.getOpeningStock());
        record(event, AuditAction.CREATE_PRODUCT, AuditEntityType.PRODUCT, meta);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onProductUpdated(ProductUpdated event) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("name", event.getName());
        meta.put("sku", event.getSku());
        meta.put("changedFields", event.getChangedFields());
        record(event, AuditAction.UPDATE_PRODUCT, AuditEntityType.PRODUCT, meta);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onProductDeleted(ProductDeleted event) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("name", event.getName());
        meta.put("sku", event.getSku());
        meta.put("stockAtDeletion", event.getStockAtDeletion());
        record(event, AuditAction.DELETE_PRODUCT, AuditEntityType.PRODUCT, meta);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onStockAdjusted(StockAdjusted event) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("productName", event.getProductName());
        meta.put("stockBefore", event.getStockBefore());
        meta.put("stockAfter", event.getStockAfter());
        meta.put("reason", event.getReason());
        record(event, AuditAction.ADJUST_STOCK, AuditEntityType.PRODUCT, meta);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onSaleRecorded(SaleRecorded event) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("productId", event.getProductId().toString());
        meta.put("productName", event.getProductName());
        meta.put("quantity", event.getQuantity());
        meta.put("totalPrice", event.getTotalPrice());
        meta.put("paymentStatus", event.getPaymentStatus().name());
        record(event, AuditAction.CREATE_SALE, AuditEntityType.SALE, meta);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onSaleUpdated(SaleUpdated event) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("productName", event.getProductName());
        meta.put("previousQuantity", event.getPreviousQuantity());
        meta.put("quantity", event.getQuantity());
        meta.put("previousTotalPrice", event.getPreviousTotalPrice());
        meta.put("totalPrice", event.getTotalPrice());
        meta.put("changedFields", event.getChangedFields());
        record(event, AuditAction.UPDATE_SALE, AuditEntityType.SALE, meta);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onSalePaymentStatusChanged(SalePaymentStatusChanged event) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("productName", event.getProductName());
        meta.put("previousStatus", event.getPreviousStatus().name());
        meta.put("paymentStatus", event.getPaymentStatus().name());
        meta.put("totalPrice", event.getTotalPrice());
        record(event, AuditAction.UPDATE_SALE_PAYMENT, AuditEntityType.SALE, meta);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onSaleDeleted(SaleDeleted event) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("productId", event.getProductId().toString());
        meta.put("productName", event.getProductName());
        meta.put("quantity", event.getQuantity());
        meta.put("totalPrice", event.getTotalPrice());
        record(event, AuditAction.DELETE_SALE, AuditEntityType.SALE, meta);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onPurchaseRecorded(PurchaseRecorded event) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("productId", event.getProductId().toString());
        meta.put("productName", event.getProductName());
        meta.put("quantity", event.getQuantity());
        meta.put("totalCost", event.getTotalCost());
        meta.put("supplier", event.getSupplier());
        record(event, AuditAction.CREATE_PURCHASE, AuditEntityType.PURCHASE, meta);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onPurchaseUpdated(PurchaseUpdated event) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("productName", event.getProductName());
        meta.put("previousQuantity", event.getPreviousQuantity());
        meta.put("quantity", event.getQuantity());
        meta.put("totalCost", event.getTotalCost());
        meta.put("changedFields", event.getChangedFields());
        record(event, AuditAction.UPDATE_PURCHASE, AuditEntityType.PURCHASE, meta);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onPurchaseDeleted(PurchaseDeleted event) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("productId", event.getProductId().toString());
        meta.put("productName", event.getProductName());
        meta.put("quantity", event.getQuantity());
        meta.put("totalCost", event.getTotalCost());
        meta.put("supplier", event.getSupplier());
        record(event, AuditAction.DELETE_PURCHASE, AuditEntityType.PURCHASE, meta);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onExpenseRecorded(ExpenseRecorded event) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("category", event.getCategory().name());
        meta.put("amount", event.getAmount());
        meta.put("description", event.getDescription());
        record(event, AuditAction.CREATE_EXPENSE, AuditEntityType.EXPENSE, meta);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onExpenseUpdated(ExpenseUpdated event) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("category", event.getCategory().name());
        meta.put("amount", event.getAmount());
        meta.put("changedFields", event.getChangedFields());
        record(event, AuditAction.UPDATE_EXPENSE, AuditEntityType.EXPENSE, meta);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onExpenseDeleted(ExpenseDeleted event) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("category", event.getCategory().name());
        meta.put("amount", event.getAmount());
        meta.put("description", event.getDescription());
        record(event, AuditAction.DELETE_EXPENSE, AuditEntityType.EXPENSE, meta);
    }

    private void record(InventoryEvent event, AuditAction action, AuditEntityType entityType,
                        Map<String, Object> meta) {
        try {
            meta.put("eventId", event.getEventId().toString());
            auditTrail.append(event.getActorId(), event.getActorRole(), action, entityType,
                    event.getAggregateId(), meta);
        } catch (Exception e) {
            metrics.recordListenerFailure("audit");
            log.error("Audit listener failed for {}: {}", event.getEventType(), e.getMessage(), e);
        }
    }
}
