package com.flagship.inventory_ledger.notification;

import com.flagship.inventory_ledger.event.ExpenseRecorded;
import com.flagship.inventory_ledger.event.PurchaseRecorded;
import com.flagship.inventory_ledger.event.SaleRecorded;
import com.flagship.inventory_ledger.event.StockChangingEvent;
import com.flagship.inventory_ledger.observability.InventoryMetrics;
import com.flagship.inventory_ledger.user.AppUserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns committed ledger events into admin notifications.
 *
 * Runs only after commit. Every failure is logged and counted, never rethrown:
 * the ledger change has already happened.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationListener {

    private static final String CURRENCY = "TZS";

    private final NotificationFanout fanout;
    private final AppUserRepository userRepository;
    private final InventoryMetrics metrics;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onStockChanged(StockChangingEvent event) {
        if (!event.fellIntoLowStock()) {
            return;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("productId", event.getProductId().toString());
        metadata.put("productName", event.getProductName());
        metadata.put("stockQuantity", event.getStockAfter());

        deliver("low_stock", () -> fanout.fanOutToAdmins(
            NotificationType.LOW_STOCK,
            "Low Stock Alert",
            event.getProductName() + " is running low (" + event.getStockAfter() + " remaining)",
            "/products",
            metadata));
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onSaleRecorded(SaleRecorded event) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("saleId", event.getSaleId().toString());
        metadata.put("productName", event.getProductName());
        metadata.put("quantity", event.getQuantity());
        metadata.put("totalPrice", event.getTotalPrice());

        deliver("sale", () -> fanout.fanOutToAdmins(
            NotificationType.SALE,
            "New Sale Recorded",
            "Sale of " + event.getQuantity() + " " + event.getProductName()
                + " for " + formatAmount(event.getTotalPrice()),
            "/sales",
            metadata));
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onPurchaseRecorded(PurchaseRecorded event) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("purchaseId", event.getPurchaseId().toString());
        metadata.put("productName", event.getProductName());
        metadata.put("quantity", event.getQuantity());
        metadata.put("totalCost", event.getTotalCost());

        deliver("purchase", () -> fanout.fanOutToAdmins(
            NotificationType.PURCHASE,
            "New Purchase Recorded",
            "Purchased " + event.getQuantity() + " " + event.getProductName()
                + " for " + formatAmount(event.getTotalCost()),
            "/purchases",
            metadata));
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onExpenseRecorded(ExpenseRecorded event) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("expenseId", event.getExpenseId().toString());
        metadata.put("category", event.getCategory().name());
        metadata.put("amount", event.getAmount());
        metadata.put("description", event.getDescription());

        deliver("expense", () -> {
            String recordedBy = userRepository.findFullNameById(event.getActorId()).orElse("A user");
            return fanout.fanOutToAdmins(
                NotificationType.EXPENSE,
                "New Expense Recorded",
                recordedBy + " added a " + event.getCategory().name().toLowerCase(Locale.ROOT)
                    + " expense of " + formatAmount(event.getAmount()),
                "/expenses",
                metadata);
        });
    }

    static String formatAmount(BigDecimal amount) {
        DecimalFormat format = new DecimalFormat("#,##0.##", DecimalFormatSymbols.getInstance(Locale.US));
        return CURRENCY + " " + format.format(amount);
    }

    private void deliver(String kind, FanoutCall call) {
        try {
            int sent = call.send();
            log.debug("Fanned out {} notification to {} recipients", kind, sent);
        } catch (Exception e) {
            metrics.recordListenerFailure("notification_" + kind);
            log.error("Failed to fan out {} notification: {}", kind, e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface FanoutCall {
        int send();
    }
}
