package com.flagship.inventory_ledger.audit;

import com.flagship.inventory_ledger.IntegrationTestSupport;
import com.flagship.inventory_ledger.catalog.Product;
import com.flagship.inventory_ledger.common.PageResponse;
import com.flagship.inventory_ledger.common.Role;
import com.flagship.inventory_ledger.common.exception.ForbiddenOperationException;
import com.flagship.inventory_ledger.ledger.TransactionRecorder;
import com.flagship.inventory_ledger.sale.PaymentMethod;
import com.flagship.inventory_ledger.sale.PaymentStatus;
import com.flagship.inventory_ledger.sale.Sale;
import com.flagship.inventory_ledger.sale.SaleChanges;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AuditTrailTest extends IntegrationTestSupport {

    @Autowired
    private AuditTrail auditTrail;

    @Autowired
    private TransactionRecorder transactionRecorder;

    @Test
    @DisplayName("Each committed sale change leaves an entry in order")
    void saleHistory() {
        Product product = createProduct("AUD-1", 10, "10", "20");
        Sale sale = transactionRecorder.createSale(product.getId(), 2, new BigDecimal("20"),
                PaymentMethod.CASH, PaymentStatus.PENDING, salesClerk);
        transactionRecorder.updateSale(sale.getId(), SaleChanges.builder().quantity(3).build(), salesClerk);
        transactionRecorder.updatePaymentStatus(sale.getId(), PaymentStatus.PAID, admin);
        transactionRecorder.deleteSale(sale.getId(), admin);

        List<AuditEntry> history = auditTrail.historyOf(AuditEntityType.SALE, sale.getId(), admin);

        assertEquals(List.of(AuditAction.CREATE_SALE, AuditAction.UPDATE_SALE,
                        AuditAction.UPDATE_SALE_PAYMENT, AuditAction.DELETE_SALE),
                history.stream().map(AuditEntry::getAction).toList());

        AuditEntry created = history.get(0);
        assertEquals(salesClerk.getId(), created.getActorId());
        assertEquals(Role.SALES, created.getActorRole());
        assertEquals(product.getId().toString(), created.getMetadata().get("productId"));
        assertEquals("PENDING", created.getMetadata().get("paymentStatus"));
        assertEquals(admin.getId(), history.get(3).getActorId());
    }

    @Test
    @DisplayName("Rejected operations leave no entry")
    void noEntryOnRollback() {
        Product product = createProduct("AUD-2", 1, "10", "20");

        assertThrows(RuntimeException.class, () ->
                transactionRecorder.createSale(product.getId(), 2, new BigDecimal("20"),
                        PaymentMethod.CASH, PaymentStatus.PAID, salesClerk));

        PageResponse<AuditEntry> sales = auditTrail.query(
                AuditQuery.builder().entityType(AuditEntityType.SALE).build(), 1, 20, admin);
        assertEquals(0, sales.getTotalItems());
    }

    @Test
    @DisplayName("Query filters by actor and action, newest first")
    void queryFilters() {
        Product product = createProduct("AUD-3", 10, "10", "20");
        transactionRecorder.createSale(product.getId(), 1, new BigDecimal("20"),
                PaymentMethod.CASH, PaymentStatus.PAID, salesClerk);
        transactionRecorder.createPurchase(product.getId(), 4, new BigDecimal("9"), "Acme", stockKeeper);

        PageResponse<AuditEntry> byStockKeeper = auditTrail.query(
                AuditQuery.builder().actorId(stockKeeper.getId()).build(), 1, 20, admin);
        assertEquals(1, byStockKeeper.getTotalItems());
        assertEquals(AuditAction.CREATE_PURCHASE, byStockKeeper.getItems().get(0).getAction());

        PageResponse<AuditEntry> productCreations = auditTrail.query(
                AuditQuery.builder().action(AuditAction.CREATE_PRODUCT).build(), 1, 20, admin);
        assertEquals(1, productCreations.getTotalItems());

        PageResponse<AuditEntry> all = auditTrail.query(null, 1, 20, admin);
        assertEquals(AuditAction.CREATE_PURCHASE, all.getItems().get(0).getAction());
    }

    @Test
    @DisplayName("Only admins read the audit log")
    void adminOnly() {
        assertThrows(ForbiddenOperationException.class, () ->
                auditTrail.query(AuditQuery.builder().build(), 1, 20, salesClerk));
        assertThrows(ForbiddenOperationException.class, () ->
                auditTrail.historyOf(AuditEntityType.PRODUCT, UUID.randomUUID(), stockKeeper));
    }

    @Test
    @DisplayName("A failed append is swallowed and reported as empty")
    void failedAppendIsSwallowed() {
        Optional<AuditEntry> result = auditTrail.append(null, Role.ADMIN, AuditAction.CREATE_EXPENSE,
                AuditEntityType.EXPENSE, UUID.randomUUID(), Map.of());

        assertTrue(result.isEmpty());
    }

    @Test
    @DisplayName("Entries cannot be changed once written")
    void entriesAreAppendOnly() {
        AuditEntry entry = auditTrail.append(admin.getId(), Role.ADMIN, AuditAction.CREATE_EXPENSE,
                AuditEntityType.EXPENSE, UUID.randomUUID(), Map.of("amount", "10.00")).orElseThrow();

        assertThrows(DataAccessException.class, () ->
                jdbcTemplate.update("UPDATE audit_entries SET action = 'DELETE_EXPENSE' WHERE id = ?", entry.getId()));
        assertThrows(DataAccessException.class, () ->
                jdbcTemplate.update("DELETE FROM audit_entries WHERE id = ?", entry.getId()));
    }
}
