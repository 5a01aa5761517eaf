package com.flagship.inventory_ledger.ledger;

import com.flagship.inventory_ledger.IntegrationTestSupport;
import com.flagship.inventory_ledger.audit.AuditEntryRepository;
import com.flagship.inventory_ledger.catalog.Product;
import com.flagship.inventory_ledger.notification.RecipientResolver;
import com.flagship.inventory_ledger.purchase.Purchase;
import com.flagship.inventory_ledger.sale.PaymentMethod;
import com.flagship.inventory_ledger.sale.PaymentStatus;
import com.flagship.inventory_ledger.sale.Sale;
import com.flagship.inventory_ledger.sale.SaleQueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Audit and notification writes run after commit. When both stores fail, the
 * sale or purchase that triggered them still stands.
 */
class AfterCommitFailureTest extends IntegrationTestSupport {

    @MockBean
    private RecipientResolver recipientResolver;

    @MockBean
    private AuditEntryRepository auditEntryRepository;

    @Autowired
    private TransactionRecorder transactionRecorder;

    @Autowired
    private SaleQueryService saleQueryService;

    @Autowired
    private StockJournal stockJournal;

    @BeforeEach
    void breakSideEffects() {
        when(recipientResolver.admins()).thenThrow(new DataAccessResourceFailureException("user directory down"));
        when(auditEntryRepository.saveAndFlush(any())).thenThrow(new DataAccessResourceFailureException("audit store down"));
    }

    private int notificationCount() {
        return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM notifications", Integer.class);
    }

    @Test
    @DisplayName("A sale into low stock commits although notifications and audit both fail")
    void saleSurvivesFailingListeners() {
        Product product = createProduct("ACF-1", 10, "100", "150");

        Sale sale = transactionRecorder.createSale(product.getId(), 6, new BigDecimal("150"),
                PaymentMethod.CASH, PaymentStatus.PAID, salesClerk);

        assertNotNull(sale.getId());
        assertEquals(4, stockOf(product.getId()));
        assertEquals(sale.getId(), saleQueryService.get(sale.getId()).getId());
        assertTrue(stockJournal.findProductsOutOfBalance().isEmpty());

        verify(recipientResolver, atLeastOnce()).admins();
        verify(auditEntryRepository, atLeastOnce()).saveAndFlush(any());
        assertEquals(0, notificationCount());
    }

    @Test
    @DisplayName("A purchase commits although its notification fails")
    void purchaseSurvivesFailingListeners() {
        Product product = createProduct("ACF-2", 2, "100", "150");

        Purchase purchase = transactionRecorder.createPurchase(product.getId(), 5, new BigDecimal("90"),
                "Acme", stockKeeper);

        assertNotNull(purchase.getId());
        assertEquals(7, stockOf(product.getId()));
        assertEquals(1, jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM purchases WHERE id = ?", Integer.class, purchase.getId()));
        assertEquals(0, notificationCount());
    }
}
