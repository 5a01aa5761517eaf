package com.flagship.inventory_ledger.ledger;

import com.flagship.inventory_ledger.IntegrationTestSupport;
import com.flagship.inventory_ledger.catalog.Product;
import com.flagship.inventory_ledger.common.exception.TransactionAbortedException;
import com.flagship.inventory_ledger.sale.PaymentMethod;
import com.flagship.inventory_ledger.sale.PaymentStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * A product row held by another transaction makes the ledger give up after the
 * configured lock wait instead of blocking, and nothing of the attempt remains.
 */
@TestPropertySource(properties = "inventory.ledger.lock-timeout-ms=300")
class LockTimeoutTest extends IntegrationTestSupport {

    @Autowired
    private TransactionRecorder transactionRecorder;

    @Autowired
    private StockJournal stockJournal;

    @Autowired
    private DataSource dataSource;

    @Test
    @DisplayName("A sale waiting on a locked product aborts and leaves stock, sales and movements untouched")
    void saleAbortsWhenProductIsLocked() throws Exception {
        Product product = createProduct("LCK-1", 10, "100", "150");
        int movementsBefore = stockJournal.getMovements(product.getId()).size();

        try (Connection holder = dataSource.getConnection()) {
            holder.setAutoCommit(false);
            try (PreparedStatement lock = holder.prepareStatement("SELECT id FROM products WHERE id = ? FOR UPDATE")) {
                lock.setObject(1, product.getId());
                try (ResultSet rs = lock.executeQuery()) {
                    assertTrue(rs.next());
                }
            }

            long start = System.currentTimeMillis();
            assertThrows(TransactionAbortedException.class, () ->
                    transactionRecorder.createSale(product.getId(), 3, new BigDecimal("150"),
                            PaymentMethod.CASH, PaymentStatus.PAID, salesClerk));
            assertTrue(System.currentTimeMillis() - start < 5000, "lock wait should be bounded");

            holder.rollback();
        }

        assertEquals(10, stockOf(product.getId()));
        assertEquals(0, jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM sales WHERE product_id = ?", Integer.class, product.getId()));
        assertEquals(movementsBefore, stockJournal.getMovements(product.getId()).size());
    }

    @Test
    @DisplayName("Once the holder releases the row the same sale goes through")
    void saleSucceedsAfterRelease() throws Exception {
        Product product = createProduct("LCK-2", 10, "100", "150");

        try (Connection holder = dataSource.getConnection()) {
            holder.setAutoCommit(false);
            try (PreparedStatement lock = holder.prepareStatement("SELECT id FROM products WHERE id = ? FOR UPDATE")) {
                lock.setObject(1, product.getId());
                lock.executeQuery().close();
            }
            assertThrows(TransactionAbortedException.class, () ->
                    transactionRecorder.createSale(product.getId(), 3, new BigDecimal("150"),
                            PaymentMethod.CASH, PaymentStatus.PAID, salesClerk));
            holder.rollback();
        }

        transactionRecorder.createSale(product.getId(), 3, new BigDecimal("150"),
                PaymentMethod.CASH, PaymentStatus.PAID, salesClerk);

        assertEquals(7, stockOf(product.getId()));
    }
}
