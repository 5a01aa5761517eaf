package com.flagship.inventory_ledger.ledger;

import com.flagship.inventory_ledger.IntegrationTestSupport;
import com.flagship.inventory_ledger.catalog.Product;
import com.flagship.inventory_ledger.common.exception.InsufficientStockException;
import com.flagship.inventory_ledger.sale.PaymentMethod;
import com.flagship.inventory_ledger.sale.PaymentStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Many clerks selling the last units at once. The product row lock serializes
 * them, so exactly the available units are sold and the rest are refused.
 */
class ConcurrentSaleTest extends IntegrationTestSupport {

    @Autowired
    private TransactionRecorder transactionRecorder;

    @Autowired
    private StockJournal stockJournal;

    @Test
    @DisplayName("N concurrent single-unit sales against stock S sell min(N, S)")
    void concurrentSalesNeverOversell() throws InterruptedException {
        int initialStock = 5;
        int threadCount = 8;
        Product product = createProduct("RACE-1", initialStock, "10", "20");

        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger();
        AtomicInteger insufficientCount = new AtomicInteger();
        Queue<Throwable> unexpected = new ConcurrentLinkedQueue<>();

        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    transactionRecorder.createSale(product.getId(), 1, new BigDecimal("20"),
                            PaymentMethod.CASH, PaymentStatus.PAID, salesClerk);
                    successCount.incrementAndGet();
                } catch (InsufficientStockException e) {
                    insufficientCount.incrementAndGet();
                } catch (Throwable e) {
                    unexpected.add(e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS), "All sales should finish");
        executor.shutdown();

        assertTrue(unexpected.isEmpty(), () -> "Unexpected failures: " + unexpected);
        assertEquals(Math.min(threadCount, initialStock), successCount.get());
        assertEquals(Math.max(0, threadCount - initialStock), insufficientCount.get());
        assertEquals(initialStock - Math.min(threadCount, initialStock), stockOf(product.getId()));
        assertEquals(stockOf(product.getId()), stockJournal.replayMovements(product.getId()));
    }
}
