package com.flagship.inventory_ledger.ledger;

import com.flagship.inventory_ledger.common.exception.ConflictException;
import com.flagship.inventory_ledger.common.exception.TransactionAbortedException;
import com.flagship.inventory_ledger.observability.InventoryMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs ledger work in one database transaction with a bounded lock wait and a
 * transaction timeout.
 *
 * Each scope starts with {@code SET LOCAL lock_timeout}, so waiting for a
 * product row held by another request gives up after
 * {@code inventory.ledger.lock-timeout-ms}. Lock timeouts, deadlocks,
 * serialization and version conflicts and the transaction timeout all roll
 * back and surface as {@link TransactionAbortedException}; duplicate unique
 * keys surface as {@link ConflictException}. Typed inventory errors raised by
 * the work itself roll back and propagate unchanged.
 */
@Component
@Slf4j
public class AtomicScope {

    private final TransactionTemplate transactionTemplate;
    private final JdbcTemplate jdbcTemplate;
    private final InventoryMetrics metrics;
    private final long lockTimeoutMs;

    public AtomicScope(PlatformTransactionManager transactionManager,
                       JdbcTemplate jdbcTemplate,
                       InventoryMetrics metrics,
                       @Value("${inventory.ledger.lock-timeout-ms:3000}") long lockTimeoutMs,
                       @Value("${inventory.ledger.transaction-timeout-seconds:10}") int transactionTimeoutSeconds) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        this.transactionTemplate.setTimeout(transactionTimeoutSeconds);
        this.jdbcTemplate = jdbcTemplate;
        this.metrics = metrics;
        this.lockTimeoutMs = lockTimeoutMs;
    }

    public <T> T execute(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> {
                jdbcTemplate.execute("SET LOCAL lock_timeout = '" + lockTimeoutMs + "ms'");
                return work.get();
            });
        } catch (TransientDataAccessException | TransactionTimedOutException e) {
            metrics.recordTransactionAborted(operation, e.getClass().getSimpleName());
            log.warn("Atomic scope aborted: operation={}, cause={}, error={}",
                    operation, e.getClass().getSimpleName(), e.getMessage());
            throw new TransactionAbortedException(operation, e);
        } catch (DataIntegrityViolationException e) {
            String detail = String.valueOf(NestedExceptionUtils.getMostSpecificCause(e).getMessage());
            if (detail.contains("idempotency_key")) {
                throw new ConflictException("Idempotency key already used by another request", e);
            }
            if (detail.contains("uq_products_sku")) {
                throw new ConflictException("A product with this SKU already exists", e);
            }
            throw e;
        }
    }

    public void run(String operation, Runnable work) {
        execute(operation, () -> {
            work.run();
            return null;
        });
    }
}
