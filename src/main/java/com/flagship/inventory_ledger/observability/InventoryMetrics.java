package com.flagship.inventory_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for ledger operations.
 *
 * <ul>
 *   <li>inventory.ledger.operations: mutations by operation and outcome</li>
 *   <li>inventory.ledger.latency: atomic scope duration by operation</li>
 *   <li>inventory.stock.insufficient: rejected stock decreases</li>
 *   <li>inventory.transactions.aborted: rolled back scopes (lock timeout, deadlock, timeout)</li>
 *   <li>idempotency.cache: hit/miss of the creation idempotency check</li>
 *   <li>notifications.fanned_out: persisted notifications by type</li>
 *   <li>audit.append.failures and post_commit.listener.failures: swallowed side-effect errors</li>
 * </ul>
 */
@Component
public class InventoryMetrics {

    private final MeterRegistry registry;

    public InventoryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordLedgerOperation(String operation, String outcome) {
        registry.counter("inventory.ledger.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLedgerLatency(String operation, long durationMs) {
        registry.timer("inventory.ledger.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordInsufficientStock(String operation) {
        registry.counter("inventory.stock.insufficient",
                "operation", sanitizeTag(operation)
        ).increment();
    }

    public void recordTransactionAborted(String operation, String cause) {
        registry.counter("inventory.transactions.aborted",
                "operation", sanitizeTag(operation),
                "cause", sanitizeTag(cause)
        ).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordNotificationsFannedOut(String type, int count) {
        registry.counter("notifications.fanned_out",
                "type", sanitizeTag(type)
        ).increment(count);
    }

    public void recordAuditAppendFailure() {
        registry.counter("audit.append.failures").increment();
    }

    public void recordListenerFailure(String listener) {
        registry.counter("post_commit.listener.failures",
                "listener", sanitizeTag(listener)
        ).increment();
    }

    /**
     * Keeps tag values short and free of special characters.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
