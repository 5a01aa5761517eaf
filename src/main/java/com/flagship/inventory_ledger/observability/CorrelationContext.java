package com.flagship.inventory_ledger.observability;

import java.util.UUID;

/**
 * Thread-local correlation id for the request being served.
 *
 * The id flows from the HTTP header into MDC, so every log line of one
 * request (including post-commit audit and notification work, which runs on
 * the same thread) carries it.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String SALE_ID_MDC_KEY = "saleId";
    public static final String PURCHASE_ID_MDC_KEY = "purchaseId";
    public static final String PRODUCT_ID_MDC_KEY = "productId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Gets the current correlation id, generating one if none is set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }
}
