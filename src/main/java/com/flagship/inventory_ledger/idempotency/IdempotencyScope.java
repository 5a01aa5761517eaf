package com.flagship.inventory_ledger.idempotency;

/**
 * Namespaces for idempotency keys; a key used for a sale does not collide
 * with the same key used for a purchase.
 */
public enum IdempotencyScope {
    SALE("sale"),
    PURCHASE("purchase");

    private final String prefix;

    IdempotencyScope(String prefix) {
        this.prefix = prefix;
    }

    String redisKey(String idempotencyKey) {
        return "idempotency:" + prefix + ":" + idempotencyKey;
    }
}
