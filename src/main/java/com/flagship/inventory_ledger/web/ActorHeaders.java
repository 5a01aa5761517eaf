package com.flagship.inventory_ledger.web;

/**
 * Headers set by the upstream gateway after authenticating the caller.
 */
public final class ActorHeaders {

    public static final String ACTOR_ID = "X-Actor-Id";
    public static final String ACTOR_ROLE = "X-Actor-Role";
    public static final String IDEMPOTENCY_KEY = "Idempotency-Key";

    private ActorHeaders() {
    }
}
