package com.flagship.inventory_ledger.idempotency;

import com.flagship.inventory_ledger.common.exception.ValidationException;
import com.flagship.inventory_ledger.purchase.PurchaseEntity;
import com.flagship.inventory_ledger.purchase.PurchaseRepository;
import com.flagship.inventory_ledger.sale.SaleEntity;
import com.flagship.inventory_ledger.sale.SaleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency-key lookups for sale and purchase creation.
 *
 * Strategy:
 * 1. Try Redis first (fast, may be unavailable)
 * 2. Fall back to the unique idempotency_key column of sales/purchases
 * 3. Cache database hits back into Redis
 *
 * The database is the source of truth; Redis failures only cost latency.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final Duration REDIS_TTL = Duration.ofDays(7);
    private static final int MAX_KEY_LENGTH = 255;

    private final SaleRepository saleRepository;
    private final PurchaseRepository purchaseRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(SaleRepository saleRepository,
                              PurchaseRepository purchaseRepository,
                              Optional<StringRedisTemplate> redisTemplate) {
        this.saleRepository = saleRepository;
        this.purchaseRepository = purchaseRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return id of the row already recorded under this key, if any
     */
    public Optional<UUID> findRecorded(IdempotencyScope scope, String idempotencyKey) {
        validateKey(idempotencyKey);
        String redisKey = scope.redisKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String recordedId = redisTemplate.get().opsForValue().get(redisKey);
                if (recordedId != null) {
                    log.debug("Idempotency key found in Redis: scope={}, key={}", scope, idempotencyKey);
                    return Optional.of(UUID.fromString(recordedId));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}. Falling back to database. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> recorded = switch (scope) {
            case SALE -> saleRepository.findByIdempotencyKey(idempotencyKey).map(SaleEntity::getId);
            case PURCHASE -> purchaseRepository.findByIdempotencyKey(idempotencyKey).map(PurchaseEntity::getId);
        };

        recorded.ifPresent(id -> {
            log.debug("Idempotency key found in database: scope={}, key={}", scope, idempotencyKey);
            cache(redisKey, id);
        });
        return recorded;
    }

    /**
     * Caches a key after the row carrying it has committed. Best effort.
     */
    public void remember(IdempotencyScope scope, String idempotencyKey, UUID recordedId) {
        validateKey(idempotencyKey);
        if (recordedId == null) {
            throw new IllegalArgumentException("Recorded id cannot be null");
        }
        cache(scope.redisKey(idempotencyKey), recordedId);
    }

    /**
     * Drops a cached key, used when the row it points to is deleted.
     */
    public void forget(IdempotencyScope scope, String idempotencyKey) {
        if (idempotencyKey == null || redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().delete(scope.redisKey(idempotencyKey));
        } catch (Exception e) {
            log.debug("Failed to evict idempotency key from Redis: {}", e.getMessage());
        }
    }

    public static void validateKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new ValidationException("Idempotency key cannot be blank");
        }
        if (idempotencyKey.length() > MAX_KEY_LENGTH) {
            throw new ValidationException("Idempotency key cannot exceed " + MAX_KEY_LENGTH + " characters");
        }
    }

    private void cache(String redisKey, UUID recordedId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey, recordedId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key in Redis: {}", e.getMessage());
        }
    }
}
