package com.flagship.inventory_ledger.ledger;

import com.flagship.inventory_ledger.catalog.ProductEntity;
import com.flagship.inventory_ledger.catalog.ProductRepository;
import com.flagship.inventory_ledger.common.AccessPolicy;
import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.Money;
import com.flagship.inventory_ledger.common.Permission;
import com.flagship.inventory_ledger.common.exception.InsufficientStockException;
import com.flagship.inventory_ledger.common.exception.InventoryException;
import com.flagship.inventory_ledger.common.exception.NotFoundException;
import com.flagship.inventory_ledger.common.exception.ValidationException;
import com.flagship.inventory_ledger.event.LedgerEventPublisher;
import com.flagship.inventory_ledger.event.PurchaseDeleted;
import com.flagship.inventory_ledger.event.PurchaseRecorded;
import com.flagship.inventory_ledger.event.PurchaseUpdated;
import com.flagship.inventory_ledger.event.SaleDeleted;
import com.flagship.inventory_ledger.event.SalePaymentStatusChanged;
import com.flagship.inventory_ledger.event.SaleRecorded;
import com.flagship.inventory_ledger.event.SaleUpdated;
import com.flagship.inventory_ledger.idempotency.IdempotencyScope;
import com.flagship.inventory_ledger.idempotency.IdempotencyService;
import com.flagship.inventory_ledger.observability.CorrelationContext;
import com.flagship.inventory_ledger.observability.InventoryMetrics;
import com.flagship.inventory_ledger.purchase.Purchase;
import com.flagship.inventory_ledger.purchase.PurchaseChanges;
import com.flagship.inventory_ledger.purchase.PurchaseEntity;
import com.flagship.inventory_ledger.purchase.PurchaseRepository;
import com.flagship.inventory_ledger.sale.PaymentMethod;
import com.flagship.inventory_ledger.sale.PaymentStatus;
import com.flagship.inventory_ledger.sale.Sale;
import com.flagship.inventory_ledger.sale.SaleChanges;
import com.flagship.inventory_ledger.sale.SaleEntity;
import com.flagship.inventory_ledger.sale.SaleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Records sales and purchases and keeps each product's stock counter in step
 * with them.
 *
 * This is the only path that changes stock as a byproduct of a sale or
 * purchase. Every mutation runs in one {@link AtomicScope}:
 * 1. lock the historical row (for edits and deletes), then the product row
 * 2. validate against the locked stock
 * 3. write the row, the new stock counter and a stock movement together
 * 4. write the ledger event to the outbox
 *
 * Either all of it commits or none of it does; in every error path the stock
 * counter is unchanged. Audit entries and notifications are derived from the
 * events after commit and never affect the outcome here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionRecorder {

    private static final String CREATE_SALE = "create_sale";
    private static final String UPDATE_SALE = "update_sale";
    private static final String UPDATE_SALE_PAYMENT = "update_sale_payment";
    private static final String DELETE_SALE = "delete_sale";
    private static final String CREATE_PURCHASE = "create_purchase";
    private static final String UPDATE_PURCHASE = "update_purchase";
    private static final String DELETE_PURCHASE = "delete_purchase";

    private static final int MAX_SUPPLIER_LENGTH = 255;

    private final ProductRepository productRepository;
    private final SaleRepository saleRepository;
    private final PurchaseRepository purchaseRepository;
    private final StockJournal stockJournal;
    private final AtomicScope atomicScope;
    private final LedgerEventPublisher eventPublisher;
    private final IdempotencyService idempotencyService;
    private final InventoryMetrics metrics;
    private final Clock clock;

    // ==================== Sales ====================

    public Sale createSale(UUID productId, int quantity, BigDecimal unitPrice,
                           PaymentMethod paymentMethod, PaymentStatus paymentStatus, Actor actor) {
        return createSale(productId, quantity, unitPrice, paymentMethod, paymentStatus, actor, null);
    }

    /**
     * Records a sale and decrements stock.
     *
     * With an idempotency key, a repeated call returns the sale recorded the
     * first time instead of selling again.
     *
     * @throws NotFoundException if the product does not exist
     * @throws InsufficientStockException if stock is below the requested quantity
     * @throws ValidationException for a quantity below 1, a negative price or a missing method
     */
    public Sale createSale(UUID productId, int quantity, BigDecimal unitPrice,
                           PaymentMethod paymentMethod, PaymentStatus paymentStatus,
                           Actor actor, String idempotencyKey) {
        AccessPolicy.require(actor, Permission.RECORD_SALES);
        requireId(productId, "productId");
        requireQuantity(quantity);
        BigDecimal price = Money.requireNonNegative(unitPrice, "unitPrice");
        Money.total(price, quantity, "totalPrice");
        if (paymentMethod == null) {
            throw new ValidationException("paymentMethod is required");
        }
        PaymentStatus status = paymentStatus != null ? paymentStatus : PaymentStatus.PAID;

        if (idempotencyKey != null) {
            Optional<Sale> replayed = findReplayedSale(idempotencyKey);
            if (replayed.isPresent()) {
                return replayed.get();
            }
        }

        return instrumented(CREATE_SALE, CorrelationContext.PRODUCT_ID_MDC_KEY, productId, () -> {
            Sale sale = atomicScope.execute(CREATE_SALE, () -> {
                ProductEntity product = lockProduct(productId);
                int stockBefore = product.getStockQuantity();

                if (stockBefore < quantity) {
                    throw new InsufficientStockException(productId, stockBefore, quantity);
                }

                product.applyStockChange(-quantity);

                SaleEntity entity = saleRepository.save(SaleEntity.record(
                    productId,
                    product.toDomain().snapshot(),
                    quantity,
                    price,
                    paymentMethod,
                    status,
                    actor.getId(),
                    clock.instant(),
                    idempotencyKey
                ));

                stockJournal.record(productId, MovementType.SALE, -quantity, product.getStockQuantity(),
                        entity.getId(), actor.getId(), null);

                Sale recorded = entity.toDomain();
                eventPublisher.publish(SaleRecorded.of(recorded, stockBefore, product.getStockQuantity(),
                        actor, clock.instant()));
                return recorded;
            });

            if (idempotencyKey != null) {
                idempotencyService.remember(IdempotencyScope.SALE, idempotencyKey, sale.getId());
            }

            log.info("Sale recorded: saleId={}, quantity={}, totalPrice={}, status={}",
                    sale.getId(), sale.getQuantitySold(), sale.getTotalPrice(), sale.getPaymentStatus());
            return sale;
        });
    }

    /**
     * Edits a sale. The previous quantity is returned to stock and the new one
     * taken, so the check is against stock plus the sale's current quantity.
     * The product of a sale cannot change.
     *
     * @throws NotFoundException if the sale or its product no longer exists
     */
    public Sale updateSale(UUID saleId, SaleChanges changes, Actor actor) {
        AccessPolicy.require(actor, Permission.RECORD_SALES);
        requireId(saleId, "saleId");
        if (changes == null || changes.isEmpty()) {
            throw new ValidationException("No changes supplied");
        }
        if (changes.getQuantity() != null) {
            requireQuantity(changes.getQuantity());
        }
        BigDecimal newPrice = changes.getUnitPrice() != null
                ? Money.requireNonNegative(changes.getUnitPrice(), "unitPrice")
                : null;

        return instrumented(UPDATE_SALE, CorrelationContext.SALE_ID_MDC_KEY, saleId, () -> {
            Sale updated = atomicScope.execute(UPDATE_SALE, () -> {
                SaleEntity sale = saleRepository.findByIdForUpdate(saleId)
                    .orElseThrow(() -> new NotFoundException("Sale", saleId));
                ProductEntity product = lockProduct(sale.getProductId());

                Sale before = sale.toDomain();
                int stockBefore = product.getStockQuantity();
                int oldQuantity = sale.getQuantitySold();
                int newQuantity = changes.getQuantity() != null ? changes.getQuantity() : oldQuantity;
                int available = stockBefore + oldQuantity;

                if (newQuantity > available) {
                    throw new InsufficientStockException(product.getId(), available, newQuantity);
                }

                int stockDelta = oldQuantity - newQuantity;
                if (stockDelta != 0) {
                    product.applyStockChange(stockDelta);
                    stockJournal.record(product.getId(), MovementType.SALE_CORRECTION, stockDelta,
                            product.getStockQuantity(), saleId, actor.getId(),
                            "quantity " + oldQuantity + " -> " + newQuantity);
                }

                sale.revise(
                    newQuantity,
                    newPrice != null ? newPrice : sale.getUnitPrice(),
                    changes.getPaymentMethod() != null ? changes.getPaymentMethod() : sale.getPaymentMethod(),
                    changes.getPaymentStatus() != null ? changes.getPaymentStatus() : sale.getPaymentStatus()
                );
                saleRepository.saveAndFlush(sale);

                Sale after = sale.toDomain();
                eventPublisher.publish(SaleUpdated.of(before, after, changedFields(before, after),
                        stockBefore, product.getStockQuantity(), actor, clock.instant()));
                return after;
            });

            log.info("Sale updated: quantity={}, totalPrice={}", updated.getQuantitySold(), updated.getTotalPrice());
            return updated;
        });
    }

    /**
     * Changes only the payment status of a sale. No stock moves, so this works
     * even after the product was deleted.
     */
    public Sale updatePaymentStatus(UUID saleId, PaymentStatus paymentStatus, Actor actor) {
        AccessPolicy.require(actor, Permission.RECORD_SALES);
        requireId(saleId, "saleId");
        if (paymentStatus == null) {
            throw new ValidationException("paymentStatus is required");
        }

        return instrumented(UPDATE_SALE_PAYMENT, CorrelationContext.SALE_ID_MDC_KEY, saleId, () ->
            atomicScope.execute(UPDATE_SALE_PAYMENT, () -> {
                SaleEntity sale = saleRepository.findByIdForUpdate(saleId)
                    .orElseThrow(() -> new NotFoundException("Sale", saleId));

                PaymentStatus previous = sale.getPaymentStatus();
                if (previous == paymentStatus) {
                    return sale.toDomain();
                }

                sale.changePaymentStatus(paymentStatus);
                saleRepository.saveAndFlush(sale);

                Sale updated = sale.toDomain();
                eventPublisher.publish(SalePaymentStatusChanged.of(updated, previous, actor, clock.instant()));
                log.info("Sale payment status changed: {} -> {}", previous, paymentStatus);
                return updated;
            })
        );
    }

    /**
     * Removes a sale and returns its quantity to stock. If the product has
     * already been deleted, the row is removed and no stock moves.
     *
     * @return the sale as it was before deletion
     */
    public Sale deleteSale(UUID saleId, Actor actor) {
        AccessPolicy.require(actor, Permission.RECORD_SALES);
        requireId(saleId, "saleId");

        return instrumented(DELETE_SALE, CorrelationContext.SALE_ID_MDC_KEY, saleId, () -> {
            AtomicReference<String> idempotencyKey = new AtomicReference<>();

            Sale deleted = atomicScope.execute(DELETE_SALE, () -> {
                SaleEntity sale = saleRepository.findByIdForUpdate(saleId)
                    .orElseThrow(() -> new NotFoundException("Sale", saleId));
                Sale snapshot = sale.toDomain();
                idempotencyKey.set(sale.getIdempotencyKey());

                Integer stockBefore = null;
                Integer stockAfter = null;
                Optional<ProductEntity> product = productRepository.findByIdForUpdate(sale.getProductId());
                if (product.isPresent()) {
                    ProductEntity locked = product.get();
                    stockBefore = locked.getStockQuantity();
                    locked.applyStockChange(sale.getQuantitySold());
                    stockAfter = locked.getStockQuantity();
                    stockJournal.record(locked.getId(), MovementType.SALE_REVERSAL, sale.getQuantitySold(),
                            stockAfter, saleId, actor.getId(), null);
                } else {
                    log.warn("Product {} of sale {} no longer exists, stock left unchanged",
                            sale.getProductId(), saleId);
                }

                saleRepository.delete(sale);
                eventPublisher.publish(SaleDeleted.of(snapshot, stockBefore, stockAfter, actor, clock.instant()));
                return snapshot;
            });

            idempotencyService.forget(IdempotencyScope.SALE, idempotencyKey.get());
            log.info("Sale deleted: quantity={} returned to stock", deleted.getQuantitySold());
            return deleted;
        });
    }

    // ==================== Purchases ====================

    public Purchase createPurchase(UUID productId, int quantity, BigDecimal unitCost,
                                   String supplier, Actor actor) {
        return createPurchase(productId, quantity, unitCost, supplier, actor, null);
    }

    /**
     * Records a purchase, increments stock and overwrites the product's cost
     * price with the unit cost.
     */
    public Purchase createPurchase(UUID productId, int quantity, BigDecimal unitCost,
                                   String supplier, Actor actor, String idempotencyKey) {
        AccessPolicy.require(actor, Permission.RECORD_PURCHASES);
        requireId(productId, "productId");
        requireQuantity(quantity);
        BigDecimal cost = Money.requireNonNegative(unitCost, "unitCost");
        Money.total(cost, quantity, "totalCost");
        String normalizedSupplier = requireSupplier(supplier);

        if (idempotencyKey != null) {
            Optional<Purchase> replayed = findReplayedPurchase(idempotencyKey);
            if (replayed.isPresent()) {
                return replayed.get();
            }
        }

        return instrumented(CREATE_PURCHASE, CorrelationContext.PRODUCT_ID_MDC_KEY, productId, () -> {
            Purchase purchase = atomicScope.execute(CREATE_PURCHASE, () -> {
                ProductEntity product = lockProduct(productId);
                int stockBefore = product.getStockQuantity();
                BigDecimal previousCost = product.getCostPrice();

                product.applyStockChange(quantity);
                product.overwriteCostPrice(cost);

                PurchaseEntity entity = purchaseRepository.save(PurchaseEntity.record(
                    productId,
                    product.toDomain().snapshot(),
                    quantity,
                    cost,
                    normalizedSupplier,
                    actor.getId(),
                    clock.instant(),
                    idempotencyKey
                ));

                stockJournal.record(productId, MovementType.PURCHASE, quantity, product.getStockQuantity(),
                        entity.getId(), actor.getId(), null);

                Purchase recorded = entity.toDomain();
                eventPublisher.publish(PurchaseRecorded.of(recorded, previousCost, stockBefore,
                        product.getStockQuantity(), actor, clock.instant()));
                return recorded;
            });

            if (idempotencyKey != null) {
                idempotencyService.remember(IdempotencyScope.PURCHASE, idempotencyKey, purchase.getId());
            }

            log.info("Purchase recorded: purchaseId={}, quantity={}, totalCost={}, supplier={}",
                    purchase.getId(), purchase.getQuantityPurchased(), purchase.getTotalCost(),
                    purchase.getSupplier());
            return purchase;
        });
    }

    /**
     * Edits a purchase. Lowering the quantity takes the difference back out of
     * stock and is rejected if that would drive stock below zero. A new unit
     * cost also becomes the product's cost price.
     */
    public Purchase updatePurchase(UUID purchaseId, PurchaseChanges changes, Actor actor) {
        AccessPolicy.require(actor, Permission.RECORD_PURCHASES);
        requireId(purchaseId, "purchaseId");
        if (changes == null || changes.isEmpty()) {
            throw new ValidationException("No changes supplied");
        }
        if (changes.getQuantity() != null) {
            requireQuantity(changes.getQuantity());
        }
        BigDecimal newCost = changes.getUnitCost() != null
                ? Money.requireNonNegative(changes.getUnitCost(), "unitCost")
                : null;
        String newSupplier = changes.getSupplier() != null ? requireSupplier(changes.getSupplier()) : null;

        return instrumented(UPDATE_PURCHASE, CorrelationContext.PURCHASE_ID_MDC_KEY, purchaseId, () -> {
            Purchase updated = atomicScope.execute(UPDATE_PURCHASE, () -> {
                PurchaseEntity purchase = purchaseRepository.findByIdForUpdate(purchaseId)
                    .orElseThrow(() -> new NotFoundException("Purchase", purchaseId));
                ProductEntity product = lockProduct(purchase.getProductId());

                Purchase before = purchase.toDomain();
                int stockBefore = product.getStockQuantity();
                int oldQuantity = purchase.getQuantityPurchased();
                int newQuantity = changes.getQuantity() != null ? changes.getQuantity() : oldQuantity;
                int stockDelta = newQuantity - oldQuantity;

                if (stockBefore + stockDelta < 0) {
                    throw new InsufficientStockException(product.getId(), stockBefore, -stockDelta);
                }

                if (stockDelta != 0) {
                    product.applyStockChange(stockDelta);
                    stockJournal.record(product.getId(), MovementType.PURCHASE_CORRECTION, stockDelta,
                            product.getStockQuantity(), purchaseId, actor.getId(),
                            "quantity " + oldQuantity + " -> " + newQuantity);
                }
                if (newCost != null && newCost.compareTo(purchase.getUnitCost()) != 0) {
                    product.overwriteCostPrice(newCost);
                }

                purchase.revise(
                    newQuantity,
                    newCost != null ? newCost : purchase.getUnitCost(),
                    newSupplier != null ? newSupplier : purchase.getSupplier()
                );
                purchaseRepository.saveAndFlush(purchase);

                Purchase after = purchase.toDomain();
                eventPublisher.publish(PurchaseUpdated.of(before, after, changedFields(before, after),
                        stockBefore, product.getStockQuantity(), actor, clock.instant()));
                return after;
            });

            log.info("Purchase updated: quantity={}, totalCost={}",
                    updated.getQuantityPurchased(), updated.getTotalCost());
            return updated;
        });
    }

    /**
     * Removes a purchase and takes its quantity back out of stock.
     *
     * @throws InsufficientStockException if part of the purchased stock has
     *         already been sold, so reversing it would go below zero
     */
    public Purchase deletePurchase(UUID purchaseId, Actor actor) {
        AccessPolicy.require(actor, Permission.RECORD_PURCHASES);
        requireId(purchaseId, "purchaseId");

        return instrumented(DELETE_PURCHASE, CorrelationContext.PURCHASE_ID_MDC_KEY, purchaseId, () -> {
            AtomicReference<String> idempotencyKey = new AtomicReference<>();

            Purchase deleted = atomicScope.execute(DELETE_PURCHASE, () -> {
                PurchaseEntity purchase = purchaseRepository.findByIdForUpdate(purchaseId)
                    .orElseThrow(() -> new NotFoundException("Purchase", purchaseId));
                Purchase snapshot = purchase.toDomain();
                idempotencyKey.set(purchase.getIdempotencyKey());
                int quantity = purchase.getQuantityPurchased();

                Integer stockBefore = null;
                Integer stockAfter = null;
                Optional<ProductEntity> product = productRepository.findByIdForUpdate(purchase.getProductId());
                if (product.isPresent()) {
                    ProductEntity locked = product.get();
                    stockBefore = locked.getStockQuantity();
                    if (stockBefore < quantity) {
                        throw new InsufficientStockException(locked.getId(), stockBefore, quantity);
                    }
                    locked.applyStockChange(-quantity);
                    stockAfter = locked.getStockQuantity();
                    stockJournal.record(locked.getId(), MovementType.PURCHASE_REVERSAL, -quantity,
                            stockAfter, purchaseId, actor.getId(), null);
                } else {
                    log.warn("Product {} of purchase {} no longer exists, stock left unchanged",
                            purchase.getProductId(), purchaseId);
                }

                purchaseRepository.delete(purchase);
                eventPublisher.publish(PurchaseDeleted.of(snapshot, stockBefore, stockAfter, actor, clock.instant()));
                return snapshot;
            });

            idempotencyService.forget(IdempotencyScope.PURCHASE, idempotencyKey.get());
            log.info("Purchase deleted: quantity={} taken out of stock", deleted.getQuantityPurchased());
            return deleted;
        });
    }

    // ==================== Helpers ====================

    private Optional<Sale> findReplayedSale(String idempotencyKey) {
        IdempotencyService.validateKey(idempotencyKey);
        Optional<Sale> existing = idempotencyService.findRecorded(IdempotencyScope.SALE, idempotencyKey)
            .flatMap(saleRepository::findById)
            .map(SaleEntity::toDomain);
        recordIdempotencyOutcome(existing.isPresent(), "sale", idempotencyKey);
        return existing;
    }

    private Optional<Purchase> findReplayedPurchase(String idempotencyKey) {
        IdempotencyService.validateKey(idempotencyKey);
        Optional<Purchase> existing = idempotencyService.findRecorded(IdempotencyScope.PURCHASE, idempotencyKey)
            .flatMap(purchaseRepository::findById)
            .map(PurchaseEntity::toDomain);
        recordIdempotencyOutcome(existing.isPresent(), "purchase", idempotencyKey);
        return existing;
    }

    private void recordIdempotencyOutcome(boolean hit, String kind, String idempotencyKey) {
        if (hit) {
            metrics.recordIdempotencyHit();
            log.info("Idempotency key already used, returning existing {}: key={}", kind, idempotencyKey);
        } else {
            metrics.recordIdempotencyMiss();
        }
    }

    private ProductEntity lockProduct(UUID productId) {
        return productRepository.findByIdForUpdate(productId)
            .orElseThrow(() -> new NotFoundException("Product", productId));
    }

    /**
     * Wraps an operation with MDC context, outcome metrics, latency and logging.
     */
    private <T> T instrumented(String operation, String mdcKey, UUID mdcValue, Supplier<T> body) {
        long startTime = System.currentTimeMillis();
        MDC.put(mdcKey, mdcValue.toString());
        try {
            T result = body.get();
            metrics.recordLedgerOperation(operation, "success");
            return result;
        } catch (InsufficientStockException e) {
            metrics.recordInsufficientStock(operation);
            metrics.recordLedgerOperation(operation, "insufficient_stock");
            log.warn("{} rejected: {}", operation, e.getMessage());
            throw e;
        } catch (InventoryException e) {
            metrics.recordLedgerOperation(operation, e.getClass().getSimpleName());
            log.warn("{} failed: {}", operation, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordLedgerOperation(operation, "error");
            log.error("{} failed unexpectedly: {}", operation, e.getMessage(), e);
            throw e;
        } finally {
            metrics.recordLedgerLatency(operation, System.currentTimeMillis() - startTime);
            MDC.remove(mdcKey);
        }
    }

    private static void requireId(UUID id, String field) {
        if (id == null) {
            throw new ValidationException(field + " is required");
        }
    }

    private static void requireQuantity(int quantity) {
        if (quantity < 1) {
            throw new ValidationException("Quantity must be at least 1");
        }
    }

    private static String requireSupplier(String supplier) {
        if (supplier == null || supplier.isBlank()) {
            throw new ValidationException("supplier is required");
        }
        String trimmed = supplier.trim();
        if (trimmed.length() > MAX_SUPPLIER_LENGTH) {
            throw new ValidationException("supplier cannot exceed " + MAX_SUPPLIER_LENGTH + " characters");
        }
        return trimmed;
    }

    private static List<String> changedFields(Sale before, Sale after) {
        List<String> changed = new ArrayList<>();
        if (before.getQuantitySold() != after.getQuantitySold()) {
            changed.add("quantity");
        }
        if (before.getUnitPrice().compareTo(after.getUnitPrice()) != 0) {
            changed.add("unitPrice");
        }
        if (before.getPaymentMethod() != after.getPaymentMethod()) {
            changed.add("paymentMethod");
        }
        if (before.getPaymentStatus() != after.getPaymentStatus()) {
            changed.add("paymentStatus");
        }
        return changed;
    }

    private static List<String> changedFields(Purchase before, Purchase after) {
        List<String> changed = new ArrayList<>();
        if (before.getQuantityPurchased() != after.getQuantityPurchased()) {
            changed.add("quantity");
        }
        if (before.getUnitCost().compareTo(after.getUnitCost()) != 0) {
            changed.add("unitCost");
        }
        if (!before.getSupplier().equals(after.getSupplier())) {
            changed.add("supplier");
        }
        return changed;
    }
}
