package com.flagship.inventory_ledger.catalog;

import com.flagship.inventory_ledger.common.AccessPolicy;
import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.Money;
import com.flagship.inventory_ledger.common.Permission;
import com.flagship.inventory_ledger.common.exception.ConflictException;
import com.flagship.inventory_ledger.common.exception.NotFoundException;
import com.flagship.inventory_ledger.common.exception.ValidationException;
import com.flagship.inventory_ledger.event.LedgerEventPublisher;
import com.flagship.inventory_ledger.event.ProductCreated;
import com.flagship.inventory_ledger.event.ProductDeleted;
import com.flagship.inventory_ledger.event.ProductUpdated;
import com.flagship.inventory_ledger.event.StockAdjusted;
import com.flagship.inventory_ledger.ledger.AtomicScope;
import com.flagship.inventory_ledger.ledger.MovementType;
import com.flagship.inventory_ledger.ledger.StockJournal;
import com.flagship.inventory_ledger.ledger.StockMovement;
import com.flagship.inventory_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Catalog management: products and their administrative stock adjustments.
 *
 * Sales and purchases move stock through the transaction recorder. Here stock
 * changes only as an opening balance on create or an explicit rewrite on
 * update; both are journaled as ADJUSTMENT movements under the product row
 * lock, so the counter still equals the sum of its movements.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProductService {

    private static final int MAX_NAME_LENGTH = 255;
    private static final int MAX_SKU_LENGTH = 100;
    private static final int MAX_CATEGORY_LENGTH = 100;

    private final ProductRepository productRepository;
    private final StockJournal stockJournal;
    private final AtomicScope atomicScope;
    private final LedgerEventPublisher eventPublisher;
    private final Clock clock;

    public Product create(NewProduct request, Actor actor) {
        AccessPolicy.require(actor, Permission.MANAGE_PRODUCTS);
        if (request == null) {
            throw new ValidationException("Product details are required");
        }

        String name = requireText(request.getName(), "name", MAX_NAME_LENGTH);
        String sku = normalizeSku(request.getSku());
        String category = requireText(request.getCategory(), "category", MAX_CATEGORY_LENGTH);
        BigDecimal costPrice = Money.requireNonNegative(request.getCostPrice(), "costPrice");
        BigDecimal sellingPrice = Money.requireNonNegative(request.getSellingPrice(), "sellingPrice");
        int openingStock = requireNonNegative(request.getOpeningStock(), "openingStock", 0);
        int reorderLevel = requireNonNegative(request.getReorderLevel(), "reorderLevel",
                StockLevels.LOW_STOCK_THRESHOLD);

        Product product = atomicScope.execute("create_product", () -> {
            if (productRepository.existsBySku(sku)) {
                throw new ConflictException("A product with SKU " + sku + " already exists");
            }

            Product draft = new Product(UUID.randomUUID(), name, sku, category,
                    trimToNull(request.getDescription()), costPrice, sellingPrice, openingStock,
                    reorderLevel, null, null, null);
            Product saved = productRepository.saveAndFlush(ProductEntity.fromDomain(draft)).toDomain();

            if (openingStock > 0) {
                stockJournal.record(saved.getId(), MovementType.ADJUSTMENT, openingStock, openingStock,
                        saved.getId(), actor.getId(), "opening balance");
            }

            eventPublisher.publish(ProductCreated.of(saved, actor, clock.instant()));
            return saved;
        });

        log.info("Product created: productId={}, sku={}, openingStock={}",
                product.getId(), product.getSku(), product.getStockQuantity());
        return product;
    }

    /**
     * Applies a partial update. A changed stock quantity is an administrative
     * adjustment: the difference is journaled and a StockAdjusted event emitted.
     */
    public Product update(UUID productId, ProductChanges changes, Actor actor) {
        AccessPolicy.require(actor, Permission.MANAGE_PRODUCTS);
        requireId(productId);
        if (changes == null) {
            throw new ValidationException("No changes supplied");
        }

        String newName = changes.getName() != null ? requireText(changes.getName(), "name", MAX_NAME_LENGTH) : null;
        String newSku = changes.getSku() != null ? normalizeSku(changes.getSku()) : null;
        String newCategory = changes.getCategory() != null
                ? requireText(changes.getCategory(), "category", MAX_CATEGORY_LENGTH) : null;
        BigDecimal newCost = changes.getCostPrice() != null
                ? Money.requireNonNegative(changes.getCostPrice(), "costPrice") : null;
        BigDecimal newSelling = changes.getSellingPrice() != null
                ? Money.requireNonNegative(changes.getSellingPrice(), "sellingPrice") : null;
        Integer newStock = changes.getStockQuantity() != null
                ? requireNonNegative(changes.getStockQuantity(), "stockQuantity", 0) : null;
        Integer newReorder = changes.getReorderLevel() != null
                ? requireNonNegative(changes.getReorderLevel(), "reorderLevel", 0) : null;

        MDC.put(CorrelationContext.PRODUCT_ID_MDC_KEY, productId.toString());
        try {
            Product updated = atomicScope.execute("update_product", () -> {
                ProductEntity entity = productRepository.findByIdForUpdate(productId)
                    .orElseThrow(() -> new NotFoundException("Product", productId));
                Product before = entity.toDomain();

                if (newSku != null && !newSku.equals(before.getSku())
                        && productRepository.existsBySkuAndIdNot(newSku, productId)) {
                    throw new ConflictException("A product with SKU " + newSku + " already exists");
                }

                entity.updateDetails(
                    newName != null ? newName : before.getName(),
                    newSku != null ? newSku : before.getSku(),
                    newCategory != null ? newCategory : before.getCategory(),
                    changes.getDescription() != null ? trimToNull(changes.getDescription()) : before.getDescription(),
                    newCost != null ? newCost : before.getCostPrice(),
                    newSelling != null ? newSelling : before.getSellingPrice(),
                    newReorder != null ? newReorder : before.getReorderLevel()
                );

                int stockBefore = before.getStockQuantity();
                if (newStock != null && newStock != stockBefore) {
                    int delta = newStock - stockBefore;
                    entity.applyStockChange(delta);
                    stockJournal.record(productId, MovementType.ADJUSTMENT, delta, newStock, productId,
                            actor.getId(), trimToNull(changes.getAdjustmentReason()));
                }

                Product after = productRepository.saveAndFlush(entity).toDomain();

                List<String> changed = changedFields(before, after);
                if (!changed.isEmpty()) {
                    eventPublisher.publish(ProductUpdated.of(after, changed, actor, clock.instant()));
                }
                if (after.getStockQuantity() != stockBefore) {
                    eventPublisher.publish(StockAdjusted.of(after, stockBefore,
                            trimToNull(changes.getAdjustmentReason()), actor, clock.instant()));
                }
                return after;
            });

            log.info("Product updated: sku={}, stock={}", updated.getSku(), updated.getStockQuantity());
            return updated;
        } finally {
            MDC.remove(CorrelationContext.PRODUCT_ID_MDC_KEY);
        }
    }

    /**
     * Removes the catalog row. Sales, purchases and stock movements keep the
     * dangling product id and their frozen snapshots.
     */
    public Product delete(UUID productId, Actor actor) {
        AccessPolicy.require(actor, Permission.MANAGE_PRODUCTS);
        requireId(productId);

        Product deleted = atomicScope.execute("delete_product", () -> {
            ProductEntity entity = productRepository.findByIdForUpdate(productId)
                .orElseThrow(() -> new NotFoundException("Product", productId));
            Product snapshot = entity.toDomain();

            productRepository.delete(entity);
            eventPublisher.publish(ProductDeleted.of(snapshot, actor, clock.instant()));
            return snapshot;
        });

        log.info("Product deleted: productId={}, sku={}", deleted.getId(), deleted.getSku());
        return deleted;
    }

    @Transactional(readOnly = true)
    public Product get(UUID productId) {
        requireId(productId);
        return productRepository.findById(productId)
            .map(ProductEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Product", productId));
    }

    @Transactional(readOnly = true)
    public List<Product> list(ProductFilter filter) {
        return productRepository.findAll(
                ProductSpecifications.matching(filter != null ? filter : ProductFilter.none()),
                Sort.by(Sort.Direction.DESC, "createdAt"))
            .stream()
            .map(ProductEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<String> categories() {
        return productRepository.findDistinctCategories();
    }

    @Transactional(readOnly = true)
    public List<StockMovement> movements(UUID productId) {
        requireId(productId);
        return stockJournal.getMovements(productId);
    }

    static String normalizeSku(String sku) {
        if (sku == null || sku.isBlank()) {
            throw new ValidationException("sku is required");
        }
        String normalized = sku.trim().toUpperCase(Locale.ROOT);
        if (normalized.length() > MAX_SKU_LENGTH) {
            throw new ValidationException("sku cannot exceed " + MAX_SKU_LENGTH + " characters");
        }
        return normalized;
    }

    private static void requireId(UUID productId) {
        if (productId == null) {
            throw new ValidationException("productId is required");
        }
    }

    private static String requireText(String value, String field, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        String trimmed = value.trim();
        if (trimmed.length() > maxLength) {
            throw new ValidationException(field + " cannot exceed " + maxLength + " characters");
        }
        return trimmed;
    }

    private static int requireNonNegative(Integer value, String field, int defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value < 0) {
            throw new ValidationException(field + " cannot be negative");
        }
        return value;
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static List<String> changedFields(Product before, Product after) {
        List<String> changed = new ArrayList<>();
        if (!Objects.equals(before.getName(), after.getName())) {
            changed.add("name");
        }
        if (!Objects.equals(before.getSku(), after.getSku())) {
            changed.add("sku");
        }
        if (!Objects.equals(before.getCategory(), after.getCategory())) {
            changed.add("category");
        }
        if (!Objects.equals(before.getDescription(), after.getDescription())) {
            changed.add("description");
        }
        if (before.getCostPrice().compareTo(after.getCostPrice()) != 0) {
            changed.add("costPrice");
        }
        if (before.getSellingPrice().compareTo(after.getSellingPrice()) != 0) {
            changed.add("sellingPrice");
        }
        if (before.getReorderLevel() != after.getReorderLevel()) {
            changed.add("reorderLevel");
        }
        return changed;
    }
}
