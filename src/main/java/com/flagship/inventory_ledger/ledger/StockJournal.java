package com.flagship.inventory_ledger.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Append-only journal of stock movements.
 *
 * Every change of a product's stock counter writes one row here in the same
 * transaction, so that:
 * 1. stock_quantity always equals the sum of the product's movement deltas
 * 2. rows are never updated or deleted (a database trigger rejects both)
 * 3. without adjustments, stock also equals purchased minus sold
 *
 * Plain JDBC: the journal is insert-and-aggregate only and needs no entity state.
 */
@Service
public class StockJournal {

    private final JdbcTemplate jdbcTemplate;

    public StockJournal(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Records a movement inside the caller's atomic scope.
     *
     * @return id of the journal row
     * @throws IllegalArgumentException for a zero delta or a negative resulting stock
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public UUID record(UUID productId, MovementType type, int quantityDelta, int stockAfter,
                       UUID referenceId, UUID actorId, String note) {
        if (quantityDelta == 0) {
            throw new IllegalArgumentException("Stock movement delta cannot be zero");
        }
        if (stockAfter < 0) {
            throw new IllegalArgumentException("Stock after movement cannot be negative: " + stockAfter);
        }

        UUID movementId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO stock_movements (id, product_id, movement_type, quantity_delta, stock_after, " +
            "reference_type, reference_id, actor_id, note, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            movementId,
            productId,
            type.name(),
            quantityDelta,
            stockAfter,
            type.getReferenceType(),
            referenceId,
            actorId,
            note
        );
        return movementId;
    }

    /**
     * Stock reconstructed from the journal: the sum of all movement deltas.
     */
    public int replayMovements(UUID productId) {
        Integer total = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(quantity_delta), 0) FROM stock_movements WHERE product_id = ?",
            Integer.class,
            productId
        );
        return total != null ? total : 0;
    }

    /**
     * Stock reconstructed from committed history alone: purchased minus sold.
     * Matches the counter whenever the product has no adjustments.
     */
    public int replaySalesAndPurchases(UUID productId) {
        Integer total = jdbcTemplate.queryForObject(
            "SELECT COALESCE((SELECT SUM(quantity_purchased) FROM purchases WHERE product_id = ?), 0) " +
            "     - COALESCE((SELECT SUM(quantity_sold) FROM sales WHERE product_id = ?), 0)",
            Integer.class,
            productId,
            productId
        );
        return total != null ? total : 0;
    }

    public boolean hasAdjustments(UUID productId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM stock_movements WHERE product_id = ? AND movement_type = 'ADJUSTMENT'",
            Integer.class,
            productId
        );
        return count != null && count > 0;
    }

    public List<StockMovement> getMovements(UUID productId) {
        return jdbcTemplate.query(
            "SELECT id, product_id, movement_type, quantity_delta, stock_after, reference_type, reference_id, " +
            "actor_id, note, sequence_number, created_at " +
            "FROM stock_movements WHERE product_id = ? ORDER BY sequence_number",
            movementRowMapper(),
            productId
        );
    }

    /**
     * Products whose counter disagrees with their journal. Empty in a healthy ledger.
     */
    public List<UUID> findProductsOutOfBalance() {
        return jdbcTemplate.query(
            "SELECT p.id FROM products p " +
            "LEFT JOIN (SELECT product_id, SUM(quantity_delta) AS total FROM stock_movements GROUP BY product_id) m " +
            "  ON m.product_id = p.id " +
            "WHERE p.stock_quantity <> COALESCE(m.total, 0)",
            (rs, rowNum) -> rs.getObject("id", UUID.class)
        );
    }

    private RowMapper<StockMovement> movementRowMapper() {
        return (rs, rowNum) -> new StockMovement(
            rs.getObject("id", UUID.class),
            rs.getObject("product_id", UUID.class),
            MovementType.valueOf(rs.getString("movement_type")),
            rs.getInt("quantity_delta"),
            rs.getInt("stock_after"),
            rs.getString("reference_type"),
            rs.getObject("reference_id", UUID.class),
            rs.getObject("actor_id", UUID.class),
            rs.getString("note"),
            rs.getLong("sequence_number"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
