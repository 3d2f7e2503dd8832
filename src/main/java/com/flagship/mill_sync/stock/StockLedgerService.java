package com.flagship.mill_sync.stock;

import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.common.InsufficientStockException;
import com.flagship.mill_sync.common.LocalIdAllocator;
import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.common.ValidationException;
import com.flagship.mill_sync.inventory.InventoryItemEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only stock ledger.
 *
 * Invariants:
 * 1. An item's currentQuantity/currentBags always equal the sum of its movement deltas
 * 2. Movements are never updated except for their sync metadata
 * 3. Every movement is written in the same transaction as the item cache update
 *
 * Stock is never allowed to go negative. Callers validate every line of an
 * operation before the first movement is written, so a rejected operation
 * leaves no partial deduction.
 */
@Service
@Slf4j
public class StockLedgerService {

    private final JdbcTemplate jdbcTemplate;
    private final LocalIdAllocator idAllocator;
    private final Clock clock;

    public StockLedgerService(JdbcTemplate jdbcTemplate, LocalIdAllocator idAllocator, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.idAllocator = idAllocator;
        this.clock = clock;
    }

    /**
     * Adds stock and recomputes the weighted average price.
     *
     * @param pricePerKg cost of the added stock, or null to keep the current average
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public StockMovement addStock(InventoryItemEntity item, BigDecimal quantity, int bags, BigDecimal pricePerKg,
                                  MovementType type, EntityRef reference, String reason) {
        requirePositive(quantity);
        BigDecimal newAverage = StockCalculator.weightedAverage(
                item.getCurrentQuantity(), item.getAveragePricePerKg(), quantity, pricePerKg);

        return append(item, quantity, Math.max(0, bags), pricePerKg, newAverage, type, reference, reason,
                SyncStatus.PENDING);
    }

    /**
     * Removes stock. Fails with {@link InsufficientStockException} if the item
     * does not hold {@code quantity}.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public StockMovement deductStock(InventoryItemEntity item, BigDecimal quantity, int bags,
                                     MovementType type, EntityRef reference, String reason) {
        requirePositive(quantity);
        requireAvailable(item, quantity);
        int bagsRemoved = StockCalculator.bagsRemoved(item.getCurrentBags(), bags);

        return append(item, quantity.negate(), -bagsRemoved, null, null, type, reference, reason,
                SyncStatus.PENDING);
    }

    /**
     * Manual correction to a counted quantity. Records the signed difference.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public StockMovement adjustTo(InventoryItemEntity item, BigDecimal targetQuantity, int targetBags, String reason) {
        if (targetQuantity == null || targetQuantity.signum() < 0) {
            throw new ValidationException("Adjusted quantity must be zero or positive");
        }
        if (targetBags < 0) {
            throw new ValidationException("Adjusted bags must be zero or positive");
        }
        BigDecimal delta = targetQuantity.subtract(item.getCurrentQuantity());
        int bagsDelta = targetBags - item.getCurrentBags();
        if (delta.signum() == 0 && bagsDelta == 0) {
            throw new ValidationException("Adjustment does not change the stock of item " + item.getLocalId());
        }
        return append(item, delta, bagsDelta, null, null, MovementType.ADJUSTMENT, null, reason,
                SyncStatus.PENDING);
    }

    /**
     * Brings the cached stock in line with a quantity reported by the remote.
     * The movement is already known to the remote, so it is stored as SYNCED
     * and never queued.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public StockMovement recordRemoteAdjustment(InventoryItemEntity item, BigDecimal remoteQuantity, int remoteBags) {
        BigDecimal delta = remoteQuantity.subtract(item.getCurrentQuantity());
        int bagsDelta = remoteBags - item.getCurrentBags();
        MovementType type = item.getCurrentQuantity().signum() == 0 && item.getCurrentBags() == 0
                ? MovementType.INITIAL
                : MovementType.ADJUSTMENT;
        return append(item, delta, bagsDelta, null, null, type, null, "Remote stock level", SyncStatus.SYNCED);
    }

    /**
     * Writes the compensating movements for everything recorded against
     * {@code reference}: each movement is mirrored with the opposite sign and
     * the same magnitude. Every deduction is validated before the first
     * reversal is written.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<StockMovement> reverse(EntityRef reference, List<InventoryItemEntity> items, String reason) {
        List<StockMovement> originals = findByReference(reference).stream()
                .filter(m -> m.getMovementType() != MovementType.REVERSAL_IN
                        && m.getMovementType() != MovementType.REVERSAL_OUT)
                .toList();

        Map<Long, BigDecimal> toRemove = new LinkedHashMap<>();
        for (StockMovement original : originals) {
            if (original.isIncrease()) {
                toRemove.merge(original.getInventoryItemLocalId(), original.getQuantityDelta(), BigDecimal::add);
            }
        }
        toRemove.forEach((itemId, quantity) -> requireAvailable(itemFor(items, itemId), quantity));

        return originals.stream()
                .map(original -> {
                    InventoryItemEntity item = itemFor(items, original.getInventoryItemLocalId());
                    MovementType type = original.isIncrease() ? MovementType.REVERSAL_OUT : MovementType.REVERSAL_IN;
                    // bag reversal clamps like any deduction so the cache never goes below zero
                    int bagsDelta = original.isIncrease()
                            ? -StockCalculator.bagsRemoved(item.getCurrentBags(), original.getBagsDelta())
                            : -original.getBagsDelta();
                    return append(item, original.getQuantityDelta().negate(), bagsDelta, null, null,
                            type, reference, reason, SyncStatus.PENDING);
                })
                .toList();
    }

    public void requireAvailable(InventoryItemEntity item, BigDecimal quantity) {
        if (item.getCurrentQuantity().compareTo(quantity) < 0) {
            throw new InsufficientStockException(item.getLocalId(), item.getName(),
                    item.getCurrentQuantity(), quantity);
        }
    }

    /**
     * Quantity derived from the movement ledger.
     */
    public BigDecimal derivedQuantity(long inventoryItemId) {
        BigDecimal sum = jdbcTemplate.queryForObject(
                "SELECT COALESCE(SUM(quantity_delta), 0) FROM stock_movements WHERE inventory_item_local_id = ?",
                BigDecimal.class,
                inventoryItemId);
        return sum != null ? sum : BigDecimal.ZERO;
    }

    public int derivedBags(long inventoryItemId) {
        Integer sum = jdbcTemplate.queryForObject(
                "SELECT COALESCE(SUM(bags_delta), 0) FROM stock_movements WHERE inventory_item_local_id = ?",
                Integer.class,
                inventoryItemId);
        return sum != null ? sum : 0;
    }

    /**
     * True when the cached stock of the item matches its movement ledger.
     */
    public boolean isConsistent(InventoryItemEntity item) {
        return item.getCurrentQuantity().compareTo(derivedQuantity(item.getLocalId())) == 0
                && item.getCurrentBags() == derivedBags(item.getLocalId());
    }

    public List<StockMovement> findByItem(long inventoryItemId) {
        return jdbcTemplate.query(
                SELECT_MOVEMENTS + "WHERE inventory_item_local_id = ? ORDER BY local_id",
                movementRowMapper(),
                inventoryItemId);
    }

    public List<StockMovement> findByReference(EntityRef reference) {
        return jdbcTemplate.query(
                SELECT_MOVEMENTS + "WHERE reference_type = ? AND reference_local_id = ? ORDER BY local_id",
                movementRowMapper(),
                reference.getType().name(),
                reference.getLocalId());
    }

    public List<StockMovement> findUnsynced() {
        return jdbcTemplate.query(
                SELECT_MOVEMENTS + "WHERE sync_status <> 'SYNCED' ORDER BY local_id",
                movementRowMapper());
    }

    /**
     * Stores the remote identity of a movement. A movement that already has
     * one keeps it.
     */
    public void markSynced(long movementId, String serverId) {
        jdbcTemplate.update(
                "UPDATE stock_movements SET server_id = COALESCE(server_id, ?), sync_status = 'SYNCED' WHERE local_id = ?",
                serverId,
                movementId);
    }

    public void markStatus(long movementId, SyncStatus status) {
        jdbcTemplate.update(
                "UPDATE stock_movements SET sync_status = ? WHERE local_id = ? AND sync_status <> 'SYNCED'",
                status.name(),
                movementId);
    }

    private StockMovement append(InventoryItemEntity item, BigDecimal quantityDelta, int bagsDelta,
                                 BigDecimal pricePerKg, BigDecimal newAverage, MovementType type,
                                 EntityRef reference, String reason, SyncStatus status) {
        Instant now = clock.instant();
        long movementId = idAllocator.nextId();

        item.applyMovement(quantityDelta, bagsDelta, newAverage, now);

        jdbcTemplate.update(
                "INSERT INTO stock_movements (local_id, inventory_item_local_id, movement_type, quantity_delta, " +
                "bags_delta, price_per_kg, reference_type, reference_local_id, reason, sync_status, created_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                movementId,
                item.getLocalId(),
                type.name(),
                quantityDelta,
                bagsDelta,
                pricePerKg,
                reference != null ? reference.getType().name() : null,
                reference != null ? reference.getLocalId() : null,
                reason,
                status.name(),
                now.atOffset(ZoneOffset.UTC));

        log.debug("Stock movement {} on item {}: type={}, quantity={}, bags={}",
                movementId, item.getLocalId(), type, quantityDelta.toPlainString(), bagsDelta);

        return new StockMovement(movementId, null, item.getLocalId(), type, quantityDelta, bagsDelta,
                pricePerKg, reference, reason, status, now);
    }

    private static InventoryItemEntity itemFor(List<InventoryItemEntity> items, long localId) {
        return items.stream()
                .filter(item -> item.getLocalId() == localId)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Inventory item " + localId + " not loaded"));
    }

    private static void requirePositive(BigDecimal quantity) {
        if (quantity == null || quantity.signum() <= 0) {
            throw new ValidationException("Quantity must be greater than zero");
        }
    }

    private static final String SELECT_MOVEMENTS =
            "SELECT local_id, server_id, inventory_item_local_id, movement_type, quantity_delta, bags_delta, " +
            "price_per_kg, reference_type, reference_local_id, reason, sync_status, created_at " +
            "FROM stock_movements ";

    private RowMapper<StockMovement> movementRowMapper() {
        return (rs, rowNum) -> {
            String referenceType = rs.getString("reference_type");
            EntityRef reference = referenceType != null
                    ? EntityRef.of(EntityType.valueOf(referenceType), rs.getLong("reference_local_id"))
                    : null;
            return new StockMovement(
                    rs.getLong("local_id"),
                    rs.getString("server_id"),
                    rs.getLong("inventory_item_local_id"),
                    MovementType.valueOf(rs.getString("movement_type")),
                    rs.getBigDecimal("quantity_delta"),
                    rs.getInt("bags_delta"),
                    rs.getBigDecimal("price_per_kg"),
                    reference,
                    rs.getString("reason"),
                    SyncStatus.valueOf(rs.getString("sync_status")),
                    rs.getObject("created_at", OffsetDateTime.class).toInstant());
        };
    }
}
