package com.flagship.mill_sync.inventory;

import com.flagship.mill_sync.common.LedgerRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Inventory item ledger row.
 *
 * currentQuantity and currentBags are a cache of the stock movement ledger
 * and change only through {@link #applyMovement}, which the stock ledger
 * calls in the same transaction as it appends the movement.
 */
@Entity
@Table(name = "inventory_items")
@Getter
public class InventoryItemEntity extends LedgerRecord {

    @Enumerated(EnumType.STRING)
    @Column(name = "item_type", nullable = false, length = 16)
    private ItemType itemType;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "variety", length = 100)
    private String variety;

    @Column(name = "current_quantity", nullable = false, precision = 19, scale = 3)
    private BigDecimal currentQuantity = BigDecimal.ZERO;

    @Column(name = "current_bags", nullable = false)
    private int currentBags;

    @Column(name = "average_price_per_kg", nullable = false, precision = 19, scale = 4)
    private BigDecimal averagePricePerKg = BigDecimal.ZERO;

    @Column(name = "selling_price_per_kg", precision = 19, scale = 2)
    private BigDecimal sellingPricePerKg;

    @Column(name = "minimum_stock", nullable = false, precision = 19, scale = 3)
    private BigDecimal minimumStock = BigDecimal.ZERO;

    @Column(name = "warehouse_location", length = 100)
    private String warehouseLocation;

    @Column(name = "last_stock_update_at")
    private Instant lastStockUpdateAt;

    protected InventoryItemEntity() {
        // JPA
    }

    public InventoryItemEntity(long localId, Instant now, InventoryItemDetails details) {
        super(localId, now);
        this.itemType = details.getItemType();
        applyDetails(details);
    }

    public void updateDetails(InventoryItemDetails details, Instant now) {
        applyDetails(details);
        touch(now);
    }

    /**
     * Applies a signed stock delta. The average price moves only when stock
     * increases and a price is known.
     */
    public void applyMovement(BigDecimal quantityDelta, int bagsDelta, BigDecimal newAveragePrice, Instant now) {
        BigDecimal updated = currentQuantity.add(quantityDelta);
        if (updated.signum() < 0) {
            throw new IllegalStateException(String.format(
                    "Stock of item %d would become negative (%s)", getLocalId(), updated.toPlainString()));
        }
        this.currentQuantity = updated;
        this.currentBags = currentBags + bagsDelta;
        if (newAveragePrice != null) {
            this.averagePricePerKg = newAveragePrice;
        }
        this.lastStockUpdateAt = now;
        touch(now);
    }

    public boolean isLowStock() {
        return currentQuantity.compareTo(minimumStock) <= 0;
    }

    /**
     * Overwrites descriptive fields with the remote version. Quantities are
     * reconciled separately through an adjustment movement.
     */
    public void applyRemote(InventoryItemDetails details, Instant remoteUpdatedAt, Instant now) {
        applyDetails(details);
        acceptRemote(remoteUpdatedAt, now);
    }

    private void applyDetails(InventoryItemDetails details) {
        this.name = details.getName();
        this.variety = details.getVariety();
        this.sellingPricePerKg = details.getSellingPricePerKg();
        this.minimumStock = details.getMinimumStock() != null ? details.getMinimumStock() : BigDecimal.ZERO;
        this.warehouseLocation = details.getWarehouseLocation();
    }
}
