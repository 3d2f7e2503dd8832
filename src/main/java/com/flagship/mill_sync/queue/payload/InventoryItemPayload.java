package com.flagship.mill_sync.queue.payload;

import com.flagship.mill_sync.inventory.InventoryItemEntity;
import com.flagship.mill_sync.inventory.ItemType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Descriptive fields of an inventory item. Quantities travel as stock
 * movements, never in this snapshot.
 */
@Value
public class InventoryItemPayload implements MutationPayload {
    ItemType itemType;
    String name;
    String variety;
    BigDecimal averagePricePerKg;
    BigDecimal sellingPricePerKg;
    BigDecimal minimumStock;
    String warehouseLocation;
    Instant updatedAt;

    public static InventoryItemPayload from(InventoryItemEntity item) {
        return new InventoryItemPayload(
                item.getItemType(),
                item.getName(),
                item.getVariety(),
                item.getAveragePricePerKg(),
                item.getSellingPricePerKg(),
                item.getMinimumStock(),
                item.getWarehouseLocation(),
                item.getUpdatedAt());
    }

    @Override
    public boolean isSnapshot() {
        return true;
    }
}
