package com.flagship.mill_sync.inventory;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Descriptive inventory fields. The item type is fixed at creation.
 */
@Value
@Builder
public class InventoryItemDetails {
    ItemType itemType;
    String name;
    String variety;
    BigDecimal sellingPricePerKg;
    BigDecimal minimumStock;
    String warehouseLocation;
}
