package com.flagship.mill_sync.common;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Requested quantity exceeds the stock currently on hand for an item.
 */
@Getter
public class InsufficientStockException extends ValidationException {

    private final long inventoryItemId;
    private final BigDecimal available;
    private final BigDecimal requested;

    public InsufficientStockException(long inventoryItemId, String itemName,
                                      BigDecimal available, BigDecimal requested) {
        super(String.format("Insufficient stock for %s (item %d): available %s kg, requested %s kg",
                itemName, inventoryItemId, available.toPlainString(), requested.toPlainString()));
        this.inventoryItemId = inventoryItemId;
        this.available = available;
        this.requested = requested;
    }
}
