package com.flagship.mill_sync.queue.payload;

import com.flagship.mill_sync.inventory.ItemType;
import com.flagship.mill_sync.transaction.TransactionItemEntity;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class TransactionLinePayload {
    long lineLocalId;
    long inventoryItemLocalId;
    ItemType itemType;
    String variety;
    int bags;
    BigDecimal quantity;
    BigDecimal pricePerKg;
    BigDecimal totalAmount;

    public static TransactionLinePayload from(TransactionItemEntity line) {
        return new TransactionLinePayload(
                line.getLocalId(),
                line.getInventoryItemLocalId(),
                line.getItemType(),
                line.getVariety(),
                line.getBags(),
                line.getQuantity(),
                line.getPricePerKg(),
                line.getTotalAmount());
    }
}
