package com.flagship.mill_sync.transaction;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class LineItemCommand {
    long inventoryItemId;
    BigDecimal quantity;
    int bags;
    BigDecimal pricePerKg;
}
