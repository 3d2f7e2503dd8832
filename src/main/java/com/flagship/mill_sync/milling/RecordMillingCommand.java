package com.flagship.mill_sync.milling;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class RecordMillingCommand {
    long paddyItemId;
    long riceItemId;
    BigDecimal paddyQuantity;
    BigDecimal riceQuantity;
    int paddyBags;
    int riceBags;
    String notes;
}
