package com.flagship.mill_sync.stock;

import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.SyncStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One append-only entry of the stock ledger.
 */
@Value
public class StockMovement {
    long localId;
    String serverId;
    long inventoryItemLocalId;
    MovementType movementType;
    BigDecimal quantityDelta;
    int bagsDelta;
    BigDecimal pricePerKg;
    EntityRef reference;
    String reason;
    SyncStatus syncStatus;
    Instant createdAt;

    public boolean isIncrease() {
        return quantityDelta.signum() > 0;
    }
}
