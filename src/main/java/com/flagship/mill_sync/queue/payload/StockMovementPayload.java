package com.flagship.mill_sync.queue.payload;

import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.stock.MovementType;
import com.flagship.mill_sync.stock.StockMovement;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * One signed stock delta, queued as an update of the inventory item so it
 * is ordered with every other change to that item.
 */
@Value
public class StockMovementPayload implements MutationPayload {
    long movementLocalId;
    MovementType movementType;
    BigDecimal quantityDelta;
    int bagsDelta;
    BigDecimal pricePerKg;
    EntityRef reference;
    String reason;
    Instant occurredAt;

    public static StockMovementPayload from(StockMovement movement) {
        return new StockMovementPayload(
                movement.getLocalId(),
                movement.getMovementType(),
                movement.getQuantityDelta(),
                movement.getBagsDelta(),
                movement.getPricePerKg(),
                movement.getReference(),
                movement.getReason(),
                movement.getCreatedAt());
    }

    @Override
    public List<EntityRef> references() {
        return reference == null ? List.of() : List.of(reference);
    }
}
