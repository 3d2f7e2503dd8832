package com.flagship.mill_sync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.stock.MovementType;
import com.flagship.mill_sync.stock.StockMovement;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class StockMovementResponse {

    @JsonProperty("local_id")
    long localId;

    @JsonProperty("server_id")
    String serverId;

    @JsonProperty("inventory_item_id")
    long inventoryItemId;

    @JsonProperty("movement_type")
    MovementType movementType;

    @JsonProperty("quantity_delta")
    BigDecimal quantityDelta;

    @JsonProperty("bags_delta")
    int bagsDelta;

    @JsonProperty("price_per_kg")
    BigDecimal pricePerKg;

    @JsonProperty("reference_type")
    String referenceType;

    @JsonProperty("reference_id")
    Long referenceId;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("sync_status")
    SyncStatus syncStatus;

    @JsonProperty("created_at")
    Instant createdAt;

    public static StockMovementResponse from(StockMovement movement) {
        return StockMovementResponse.builder()
                .localId(movement.getLocalId())
                .serverId(movement.getServerId())
                .inventoryItemId(movement.getInventoryItemLocalId())
                .movementType(movement.getMovementType())
                .quantityDelta(movement.getQuantityDelta())
                .bagsDelta(movement.getBagsDelta())
                .pricePerKg(movement.getPricePerKg())
                .referenceType(movement.getReference() == null ? null : movement.getReference().getType().name())
                .referenceId(movement.getReference() == null ? null : movement.getReference().getLocalId())
                .reason(movement.getReason())
                .syncStatus(movement.getSyncStatus())
                .createdAt(movement.getCreatedAt())
                .build();
    }
}
