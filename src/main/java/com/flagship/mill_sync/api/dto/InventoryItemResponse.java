package com.flagship.mill_sync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.inventory.InventoryItemEntity;
import com.flagship.mill_sync.inventory.ItemType;
import com.flagship.mill_sync.stock.StockMovement;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
@Builder
public class InventoryItemResponse {

    @JsonProperty("local_id")
    long localId;

    @JsonProperty("server_id")
    String serverId;

    @JsonProperty("item_type")
    ItemType itemType;

    @JsonProperty("name")
    String name;

    @JsonProperty("variety")
    String variety;

    @JsonProperty("current_quantity")
    BigDecimal currentQuantity;

    @JsonProperty("current_bags")
    int currentBags;

    @JsonProperty("average_price_per_kg")
    BigDecimal averagePricePerKg;

    @JsonProperty("selling_price_per_kg")
    BigDecimal sellingPricePerKg;

    @JsonProperty("minimum_stock")
    BigDecimal minimumStock;

    @JsonProperty("low_stock")
    boolean lowStock;

    @JsonProperty("warehouse_location")
    String warehouseLocation;

    @JsonProperty("sync_status")
    SyncStatus syncStatus;

    @JsonProperty("last_stock_update_at")
    Instant lastStockUpdateAt;

    @JsonProperty("movements")
    List<StockMovementResponse> movements;

    public static InventoryItemResponse from(InventoryItemEntity item) {
        return from(item, null);
    }

    /**
     * @param movements the item's stock history, or null to leave it out
     */
    public static InventoryItemResponse from(InventoryItemEntity item, List<StockMovement> movements) {
        return InventoryItemResponse.builder()
                .localId(item.getLocalId())
                .serverId(item.getServerId())
                .itemType(item.getItemType())
                .name(item.getName())
                .variety(item.getVariety())
                .currentQuantity(item.getCurrentQuantity())
                .currentBags(item.getCurrentBags())
                .averagePricePerKg(item.getAveragePricePerKg())
                .sellingPricePerKg(item.getSellingPricePerKg())
                .minimumStock(item.getMinimumStock())
                .lowStock(item.isLowStock())
                .warehouseLocation(item.getWarehouseLocation())
                .syncStatus(item.getSyncStatus())
                .lastStockUpdateAt(item.getLastStockUpdateAt())
                .movements(movements == null ? null : movements.stream().map(StockMovementResponse::from).toList())
                .build();
    }
}
