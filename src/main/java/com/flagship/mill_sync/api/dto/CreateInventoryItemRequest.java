package com.flagship.mill_sync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mill_sync.inventory.InventoryItemDetails;
import com.flagship.mill_sync.inventory.ItemType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * New inventory item with optional opening stock.
 */
@Value
public class CreateInventoryItemRequest {

    @NotNull(message = "Item type is required")
    @JsonProperty("item_type")
    ItemType itemType;

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @JsonProperty("variety")
    String variety;

    @DecimalMin(value = "0", message = "Selling price cannot be negative")
    @JsonProperty("selling_price_per_kg")
    BigDecimal sellingPricePerKg;

    @DecimalMin(value = "0", message = "Minimum stock cannot be negative")
    @JsonProperty("minimum_stock")
    BigDecimal minimumStock;

    @JsonProperty("warehouse_location")
    String warehouseLocation;

    @DecimalMin(value = "0", message = "Opening quantity cannot be negative")
    @JsonProperty("opening_quantity")
    BigDecimal openingQuantity;

    @Min(value = 0, message = "Opening bags cannot be negative")
    @JsonProperty("opening_bags")
    Integer openingBags;

    @DecimalMin(value = "0", message = "Opening price cannot be negative")
    @JsonProperty("opening_price_per_kg")
    BigDecimal openingPricePerKg;

    public InventoryItemDetails toDetails() {
        return InventoryItemDetails.builder()
                .itemType(itemType)
                .name(name)
                .variety(variety)
                .sellingPricePerKg(sellingPricePerKg)
                .minimumStock(minimumStock)
                .warehouseLocation(warehouseLocation)
                .build();
    }

    public int openingBagsOrZero() {
        return openingBags == null ? 0 : openingBags;
    }
}
