package com.flagship.mill_sync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mill_sync.inventory.InventoryItemDetails;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Descriptive fields only; stock changes go through adjustments.
 */
@Value
public class UpdateInventoryItemRequest {

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

    public InventoryItemDetails toDetails() {
        return InventoryItemDetails.builder()
                .name(name)
                .variety(variety)
                .sellingPricePerKg(sellingPricePerKg)
                .minimumStock(minimumStock)
                .warehouseLocation(warehouseLocation)
                .build();
    }
}
