package com.flagship.mill_sync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mill_sync.milling.RecordMillingCommand;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Paddy consumed and rice produced by one milling run.
 */
@Value
public class RecordMillingRequest {

    @NotNull(message = "Paddy item ID is required")
    @JsonProperty("paddy_item_id")
    Long paddyItemId;

    @NotNull(message = "Rice item ID is required")
    @JsonProperty("rice_item_id")
    Long riceItemId;

    @NotNull(message = "Paddy quantity is required")
    @DecimalMin(value = "0.001", message = "Paddy quantity must be greater than 0")
    @JsonProperty("paddy_quantity")
    BigDecimal paddyQuantity;

    @NotNull(message = "Rice quantity is required")
    @DecimalMin(value = "0.001", message = "Rice quantity must be greater than 0")
    @JsonProperty("rice_quantity")
    BigDecimal riceQuantity;

    @Min(value = 0, message = "Paddy bags cannot be negative")
    @JsonProperty("paddy_bags")
    Integer paddyBags;

    @Min(value = 0, message = "Rice bags cannot be negative")
    @JsonProperty("rice_bags")
    Integer riceBags;

    @JsonProperty("notes")
    String notes;

    public RecordMillingCommand toCommand() {
        return RecordMillingCommand.builder()
                .paddyItemId(paddyItemId)
                .riceItemId(riceItemId)
                .paddyQuantity(paddyQuantity)
                .riceQuantity(riceQuantity)
                .paddyBags(paddyBags == null ? 0 : paddyBags)
                .riceBags(riceBags == null ? 0 : riceBags)
                .notes(notes)
                .build();
    }
}
