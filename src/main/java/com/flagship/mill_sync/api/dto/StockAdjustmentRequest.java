package com.flagship.mill_sync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Counted stock to correct an item to.
 */
@Value
public class StockAdjustmentRequest {

    @NotNull(message = "Quantity is required")
    @DecimalMin(value = "0", message = "Quantity cannot be negative")
    @JsonProperty("quantity")
    BigDecimal quantity;

    @NotNull(message = "Bags is required")
    @Min(value = 0, message = "Bags cannot be negative")
    @JsonProperty("bags")
    Integer bags;

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    String reason;
}
