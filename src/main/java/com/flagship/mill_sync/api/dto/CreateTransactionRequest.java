package com.flagship.mill_sync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mill_sync.payment.PaymentMethod;
import com.flagship.mill_sync.transaction.CreateTransactionCommand;
import com.flagship.mill_sync.transaction.LineItemCommand;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Body of buy and sell calls.
 */
@Value
public class CreateTransactionRequest {

    @NotNull(message = "Customer ID is required")
    @JsonProperty("customer_id")
    Long customerId;

    @NotEmpty(message = "At least one item is required")
    @Valid
    @JsonProperty("items")
    List<Item> items;

    @DecimalMin(value = "0", message = "Discount cannot be negative")
    @JsonProperty("discount")
    BigDecimal discount;

    @DecimalMin(value = "0", message = "Paid amount cannot be negative")
    @JsonProperty("paid_amount")
    BigDecimal paidAmount;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("notes")
    String notes;

    public CreateTransactionCommand toCommand() {
        CreateTransactionCommand.CreateTransactionCommandBuilder builder = CreateTransactionCommand.builder()
                .customerId(customerId)
                .discount(discount)
                .paidAmount(paidAmount)
                .paymentMethod(paymentMethod)
                .notes(notes);
        for (Item item : items) {
            builder.line(new LineItemCommand(item.getInventoryItemId(), item.getQuantity(),
                    item.getBags() == null ? 0 : item.getBags(), item.getPricePerKg()));
        }
        return builder.build();
    }

    @Value
    public static class Item {

        @NotNull(message = "Inventory item ID is required")
        @JsonProperty("inventory_item_id")
        Long inventoryItemId;

        @NotNull(message = "Quantity is required")
        @DecimalMin(value = "0.001", message = "Quantity must be greater than 0")
        @JsonProperty("quantity")
        BigDecimal quantity;

        @Min(value = 0, message = "Bags cannot be negative")
        @JsonProperty("bags")
        Integer bags;

        @NotNull(message = "Price per kg is required")
        @DecimalMin(value = "0", message = "Price cannot be negative")
        @JsonProperty("price_per_kg")
        BigDecimal pricePerKg;
    }
}
