package com.flagship.mill_sync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.inventory.ItemType;
import com.flagship.mill_sync.payment.PaymentMethod;
import com.flagship.mill_sync.payment.PaymentStatus;
import com.flagship.mill_sync.transaction.TransactionEntity;
import com.flagship.mill_sync.transaction.TransactionItemEntity;
import com.flagship.mill_sync.transaction.TransactionStatus;
import com.flagship.mill_sync.transaction.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("local_id")
    long localId;

    @JsonProperty("server_id")
    String serverId;

    @JsonProperty("transaction_number")
    String transactionNumber;

    @JsonProperty("transaction_type")
    TransactionType transactionType;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("customer_id")
    long customerId;

    @JsonProperty("items")
    List<Item> items;

    @JsonProperty("subtotal")
    BigDecimal subtotal;

    @JsonProperty("discount")
    BigDecimal discount;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("paid_amount")
    BigDecimal paidAmount;

    @JsonProperty("due_amount")
    BigDecimal dueAmount;

    @JsonProperty("payment_status")
    PaymentStatus paymentStatus;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("cancel_reason")
    String cancelReason;

    @JsonProperty("sync_status")
    SyncStatus syncStatus;

    @JsonProperty("transaction_date")
    Instant transactionDate;

    public static TransactionResponse from(TransactionEntity transaction) {
        return TransactionResponse.builder()
                .localId(transaction.getLocalId())
                .serverId(transaction.getServerId())
                .transactionNumber(transaction.getTransactionNumber())
                .transactionType(transaction.getTransactionType())
                .status(transaction.getStatus())
                .customerId(transaction.getCustomerLocalId())
                .items(transaction.getItems().stream().map(Item::from).toList())
                .subtotal(transaction.getSubtotal())
                .discount(transaction.getDiscount())
                .totalAmount(transaction.getTotalAmount())
                .paidAmount(transaction.getPaidAmount())
                .dueAmount(transaction.getDueAmount())
                .paymentStatus(transaction.getPaymentStatus())
                .paymentMethod(transaction.getPaymentMethod())
                .notes(transaction.getNotes())
                .cancelReason(transaction.getCancelReason())
                .syncStatus(transaction.getSyncStatus())
                .transactionDate(transaction.getTransactionDate())
                .build();
    }

    @Value
    @Builder
    public static class Item {

        @JsonProperty("local_id")
        long localId;

        @JsonProperty("server_id")
        String serverId;

        @JsonProperty("inventory_item_id")
        long inventoryItemId;

        @JsonProperty("item_type")
        ItemType itemType;

        @JsonProperty("variety")
        String variety;

        @JsonProperty("bags")
        int bags;

        @JsonProperty("quantity")
        BigDecimal quantity;

        @JsonProperty("price_per_kg")
        BigDecimal pricePerKg;

        @JsonProperty("total_amount")
        BigDecimal totalAmount;

        static Item from(TransactionItemEntity item) {
            return Item.builder()
                    .localId(item.getLocalId())
                    .serverId(item.getServerId())
                    .inventoryItemId(item.getInventoryItemLocalId())
                    .itemType(item.getItemType())
                    .variety(item.getVariety())
                    .bags(item.getBags())
                    .quantity(item.getQuantity())
                    .pricePerKg(item.getPricePerKg())
                    .totalAmount(item.getTotalAmount())
                    .build();
        }
    }
}
