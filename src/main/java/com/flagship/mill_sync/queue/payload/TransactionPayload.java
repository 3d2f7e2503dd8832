package com.flagship.mill_sync.queue.payload;

import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.payment.PaymentMethod;
import com.flagship.mill_sync.payment.PaymentStatus;
import com.flagship.mill_sync.transaction.TransactionEntity;
import com.flagship.mill_sync.transaction.TransactionStatus;
import com.flagship.mill_sync.transaction.TransactionType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Value
public class TransactionPayload implements MutationPayload {
    String transactionNumber;
    TransactionType transactionType;
    TransactionStatus status;
    long customerLocalId;
    List<TransactionLinePayload> lines;
    BigDecimal subtotal;
    BigDecimal discount;
    BigDecimal totalAmount;
    BigDecimal paidAmount;
    BigDecimal dueAmount;
    PaymentStatus paymentStatus;
    PaymentMethod paymentMethod;
    String notes;
    Instant transactionDate;

    public static TransactionPayload from(TransactionEntity transaction) {
        return new TransactionPayload(
                transaction.getTransactionNumber(),
                transaction.getTransactionType(),
                transaction.getStatus(),
                transaction.getCustomerLocalId(),
                transaction.getItems().stream().map(TransactionLinePayload::from).toList(),
                transaction.getSubtotal(),
                transaction.getDiscount(),
                transaction.getTotalAmount(),
                transaction.getPaidAmount(),
                transaction.getDueAmount(),
                transaction.getPaymentStatus(),
                transaction.getPaymentMethod(),
                transaction.getNotes(),
                transaction.getTransactionDate());
    }

    @Override
    public List<EntityRef> references() {
        Set<EntityRef> refs = new LinkedHashSet<>();
        refs.add(EntityRef.of(EntityType.CUSTOMER, customerLocalId));
        for (TransactionLinePayload line : lines) {
            refs.add(EntityRef.of(EntityType.INVENTORY, line.getInventoryItemLocalId()));
        }
        return new ArrayList<>(refs);
    }
}
