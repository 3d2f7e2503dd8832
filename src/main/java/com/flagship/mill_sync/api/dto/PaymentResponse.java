package com.flagship.mill_sync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.payment.PaymentEntity;
import com.flagship.mill_sync.payment.PaymentMethod;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class PaymentResponse {

    @JsonProperty("local_id")
    long localId;

    @JsonProperty("server_id")
    String serverId;

    @JsonProperty("transaction_id")
    long transactionId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("sync_status")
    SyncStatus syncStatus;

    @JsonProperty("paid_at")
    Instant paidAt;

    public static PaymentResponse from(PaymentEntity payment) {
        return PaymentResponse.builder()
                .localId(payment.getLocalId())
                .serverId(payment.getServerId())
                .transactionId(payment.getTransactionLocalId())
                .amount(payment.getAmount())
                .paymentMethod(payment.getPaymentMethod())
                .notes(payment.getNotes())
                .syncStatus(payment.getSyncStatus())
                .paidAt(payment.getPaidAt())
                .build();
    }
}
