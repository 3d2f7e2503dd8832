package com.flagship.mill_sync.queue.payload;

import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.payment.PaymentEntity;
import com.flagship.mill_sync.payment.PaymentMethod;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
public class PaymentPayload implements MutationPayload {
    long transactionLocalId;
    BigDecimal amount;
    PaymentMethod paymentMethod;
    String notes;
    Instant paidAt;

    public static PaymentPayload from(PaymentEntity payment) {
        return new PaymentPayload(
                payment.getTransactionLocalId(),
                payment.getAmount(),
                payment.getPaymentMethod(),
                payment.getNotes(),
                payment.getPaidAt());
    }

    @Override
    public List<EntityRef> references() {
        return List.of(EntityRef.of(EntityType.TRANSACTION, transactionLocalId));
    }
}
