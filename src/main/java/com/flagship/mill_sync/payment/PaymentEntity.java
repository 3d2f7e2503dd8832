package com.flagship.mill_sync.payment;

import com.flagship.mill_sync.common.LedgerRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A payment made against a transaction after it was recorded.
 *
 * No @Setter: a payment is immutable once written, only its sync metadata
 * changes.
 */
@Entity
@Table(name = "transaction_payments")
@Getter
public class PaymentEntity extends LedgerRecord {

    @Column(name = "transaction_local_id", nullable = false, updatable = false)
    private long transactionLocalId;

    @Column(name = "amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, updatable = false, length = 16)
    private PaymentMethod paymentMethod;

    @Column(name = "notes", length = 500)
    private String notes;

    @Column(name = "paid_at", nullable = false, updatable = false)
    private Instant paidAt;

    protected PaymentEntity() {
        // JPA
    }

    public PaymentEntity(long localId, Instant now, long transactionLocalId, BigDecimal amount,
                         PaymentMethod paymentMethod, String notes) {
        super(localId, now);
        this.transactionLocalId = transactionLocalId;
        this.amount = amount;
        this.paymentMethod = paymentMethod != null ? paymentMethod : PaymentMethod.CASH;
        this.notes = notes;
        this.paidAt = now;
    }
}
