package com.flagship.mill_sync.transaction;

import com.flagship.mill_sync.common.LedgerRecord;
import com.flagship.mill_sync.payment.PaymentMethod;
import com.flagship.mill_sync.payment.PaymentStatus;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Buy or sell transaction ledger row.
 *
 * Totals: subtotal = sum of line totals, totalAmount = subtotal - discount,
 * dueAmount = totalAmount - paidAmount.
 */
@Entity
@Table(name = "transactions")
@Getter
public class TransactionEntity extends LedgerRecord {

    @Column(name = "transaction_number", nullable = false, updatable = false, length = 32)
    private String transactionNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, updatable = false, length = 8)
    private TransactionType transactionType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private TransactionStatus status;

    @Column(name = "customer_local_id", nullable = false, updatable = false)
    private long customerLocalId;

    @Column(name = "subtotal", nullable = false, precision = 19, scale = 2)
    private BigDecimal subtotal = BigDecimal.ZERO;

    @Column(name = "discount", nullable = false, precision = 19, scale = 2)
    private BigDecimal discount = BigDecimal.ZERO;

    @Column(name = "total_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalAmount = BigDecimal.ZERO;

    @Column(name = "paid_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal paidAmount = BigDecimal.ZERO;

    @Column(name = "due_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal dueAmount = BigDecimal.ZERO;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 16)
    private PaymentStatus paymentStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, length = 16)
    private PaymentMethod paymentMethod;

    @Column(name = "notes", length = 1000)
    private String notes;

    @Column(name = "cancel_reason", length = 500)
    private String cancelReason;

    @Column(name = "transaction_date", nullable = false)
    private Instant transactionDate;

    @OneToMany(mappedBy = "transaction", cascade = CascadeType.ALL, fetch = FetchType.EAGER, orphanRemoval = true)
    @OrderBy("localId ASC")
    private List<TransactionItemEntity> items = new ArrayList<>();

    protected TransactionEntity() {
        // JPA
    }

    public TransactionEntity(long localId, Instant now, TransactionType type, String transactionNumber,
                             long customerLocalId, PaymentMethod paymentMethod, String notes) {
        super(localId, now);
        this.transactionType = type;
        this.transactionNumber = transactionNumber;
        this.customerLocalId = customerLocalId;
        this.paymentMethod = paymentMethod != null ? paymentMethod : PaymentMethod.CASH;
        this.notes = notes;
        this.status = TransactionStatus.COMPLETED;
        this.paymentStatus = PaymentStatus.PENDING;
        this.transactionDate = now;
    }

    public void addItem(TransactionItemEntity item) {
        item.attachTo(this);
        items.add(item);
    }

    public List<TransactionItemEntity> getItems() {
        return Collections.unmodifiableList(items);
    }

    /**
     * Computes totals from the lines, the discount and the amount paid up front.
     */
    public void settleTotals(BigDecimal discount, BigDecimal paidAmount) {
        this.subtotal = items.stream()
                .map(TransactionItemEntity::getTotalAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        this.discount = discount;
        this.totalAmount = subtotal.subtract(discount);
        this.paidAmount = paidAmount;
        this.dueAmount = totalAmount.subtract(paidAmount);
        this.paymentStatus = PaymentStatus.of(paidAmount, totalAmount);
    }

    public boolean isCancelled() {
        return status == TransactionStatus.CANCELLED;
    }

    public void cancel(String reason, Instant now) {
        if (isCancelled()) {
            throw new IllegalStateException("Transaction " + transactionNumber + " is already cancelled");
        }
        this.status = TransactionStatus.CANCELLED;
        this.paymentStatus = PaymentStatus.CANCELLED;
        this.cancelReason = reason;
        touch(now);
    }

    /**
     * A payment recorded against this transaction. The remote derives the
     * same totals from the synced payment, so no update of the transaction
     * itself is queued.
     */
    public void recordPayment(BigDecimal amount, Instant now) {
        this.paidAmount = paidAmount.add(amount);
        this.dueAmount = totalAmount.subtract(paidAmount);
        this.paymentStatus = PaymentStatus.of(paidAmount, totalAmount);
        stampUpdated(now);
    }

    /**
     * Canonical totals returned by the remote. Null values keep the local ones.
     */
    public void applyCanonicalTotals(BigDecimal total, BigDecimal paid, BigDecimal due, PaymentStatus remoteStatus) {
        if (total != null) {
            this.totalAmount = total;
        }
        if (paid != null) {
            this.paidAmount = paid;
        }
        if (due != null) {
            this.dueAmount = due;
        }
        if (remoteStatus != null && !isCancelled()) {
            this.paymentStatus = remoteStatus;
        }
    }

    /**
     * Settlement and status changes made on the remote.
     */
    public void applyRemote(TransactionStatus remoteStatus, BigDecimal paid, BigDecimal due,
                            PaymentStatus remotePaymentStatus, Instant remoteUpdatedAt, Instant now) {
        if (remoteStatus != null) {
            this.status = remoteStatus;
        }
        applyCanonicalTotals(null, paid, due, remotePaymentStatus);
        if (remoteStatus == TransactionStatus.CANCELLED) {
            this.paymentStatus = PaymentStatus.CANCELLED;
        }
        acceptRemote(remoteUpdatedAt, now);
    }
}
