package com.flagship.mill_sync.payment;

import java.math.BigDecimal;

/**
 * Settlement state of a transaction.
 */
public enum PaymentStatus {
    PENDING,
    PARTIAL,
    COMPLETED,
    CANCELLED;

    public static PaymentStatus of(BigDecimal paid, BigDecimal total) {
        if (paid.signum() <= 0) {
            return total.signum() <= 0 ? COMPLETED : PENDING;
        }
        return paid.compareTo(total) >= 0 ? COMPLETED : PARTIAL;
    }
}
