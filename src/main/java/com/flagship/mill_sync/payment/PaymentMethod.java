package com.flagship.mill_sync.payment;

public enum PaymentMethod {
    CASH,
    BANK_TRANSFER,
    CHEQUE,
    CREDIT,
    MOBILE
}
