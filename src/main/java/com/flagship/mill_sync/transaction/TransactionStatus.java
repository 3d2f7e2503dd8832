package com.flagship.mill_sync.transaction;

public enum TransactionStatus {
    PENDING,
    COMPLETED,
    CANCELLED
}
