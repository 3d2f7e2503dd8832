package com.flagship.mill_sync.transaction;

/**
 * BUY: the mill buys from a customer and stock comes in.
 * SELL: the mill sells to a customer and stock goes out.
 */
public enum TransactionType {
    BUY,
    SELL
}
