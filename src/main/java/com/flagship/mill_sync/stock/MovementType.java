package com.flagship.mill_sync.stock;

/**
 * Kinds of stock movement. The sign of the delta is carried by the
 * movement itself, the type says why it happened.
 */
public enum MovementType {
    INITIAL,
    STOCK_IN,
    STOCK_OUT,
    REVERSAL_IN,
    REVERSAL_OUT,
    MILLING_IN,
    MILLING_OUT,
    ADJUSTMENT
}
