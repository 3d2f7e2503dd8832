package com.flagship.mill_sync.common;

/**
 * Kinds of entities that carry mutation records.
 */
public enum EntityType {
    CUSTOMER,
    INVENTORY,
    TRANSACTION,
    PAYMENT,
    MILLING,
    USER
}
