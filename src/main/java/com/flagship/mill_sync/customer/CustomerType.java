package com.flagship.mill_sync.customer;

public enum CustomerType {
    FARMER,
    TRADER,
    RETAILER,
    WHOLESALER,
    BUYER,
    SELLER,
    BOTH,
    OTHER
}
