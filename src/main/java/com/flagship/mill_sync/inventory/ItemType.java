package com.flagship.mill_sync.inventory;

public enum ItemType {
    PADDY,
    RICE,
    BRAN,
    HUSK
}
