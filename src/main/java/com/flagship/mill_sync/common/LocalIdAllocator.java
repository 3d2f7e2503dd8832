package com.flagship.mill_sync.common;

/**
 * Source of device-local monotonic identities. Ids are assigned before any
 * server identity exists and stay stable for the lifetime of the row.
 */
public interface LocalIdAllocator {

    long nextId();
}
