package com.flagship.mill_sync.common;

import lombok.Value;

/**
 * Reference to one ledger row by its device-local identity.
 *
 * Used as the serialization key for per-entity ordering in the sync queue,
 * and stored in text form ({@code TYPE:localId}) for record dependencies.
 */
@Value
public class EntityRef {
    EntityType type;
    long localId;

    public static EntityRef of(EntityType type, long localId) {
        return new EntityRef(type, localId);
    }

    public static EntityRef parse(String value) {
        int separator = value.indexOf(':');
        if (separator <= 0) {
            throw new IllegalArgumentException("Malformed entity reference: " + value);
        }
        return new EntityRef(
                EntityType.valueOf(value.substring(0, separator)),
                Long.parseLong(value.substring(separator + 1)));
    }

    public String format() {
        return type.name() + ":" + localId;
    }

    @Override
    public String toString() {
        return format();
    }
}
