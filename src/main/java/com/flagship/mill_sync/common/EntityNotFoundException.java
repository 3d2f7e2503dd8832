package com.flagship.mill_sync.common;

public class EntityNotFoundException extends RuntimeException {

    public EntityNotFoundException(EntityType type, long localId) {
        super(String.format("%s %d not found", type, localId));
    }

    public EntityNotFoundException(String message) {
        super(message);
    }
}
