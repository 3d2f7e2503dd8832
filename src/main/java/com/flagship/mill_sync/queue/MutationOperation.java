package com.flagship.mill_sync.queue;

public enum MutationOperation {
    CREATE,
    UPDATE,
    DELETE
}
