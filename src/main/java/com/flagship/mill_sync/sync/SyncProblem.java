package com.flagship.mill_sync.sync;

import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.queue.MutationOperation;
import com.flagship.mill_sync.queue.MutationRecord;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A FAILED or CONFLICT record as the user sees it. Carries no payload.
 */
@Value
@Builder
public class SyncProblem {
    UUID recordId;
    EntityType entityType;
    long entityId;
    MutationOperation operation;
    SyncStatus status;
    String errorMessage;
    int retryCount;
    Instant createdAt;
    Instant lastAttemptAt;

    public static SyncProblem from(MutationRecord record) {
        return SyncProblem.builder()
                .recordId(record.getId())
                .entityType(record.getEntityType())
                .entityId(record.getEntityId())
                .operation(record.getOperation())
                .status(record.getStatus())
                .errorMessage(record.getErrorMessage())
                .retryCount(record.getRetryCount())
                .createdAt(record.getCreatedAt())
                .lastAttemptAt(record.getLastAttemptAt())
                .build();
    }
}
