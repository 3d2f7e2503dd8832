package com.flagship.mill_sync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.queue.MutationOperation;
import com.flagship.mill_sync.sync.SyncProblem;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class SyncProblemResponse {

    @JsonProperty("record_id")
    UUID recordId;

    @JsonProperty("entity_type")
    EntityType entityType;

    @JsonProperty("entity_id")
    long entityId;

    @JsonProperty("operation")
    MutationOperation operation;

    @JsonProperty("status")
    SyncStatus status;

    @JsonProperty("error_message")
    String errorMessage;

    @JsonProperty("retry_count")
    int retryCount;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("last_attempt_at")
    Instant lastAttemptAt;

    public static SyncProblemResponse from(SyncProblem problem) {
        return SyncProblemResponse.builder()
                .recordId(problem.getRecordId())
                .entityType(problem.getEntityType())
                .entityId(problem.getEntityId())
                .operation(problem.getOperation())
                .status(problem.getStatus())
                .errorMessage(problem.getErrorMessage())
                .retryCount(problem.getRetryCount())
                .createdAt(problem.getCreatedAt())
                .lastAttemptAt(problem.getLastAttemptAt())
                .build();
    }
}
