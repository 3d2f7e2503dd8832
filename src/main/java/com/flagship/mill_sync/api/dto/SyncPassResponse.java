package com.flagship.mill_sync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mill_sync.sync.SyncPassResult;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class SyncPassResponse {

    @JsonProperty("pass_id")
    String passId;

    @JsonProperty("started_at")
    Instant startedAt;

    @JsonProperty("finished_at")
    Instant finishedAt;

    @JsonProperty("attempted")
    int attempted;

    @JsonProperty("succeeded")
    int succeeded;

    @JsonProperty("retried")
    int retried;

    @JsonProperty("failed")
    int failed;

    @JsonProperty("conflicted")
    int conflicted;

    @JsonProperty("deferred")
    int deferred;

    @JsonProperty("repaired")
    int repaired;

    @JsonProperty("pulled")
    int pulled;

    @JsonProperty("auth_required")
    boolean authRequired;

    @JsonProperty("cancelled")
    boolean cancelled;

    @JsonProperty("skipped_reason")
    String skippedReason;

    @JsonProperty("error")
    String error;

    public static SyncPassResponse from(SyncPassResult result) {
        if (result == null) {
            return null;
        }
        return SyncPassResponse.builder()
                .passId(result.getPassId())
                .startedAt(result.getStartedAt())
                .finishedAt(result.getFinishedAt())
                .attempted(result.getAttempted())
                .succeeded(result.getSucceeded())
                .retried(result.getRetried())
                .failed(result.getFailed())
                .conflicted(result.getConflicted())
                .deferred(result.getDeferred())
                .repaired(result.getRepaired())
                .pulled(result.getPulled())
                .authRequired(result.isAuthRequired())
                .cancelled(result.isCancelled())
                .skippedReason(result.getSkippedReason())
                .error(result.getError())
                .build();
    }
}
