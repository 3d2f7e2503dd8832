package com.flagship.mill_sync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mill_sync.sync.SyncStatusSnapshot;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class SyncStatusResponse {

    @JsonProperty("pending")
    long pending;

    @JsonProperty("failed")
    long failed;

    @JsonProperty("conflicts")
    long conflicts;

    @JsonProperty("online")
    boolean online;

    @JsonProperty("pass_running")
    boolean passRunning;

    @JsonProperty("last_pull_at")
    Instant lastPullAt;

    @JsonProperty("last_pass")
    SyncPassResponse lastPass;

    public static SyncStatusResponse from(SyncStatusSnapshot snapshot) {
        return SyncStatusResponse.builder()
                .pending(snapshot.getPending())
                .failed(snapshot.getFailed())
                .conflicts(snapshot.getConflicts())
                .online(snapshot.isOnline())
                .passRunning(snapshot.isPassRunning())
                .lastPullAt(snapshot.getLastPullAt())
                .lastPass(SyncPassResponse.from(snapshot.getLastPass()))
                .build();
    }
}
