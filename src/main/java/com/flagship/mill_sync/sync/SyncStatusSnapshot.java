package com.flagship.mill_sync.sync;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * What the shell shows as the sync indicator.
 */
@Value
@Builder
public class SyncStatusSnapshot {
    long pending;
    long failed;
    long conflicts;
    boolean online;
    boolean passRunning;
    Instant lastPullAt;
    SyncPassResult lastPass;
}
