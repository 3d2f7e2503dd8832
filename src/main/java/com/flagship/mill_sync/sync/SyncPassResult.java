package com.flagship.mill_sync.sync;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Summary of one sync pass.
 *
 * {@code failed} counts records that reached FAILED in this pass;
 * {@code retried} those sent back to PENDING with a backoff window.
 */
@Value
@Builder(toBuilder = true)
public class SyncPassResult {
    String passId;
    Instant startedAt;
    Instant finishedAt;
    int attempted;
    int succeeded;
    int retried;
    int failed;
    int conflicted;
    int deferred;
    int repaired;
    int pulled;
    boolean authRequired;
    boolean cancelled;
    /** Why the pass did not run, or null if it ran. */
    String skippedReason;
    /** Unexpected error that ended the pass early, or null. */
    String error;

    public static SyncPassResult skipped(String reason, Instant now) {
        return SyncPassResult.builder()
                .startedAt(now)
                .finishedAt(now)
                .skippedReason(reason)
                .build();
    }

    public boolean isSkipped() {
        return skippedReason != null;
    }
}
