package com.flagship.mill_sync.queue;

import java.time.Duration;

/**
 * Exponential backoff for transient sync failures:
 * {@code clamp(2^retryCount, 1, 60)} minutes.
 */
public final class BackoffPolicy {

    public static final long MIN_DELAY_MINUTES = 1;
    public static final long MAX_DELAY_MINUTES = 60;

    private BackoffPolicy() {
    }

    public static Duration delayFor(int retryCount) {
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0: " + retryCount);
        }
        // 2^6 already exceeds the cap
        long minutes = retryCount >= 6 ? MAX_DELAY_MINUTES : 1L << retryCount;
        return Duration.ofMinutes(Math.max(MIN_DELAY_MINUTES, Math.min(MAX_DELAY_MINUTES, minutes)));
    }
}
