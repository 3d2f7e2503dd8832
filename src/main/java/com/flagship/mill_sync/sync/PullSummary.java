package com.flagship.mill_sync.sync;

import lombok.Value;

@Value
public class PullSummary {
    int applied;
    boolean authRequired;

    public static PullSummary empty() {
        return new PullSummary(0, false);
    }
}
