package com.flagship.mill_sync.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the cached queue gauges.
 */
@Component
@RequiredArgsConstructor
public class MetricsScheduler {

    private final SyncMetrics syncMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshSyncMetrics() {
        syncMetrics.refreshMetrics();
    }
}
