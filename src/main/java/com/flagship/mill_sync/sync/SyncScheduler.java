package com.flagship.mill_sync.sync;

import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.config.SyncProperties;
import com.flagship.mill_sync.queue.SyncQueueService;
import com.flagship.mill_sync.remote.ConnectivityMonitor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Periodic sync pass while online. A tick requests a pass when records are
 * waiting to be pushed; otherwise only once the pull interval has passed
 * since the last pass, so remote changes still arrive without user action.
 */
@Component
@ConditionalOnProperty(name = "sync.scheduler.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SyncScheduler {

    private final SyncTrigger syncTrigger;
    private final SyncOrchestrator orchestrator;
    private final SyncQueueService syncQueue;
    private final ConnectivityMonitor connectivityMonitor;
    private final SyncProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${sync.poll-interval-ms:300000}",
            initialDelayString = "${sync.poll-interval-ms:300000}")
    public void periodicSync() {
        try {
            tick();
        } catch (Exception e) {
            log.error("Error in periodic sync trigger", e);
        }
    }

    /**
     * @return the trigger reason, or null when no pass was requested
     */
    String tick() {
        if (!connectivityMonitor.isOnline()) {
            return null;
        }
        long pending = syncQueue.countByStatus(SyncStatus.PENDING);
        if (pending > 0) {
            log.debug("Periodic sync tick: pending={}", pending);
            syncTrigger.requestSync("periodic");
            return "periodic";
        }
        if (pullDue()) {
            log.debug("Periodic sync tick: nothing to push, pull due");
            syncTrigger.requestSync("periodic pull");
            return "periodic pull";
        }
        return null;
    }

    private boolean pullDue() {
        Duration interval = Duration.ofMillis(properties.getPullIntervalMs());
        return orchestrator.getLastResult()
                .map(last -> !clock.instant().isBefore(last.getFinishedAt().plus(interval)))
                .orElse(true);
    }
}
