package com.flagship.mill_sync.observability;

import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.queue.SyncQueueService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the sync queue and sync passes.
 *
 * Gauges read cached values that {@link MetricsScheduler} refreshes, so a
 * scrape never queries the store.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SyncMetrics {

    private final SyncQueueService syncQueue;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestRecordAgeSeconds = new AtomicLong(0);
    private final AtomicLong failedCount = new AtomicLong(0);
    private final AtomicLong conflictCount = new AtomicLong(0);

    private Timer passTimer;

    @PostConstruct
    public void init() {
        Gauge.builder("sync.queue.backlog.size", backlogSize, AtomicLong::get)
                .description("Mutation records not yet synced")
                .tag("status", "pending")
                .register(meterRegistry);

        Gauge.builder("sync.queue.backlog.age.seconds", oldestRecordAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unsynced mutation record in seconds")
                .register(meterRegistry);

        Gauge.builder("sync.queue.failed", failedCount, AtomicLong::get)
                .description("Records that exhausted their retries")
                .tag("status", "failed")
                .register(meterRegistry);

        Gauge.builder("sync.queue.conflicts", conflictCount, AtomicLong::get)
                .description("Records rejected by the remote and waiting for the user")
                .tag("status", "conflict")
                .register(meterRegistry);

        passTimer = Timer.builder("sync.pass.duration")
                .description("Duration of one sync pass")
                .publishPercentiles(0.5, 0.95)
                .register(meterRegistry);

        log.info("Sync metrics registered with Micrometer");
    }

    public void refreshMetrics() {
        try {
            long pending = syncQueue.countPending();
            backlogSize.set(pending);

            syncQueue.oldestOutstandingCreatedAt()
                    .ifPresentOrElse(
                            oldest -> oldestRecordAgeSeconds.set(
                                    Math.max(0, Duration.between(oldest, clock.instant()).getSeconds())),
                            () -> oldestRecordAgeSeconds.set(0));

            failedCount.set(syncQueue.countByStatus(SyncStatus.FAILED));
            conflictCount.set(syncQueue.countByStatus(SyncStatus.CONFLICT));

            log.debug("Sync metrics refreshed: backlog={}, oldestAge={}s, failed={}, conflicts={}",
                    pending, oldestRecordAgeSeconds.get(), failedCount.get(), conflictCount.get());

        } catch (Exception e) {
            log.warn("Failed to refresh sync metrics: {}", e.getMessage());
        }
    }

    /**
     * Counts one record outcome: synced, retried, failed, conflict, deferred
     * or released.
     */
    public void recordProcessed(EntityType entityType, String outcome) {
        meterRegistry.counter("sync.mutations.processed",
                "entity_type", entityType.name(),
                "outcome", outcome
        ).increment();
    }

    public void recordPassDuration(Duration duration) {
        passTimer.record(duration);
    }

    public long getBacklogSize() {
        return backlogSize.get();
    }
}
