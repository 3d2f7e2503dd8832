package com.flagship.mill_sync.observability;

import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.queue.SyncQueueService;
import com.flagship.mill_sync.remote.ConnectivityMonitor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicators for the sync engine.
 */
public class HealthIndicators {

    /**
     * Unhealthy when the backlog grows too large or too many records wait
     * for the user.
     */
    @Component("syncQueueHealth")
    public static class SyncQueueHealthIndicator implements HealthIndicator {

        static final long BACKLOG_WARNING_THRESHOLD = 1000;
        static final long BACKLOG_CRITICAL_THRESHOLD = 10000;
        static final long CONFLICT_CRITICAL_THRESHOLD = 50;

        private final SyncQueueService syncQueue;

        public SyncQueueHealthIndicator(SyncQueueService syncQueue) {
            this.syncQueue = syncQueue;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = syncQueue.countPending();
                long conflicts = syncQueue.countByStatus(SyncStatus.CONFLICT);
                long failed = syncQueue.countByStatus(SyncStatus.FAILED);

                Health.Builder builder = backlogSize >= BACKLOG_CRITICAL_THRESHOLD
                        || conflicts >= CONFLICT_CRITICAL_THRESHOLD
                        ? Health.down()
                        : backlogSize >= BACKLOG_WARNING_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.up();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("failed", failed)
                        .withDetail("conflicts", conflicts)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * Reports the last connectivity state from the shell. Being offline is
     * a normal state for this app, so it never reports DOWN.
     */
    @Component("connectivityHealth")
    public static class ConnectivityHealthIndicator implements HealthIndicator {

        private final ConnectivityMonitor connectivityMonitor;

        public ConnectivityHealthIndicator(ConnectivityMonitor connectivityMonitor) {
            this.connectivityMonitor = connectivityMonitor;
        }

        @Override
        public Health health() {
            return connectivityMonitor.isOnline()
                    ? Health.up().withDetail("online", true).build()
                    : Health.status("OFFLINE").withDetail("online", false).build();
        }
    }
}
