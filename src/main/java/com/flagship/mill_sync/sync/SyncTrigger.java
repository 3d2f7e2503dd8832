package com.flagship.mill_sync.sync;

import com.flagship.mill_sync.config.SyncExecutorConfig;
import com.flagship.mill_sync.config.SyncProperties;
import com.flagship.mill_sync.observability.CorrelationContext;
import com.flagship.mill_sync.remote.ConnectivityChangedEvent;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;

/**
 * Starts sync passes on the single sync thread so callers never wait on the
 * network. Triggered by the user, by the scheduler and by regaining
 * connectivity.
 */
@Component
@Slf4j
public class SyncTrigger {

    private final SyncOrchestrator orchestrator;
    private final ThreadPoolTaskExecutor syncExecutor;
    private final SyncProperties properties;
    private final Clock clock;

    public SyncTrigger(SyncOrchestrator orchestrator,
                       @Qualifier(SyncExecutorConfig.SYNC_EXECUTOR) ThreadPoolTaskExecutor syncExecutor,
                       SyncProperties properties,
                       Clock clock) {
        this.orchestrator = orchestrator;
        this.syncExecutor = syncExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Queues a pass. A pass requested while one runs is answered with a
     * skipped result once it reaches the sync thread.
     */
    public CompletableFuture<SyncPassResult> requestSync(String reason) {
        log.debug("Sync requested: {}", reason);
        String origin = CorrelationContext.currentCorrelationId();
        try {
            return syncExecutor.submitCompletable(() -> runTagged(origin, reason));
        } catch (TaskRejectedException e) {
            log.warn("Sync request rejected ({}): sync thread is busy", reason);
            return CompletableFuture.completedFuture(SyncPassResult.skipped("busy", clock.instant()));
        }
    }

    private SyncPassResult runTagged(String origin, String reason) {
        if (origin != null) {
            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, origin);
        }
        MDC.put(CorrelationContext.SYNC_TRIGGER_MDC_KEY, reason);
        try {
            return orchestrator.runSyncPass();
        } finally {
            CorrelationContext.clearMdc();
        }
    }

    @EventListener
    public void onConnectivityChanged(ConnectivityChangedEvent event) {
        if (event.isOnline()) {
            if (properties.isSyncOnReconnect()) {
                requestSync("connectivity regained");
            }
        } else {
            orchestrator.cancelCurrentPass();
        }
    }

    @PreDestroy
    public void shutdown() {
        if (orchestrator.cancelCurrentPass()) {
            log.info("Shutting down: running sync pass cancelled");
        }
    }
}
