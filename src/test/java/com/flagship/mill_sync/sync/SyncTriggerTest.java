package com.flagship.mill_sync.sync;

import com.flagship.mill_sync.config.SyncProperties;
import com.flagship.mill_sync.observability.CorrelationContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SyncTriggerTest {

    private ThreadPoolTaskExecutor executor;
    private SyncOrchestrator orchestrator;
    private SyncTrigger trigger;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("sync-test-");
        executor.initialize();
        orchestrator = mock(SyncOrchestrator.class);
        trigger = new SyncTrigger(orchestrator, executor, new SyncProperties(), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
        CorrelationContext.clear();
    }

    @Test
    @DisplayName("A pass requested from a request carries its correlation id and reason")
    void testPassTaggedWithOrigin() throws Exception {
        Map<String, String> seen = new HashMap<>();
        when(orchestrator.runSyncPass()).thenAnswer(invocation -> {
            seen.put("correlationId", MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
            seen.put("trigger", MDC.get(CorrelationContext.SYNC_TRIGGER_MDC_KEY));
            return SyncPassResult.skipped("test", Instant.now());
        });

        CorrelationContext.setCorrelationId("ui-42");
        CompletableFuture<SyncPassResult> result = trigger.requestSync("user");
        result.get(5, TimeUnit.SECONDS);

        assertEquals("ui-42", seen.get("correlationId"));
        assertEquals("user", seen.get("trigger"));

        CompletableFuture<Map<String, String>> afterwards = executor.submitCompletable(() -> {
            Map<String, String> left = new HashMap<>();
            left.put("correlationId", MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
            left.put("trigger", MDC.get(CorrelationContext.SYNC_TRIGGER_MDC_KEY));
            return left;
        });
        Map<String, String> left = afterwards.get(5, TimeUnit.SECONDS);
        assertNull(left.get("correlationId"), "Sync thread keeps no request id between passes");
        assertNull(left.get("trigger"));
    }

    @Test
    @DisplayName("Scheduler and reconnect passes run without a correlation id")
    void testBackgroundPassHasNoCorrelationId() throws Exception {
        Map<String, String> seen = new HashMap<>();
        when(orchestrator.runSyncPass()).thenAnswer(invocation -> {
            seen.put("correlationId", MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
            seen.put("trigger", MDC.get(CorrelationContext.SYNC_TRIGGER_MDC_KEY));
            return SyncPassResult.skipped("test", Instant.now());
        });

        trigger.requestSync("periodic").get(5, TimeUnit.SECONDS);

        assertNull(seen.get("correlationId"));
        assertEquals("periodic", seen.get("trigger"));
    }
}
