package com.flagship.mill_sync.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Single worker thread for sync passes. Passes never overlap, and the
 * caller (HTTP thread, scheduler, event listener) is never blocked on
 * network calls.
 */
@Configuration
public class SyncExecutorConfig {

    public static final String SYNC_EXECUTOR = "syncExecutor";

    @Bean(SYNC_EXECUTOR)
    public ThreadPoolTaskExecutor syncExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(16);
        executor.setThreadNamePrefix("sync-");
        // the running pass is cancelled first and gets this long to release its record
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
