package com.flagship.mill_sync.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Sync engine settings, bound from the {@code sync} prefix.
 *
 * <pre>
 * sync:
 *   batch-size: 50
 *   max-retries: 3
 *   max-records-per-pass: 500
 *   poll-interval-ms: 300000
 *   purge-synced: true
 *   remote:
 *     base-url: http://localhost:8000/api
 *     connect-timeout: 10s
 *     read-timeout: 30s
 * </pre>
 */
@ConfigurationProperties(prefix = "sync")
@Getter
@Setter
public class SyncProperties {

    /**
     * Records pulled from the queue per selection round.
     */
    private int batchSize = 50;

    /**
     * Transient failures tolerated before a record becomes FAILED.
     */
    private int maxRetries = 3;

    /**
     * Upper bound on records attempted in one pass, so a pass always ends.
     */
    private int maxRecordsPerPass = 500;

    private long pollIntervalMs = 300_000L;

    /**
     * Minimum gap between periodic passes run only to pull, when nothing is
     * waiting to be pushed.
     */
    private long pullIntervalMs = 900_000L;

    /**
     * Delete SYNCED records at the end of each pass.
     */
    private boolean purgeSynced = true;

    /**
     * Connectivity assumed at startup until the shell reports otherwise.
     */
    private boolean assumeOnline = true;

    /**
     * Start a pass as soon as the shell reports connectivity regained.
     */
    private boolean syncOnReconnect = true;

    private Scheduler scheduler = new Scheduler();

    private Remote remote = new Remote();

    @Getter
    @Setter
    public static class Scheduler {
        private boolean enabled = true;
    }

    @Getter
    @Setter
    public static class Remote {
        private String baseUrl = "http://localhost:8000/api";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private String accessToken;
    }
}
