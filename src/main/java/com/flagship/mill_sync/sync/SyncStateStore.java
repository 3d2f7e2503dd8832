package com.flagship.mill_sync.sync;

import com.flagship.mill_sync.common.EntityType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * Small key/value store for sync bookkeeping, such as the time of the last
 * successful pull per entity type.
 */
@Repository
@RequiredArgsConstructor
public class SyncStateStore {

    private static final String LAST_PULL_PREFIX = "last_pull.";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public Optional<Instant> lastPullAt(EntityType type) {
        return get(LAST_PULL_PREFIX + type.name()).map(Instant::parse);
    }

    public void recordPull(EntityType type, Instant pulledAt) {
        put(LAST_PULL_PREFIX + type.name(), pulledAt.toString());
    }

    /**
     * Most recent pull over all entity types.
     */
    public Optional<Instant> lastPullAt() {
        return jdbcTemplate.queryForList(
                        "SELECT state_value FROM sync_state WHERE state_key LIKE ?",
                        String.class,
                        LAST_PULL_PREFIX + "%")
                .stream()
                .map(Instant::parse)
                .max(Instant::compareTo);
    }

    public Optional<String> get(String key) {
        List<String> values = jdbcTemplate.queryForList(
                "SELECT state_value FROM sync_state WHERE state_key = ?", String.class, key);
        return values.stream().findFirst();
    }

    public void put(String key, String value) {
        jdbcTemplate.update(
                "MERGE INTO sync_state (state_key, state_value, updated_at) KEY (state_key) VALUES (?, ?, ?)",
                key,
                value,
                OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC));
    }
}
