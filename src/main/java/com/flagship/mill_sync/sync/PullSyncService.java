package com.flagship.mill_sync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.mill_sync.common.FailureType;
import com.flagship.mill_sync.remote.RemoteApi;
import com.flagship.mill_sync.remote.RemoteRequest;
import com.flagship.mill_sync.remote.RemoteResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Pulls rows changed on the remote since the last successful pull and
 * merges them last-write-wins.
 *
 * A remote row wins only if it is newer than the local row and the local
 * row has no outstanding mutation; otherwise the local version is pushed
 * over it later. The per-type timestamp only advances after a complete pull.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PullSyncService {

    private final LedgerRegistry registry;
    private final RemoteApi remoteApi;
    private final SyncStateStore stateStore;
    private final Clock clock;

    public PullSummary pullAll(CancellationToken token) {
        int applied = 0;
        for (EntityLedger ledger : registry.all()) {
            Optional<String> path = ledger.pullPath();
            if (path.isEmpty()) {
                continue;
            }
            if (token.isCancelled()) {
                break;
            }
            Instant startedAt = clock.instant();
            Optional<Instant> since = stateStore.lastPullAt(ledger.entityType());
            String uri = since.map(s -> path.get() + "?updated_after=" + s).orElse(path.get());

            RemoteResult result = remoteApi.send(RemoteRequest.get(uri));
            if (!result.isSuccess()) {
                log.warn("Pull of {} failed: {}", ledger.entityType(), result.describe());
                if (result.getFailure().getType() == FailureType.AUTH) {
                    return new PullSummary(applied, true);
                }
                continue;
            }

            int changed = mergeAll(ledger, rows(result.getResponse().getData()));
            applied += changed;
            stateStore.recordPull(ledger.entityType(), startedAt);
            log.debug("Pulled {}: {} row(s) changed locally", ledger.entityType(), changed);
        }
        return new PullSummary(applied, false);
    }

    private int mergeAll(EntityLedger ledger, JsonNode rows) {
        int changed = 0;
        for (JsonNode row : rows) {
            try {
                if (ledger.applyRemote(row)) {
                    changed++;
                }
            } catch (Exception e) {
                log.warn("Could not merge remote {} {}: {}",
                        ledger.entityType(), RemoteFields.text(row, "id"), e.getMessage());
            }
        }
        return changed;
    }

    private static JsonNode rows(JsonNode data) {
        if (data.isArray()) {
            return data;
        }
        return data.path("items");
    }
}
