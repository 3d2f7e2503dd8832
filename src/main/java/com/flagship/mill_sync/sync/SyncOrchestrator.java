package com.flagship.mill_sync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.config.SyncProperties;
import com.flagship.mill_sync.observability.CorrelationContext;
import com.flagship.mill_sync.observability.SyncMetrics;
import com.flagship.mill_sync.queue.EntityLockRegistry;
import com.flagship.mill_sync.queue.MutationOperation;
import com.flagship.mill_sync.queue.MutationRecord;
import com.flagship.mill_sync.queue.SyncQueueService;
import com.flagship.mill_sync.remote.ConnectivityMonitor;
import com.flagship.mill_sync.remote.RemoteApi;
import com.flagship.mill_sync.remote.RemoteOutcome;
import com.flagship.mill_sync.remote.RemoteOutcomeClassifier;
import com.flagship.mill_sync.remote.RemoteRequest;
import com.flagship.mill_sync.remote.RemoteResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives sync passes: push eligible mutation records to the remote, then
 * pull remote changes.
 *
 * A pass never throws. Every per-record problem becomes a record transition:
 * <ul>
 *   <li>success: SYNCED, server id and canonical values merged into the ledger</li>
 *   <li>transient failure: PENDING with backoff, or FAILED once retries run out</li>
 *   <li>semantic conflict: CONFLICT, no retry consumed</li>
 *   <li>auth required: record released, pass stops</li>
 *   <li>cancelled: record released, pass stops</li>
 * </ul>
 *
 * A record whose own or referenced server ids are not known yet is deferred:
 * it stays PENDING, is never claimed and consumes no retry. When no create
 * for the missing entity is left in the queue the id can never arrive, and
 * the record becomes a CONFLICT instead. Passes never overlap.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SyncOrchestrator {

    private final SyncQueueService syncQueue;
    private final EntityLockRegistry lockRegistry;
    private final LedgerRegistry registry;
    private final LedgerReconciler reconciler;
    private final RemoteRequestFactory requestFactory;
    private final RemoteApi remoteApi;
    private final RemoteOutcomeClassifier classifier;
    private final PullSyncService pullSyncService;
    private final SyncQueueRepairService repairService;
    private final ConnectivityMonitor connectivityMonitor;
    private final SyncMetrics syncMetrics;
    private final SyncProperties properties;
    private final Clock clock;

    private final ReentrantLock passLock = new ReentrantLock();
    private final AtomicReference<CancellationToken> currentToken = new AtomicReference<>();
    private final AtomicReference<SyncPassResult> lastResult = new AtomicReference<>();

    /**
     * Records left SYNCING by a previous run go back to PENDING before the
     * first pass.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void recoverInterruptedRecords() {
        try {
            syncQueue.recoverInterrupted();
        } catch (Exception e) {
            log.error("Could not recover interrupted mutation records", e);
        }
    }

    public SyncPassResult runSyncPass() {
        return runSyncPass(new CancellationToken());
    }

    public SyncPassResult runSyncPass(CancellationToken token) {
        if (!passLock.tryLock()) {
            log.debug("Sync pass requested while another pass is running");
            return SyncPassResult.skipped("already running", clock.instant());
        }
        String passId = CorrelationContext.generateId();
        MDC.put(CorrelationContext.SYNC_PASS_ID_MDC_KEY, passId);
        currentToken.set(token);
        PassCounters counters = new PassCounters(passId, clock.instant());
        try {
            if (!connectivityMonitor.isOnline()) {
                log.debug("Device offline, sync pass skipped");
                return remember(SyncPassResult.skipped("offline", counters.startedAt));
            }
            log.info("Sync pass started: pending={}", syncQueue.countPending());

            counters.repaired = repairService.repairAll();
            push(token, counters);

            if (!counters.authRequired && !token.isCancelled()) {
                PullSummary pull = pullSyncService.pullAll(token);
                counters.pulled = pull.getApplied();
                counters.authRequired = pull.isAuthRequired();
            }
            if (properties.isPurgeSynced()) {
                syncQueue.purgeSynced();
            }
        } catch (Exception e) {
            log.error("Sync pass {} ended early", passId, e);
            counters.error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        } finally {
            currentToken.set(null);
            MDC.remove(CorrelationContext.SYNC_PASS_ID_MDC_KEY);
            passLock.unlock();
        }
        counters.cancelled = token.isCancelled();
        SyncPassResult result = remember(counters.toResult(clock.instant()));
        syncMetrics.recordPassDuration(Duration.between(result.getStartedAt(), result.getFinishedAt()));
        syncMetrics.refreshMetrics();

        log.info("Sync pass finished: attempted={}, succeeded={}, retried={}, failed={}, conflicted={}, " +
                        "deferred={}, pulled={}, authRequired={}, cancelled={}",
                result.getAttempted(), result.getSucceeded(), result.getRetried(), result.getFailed(),
                result.getConflicted(), result.getDeferred(), result.getPulled(), result.isAuthRequired(),
                result.isCancelled());
        return result;
    }

    /**
     * Asks the running pass, if any, to stop after the current call. The
     * record of that call is released back to PENDING.
     */
    public boolean cancelCurrentPass() {
        CancellationToken token = currentToken.get();
        if (token == null) {
            return false;
        }
        token.cancel();
        log.info("Cancellation requested for the running sync pass");
        return true;
    }

    public Optional<SyncPassResult> getLastResult() {
        return Optional.ofNullable(lastResult.get());
    }

    public boolean isPassRunning() {
        return passLock.isLocked();
    }

    /**
     * Drains eligible records in selection order. Deferred records are
     * offered again once something else synced in this pass, since that may
     * have supplied the server id they were waiting for.
     */
    private void push(CancellationToken token, PassCounters counters) {
        Set<UUID> excluded = new HashSet<>();
        Set<UUID> deferred = new HashSet<>();
        int succeededAtReadmission = 0;

        while (counters.attempted < properties.getMaxRecordsPerPass()
                && !counters.authRequired
                && !token.isCancelled()) {
            int room = Math.min(properties.getBatchSize(), properties.getMaxRecordsPerPass() - counters.attempted);
            List<MutationRecord> eligible = syncQueue.findEligible(room, excluded);
            if (eligible.isEmpty()) {
                if (deferred.isEmpty() || counters.succeeded == succeededAtReadmission) {
                    break;
                }
                excluded.removeAll(deferred);
                succeededAtReadmission = counters.succeeded;
                continue;
            }

            List<MutationRecord> claimed = new ArrayList<>();
            for (MutationRecord record : eligible) {
                excluded.add(record.getId());
                List<EntityRef> missing = missingServerIds(record);
                if (!missing.isEmpty()) {
                    Optional<EntityRef> unreachable = missing.stream()
                            .filter(ref -> !syncQueue.hasOutstandingCreate(ref))
                            .findFirst();
                    if (unreachable.isPresent()) {
                        deferred.remove(record.getId());
                        claim(record).ifPresent(taken -> rejectUnreachable(taken, unreachable.get(), counters));
                        continue;
                    }
                    if (deferred.add(record.getId())) {
                        syncMetrics.recordProcessed(record.getEntityType(), "deferred");
                        log.debug("Mutation {} deferred: server ids not yet known for {}",
                                record.getId(), record.requiredServerIds());
                    }
                    continue;
                }
                deferred.remove(record.getId());
                claim(record).ifPresent(claimed::add);
            }
            transmit(claimed, token, counters);
        }
        counters.deferred = deferred.size();
    }

    /**
     * Required entities whose server id is not known yet. A delete of an
     * entity that never reached the remote needs no server id: it completes
     * locally.
     */
    private List<EntityRef> missingServerIds(MutationRecord record) {
        List<EntityRef> missing = new ArrayList<>();
        for (EntityRef ref : record.requiredServerIds()) {
            if (record.getOperation() == MutationOperation.DELETE && ref.equals(record.getEntityRef())) {
                continue;
            }
            if (ref.equals(record.getEntityRef()) && record.getEntityServerId() != null) {
                continue;
            }
            if (registry.serverIdOf(ref).isEmpty()) {
                missing.add(ref);
            }
        }
        return missing;
    }

    /**
     * The record needs a server id that no outstanding create will ever
     * supply, typically after the entity's create was discarded. Waiting
     * would strand it, so it becomes a CONFLICT the user can see.
     */
    private void rejectUnreachable(MutationRecord record, EntityRef missing, PassCounters counters) {
        try {
            log.warn("Mutation {} needs a server id for {} but no create is queued for it",
                    record.getId(), missing.format());
            applyOutcome(record, RemoteOutcome.SEMANTIC_CONFLICT, null, NullNode.getInstance(),
                    "No server id for " + missing.format() + " and no create queued for it", counters);
        } catch (Exception e) {
            log.error("Could not reject mutation {}", record.getId(), e);
            failSafely(record, e, counters);
        } finally {
            lockRegistry.unlock(record.getEntityRef());
        }
    }

    private Optional<MutationRecord> claim(MutationRecord record) {
        EntityRef entity = record.getEntityRef();
        if (!lockRegistry.tryLock(entity)) {
            return Optional.empty();
        }
        try {
            Optional<MutationRecord> claimed = syncQueue.claim(record.getId());
            if (claimed.isEmpty()) {
                lockRegistry.unlock(entity);
            }
            return claimed;
        } catch (Exception e) {
            lockRegistry.unlock(entity);
            log.warn("Could not claim mutation {}: {}", record.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    private void transmit(List<MutationRecord> claimed, CancellationToken token, PassCounters counters) {
        Map<EntityType, List<MutationRecord>> batches = new LinkedHashMap<>();
        List<MutationRecord> singles = new ArrayList<>();
        for (MutationRecord record : claimed) {
            if (requestFactory.isBatchable(record)) {
                batches.computeIfAbsent(record.getEntityType(), type -> new ArrayList<>()).add(record);
            } else {
                singles.add(record);
            }
        }
        batches.forEach((type, records) -> {
            if (records.size() == 1) {
                singles.add(0, records.get(0));
            } else {
                sendBatch(type, records, token, counters);
            }
        });
        for (MutationRecord record : singles) {
            sendSingle(record, token, counters);
        }
    }

    private void sendSingle(MutationRecord record, CancellationToken token, PassCounters counters) {
        MDC.put(CorrelationContext.MUTATION_ID_MDC_KEY, record.getId().toString());
        MDC.put(CorrelationContext.ENTITY_REF_MDC_KEY, record.getEntityRef().format());
        try {
            if (token.isCancelled() || counters.authRequired) {
                release(record, "released");
                return;
            }
            counters.attempted++;

            if (record.getOperation() == MutationOperation.DELETE
                    && registry.serverIdOf(record.getEntityRef()).isEmpty()
                    && record.getEntityServerId() == null) {
                log.debug("Delete of {} never reached the remote, completed locally", record.getEntityRef());
                reconciler.confirm(record, null, NullNode.getInstance());
                counters.succeeded++;
                syncMetrics.recordProcessed(record.getEntityType(), "synced");
                return;
            }

            RemoteRequest request = requestFactory.build(record);
            RemoteResult result = remoteApi.send(request);
            RemoteOutcome outcome = token.isCancelled() ? RemoteOutcome.CANCELLED : classifier.classify(request, result);

            JsonNode data = result.isSuccess() ? result.getResponse().getData() : NullNode.getInstance();
            applyOutcome(record, outcome, RemoteFields.text(data, "id"), data, result.describe(), counters);

        } catch (Exception e) {
            log.error("Unexpected error while syncing mutation {}", record.getId(), e);
            failSafely(record, e, counters);
        } finally {
            lockRegistry.unlock(record.getEntityRef());
            MDC.remove(CorrelationContext.MUTATION_ID_MDC_KEY);
            MDC.remove(CorrelationContext.ENTITY_REF_MDC_KEY);
        }
    }

    /**
     * Creates of one entity type in a single call. A failed call applies its
     * outcome to every record; a successful one confirms each record the
     * reply acknowledges by local id.
     */
    private void sendBatch(EntityType type, List<MutationRecord> records, CancellationToken token,
                           PassCounters counters) {
        try {
            if (token.isCancelled() || counters.authRequired) {
                records.forEach(record -> release(record, "released"));
                return;
            }
            counters.attempted += records.size();

            RemoteRequest request = requestFactory.buildBatch(type, records);
            RemoteResult result = remoteApi.send(request);
            RemoteOutcome outcome = token.isCancelled() ? RemoteOutcome.CANCELLED : classifier.classify(request, result);

            if (outcome != RemoteOutcome.SUCCESS) {
                for (MutationRecord record : records) {
                    applyOutcome(record, outcome, null, NullNode.getInstance(), result.describe(), counters);
                }
                return;
            }

            JsonNode data = result.getResponse().getData();
            Map<Long, JsonNode> synced = indexByLocalId(data.path("synced"));
            Map<Long, JsonNode> rejected = indexByLocalId(data.path("failed"));
            for (MutationRecord record : records) {
                JsonNode acknowledged = synced.get(record.getEntityId());
                if (acknowledged != null) {
                    applyOutcome(record, RemoteOutcome.SUCCESS, RemoteFields.text(acknowledged, "id"),
                            acknowledged, null, counters);
                } else if (rejected.containsKey(record.getEntityId())) {
                    String message = RemoteFields.text(rejected.get(record.getEntityId()), "message");
                    applyOutcome(record, RemoteOutcome.SEMANTIC_CONFLICT, null, NullNode.getInstance(),
                            message != null ? message : "Rejected in batch", counters);
                } else {
                    applyOutcome(record, RemoteOutcome.TRANSIENT, null, NullNode.getInstance(),
                            "Batch reply did not acknowledge local id " + record.getEntityId(), counters);
                }
            }
        } catch (Exception e) {
            log.error("Unexpected error while syncing {} batch", type, e);
            for (MutationRecord record : records) {
                failSafely(record, e, counters);
            }
        } finally {
            records.forEach(record -> lockRegistry.unlock(record.getEntityRef()));
        }
    }

    private void applyOutcome(MutationRecord record, RemoteOutcome outcome, String remoteId, JsonNode data,
                              String description, PassCounters counters) {
        switch (outcome) {
            case SUCCESS -> {
                if (record.getOperation() == MutationOperation.CREATE && remoteId == null) {
                    applyOutcome(record, RemoteOutcome.TRANSIENT, null, data,
                            "Remote accepted the create without returning an id", counters);
                    return;
                }
                reconciler.confirm(record, remoteId, data);
                counters.succeeded++;
                syncMetrics.recordProcessed(record.getEntityType(), "synced");
            }
            case TRANSIENT -> {
                MutationRecord updated = reconciler.recordTransientFailure(record, description);
                if (updated.getStatus() == SyncStatus.FAILED) {
                    counters.failed++;
                    syncMetrics.recordProcessed(record.getEntityType(), "failed");
                } else {
                    counters.retried++;
                    syncMetrics.recordProcessed(record.getEntityType(), "retried");
                }
            }
            case SEMANTIC_CONFLICT -> {
                reconciler.recordConflict(record, description);
                counters.conflicted++;
                syncMetrics.recordProcessed(record.getEntityType(), "conflict");
            }
            case AUTH_REQUIRED -> {
                log.warn("Remote requires a new session, stopping the pass: {}", description);
                counters.authRequired = true;
                release(record, "auth_required");
            }
            case CANCELLED -> release(record, "released");
        }
    }

    private void release(MutationRecord record, String outcome) {
        reconciler.release(record);
        syncMetrics.recordProcessed(record.getEntityType(), outcome);
    }

    /**
     * Last resort for an unexpected exception: count it as a transient
     * failure so the record leaves SYNCING and the retry budget bounds it.
     */
    private void failSafely(MutationRecord record, Exception cause, PassCounters counters) {
        try {
            boolean inFlight = syncQueue.findById(record.getId())
                    .map(current -> current.getStatus() == SyncStatus.SYNCING)
                    .orElse(false);
            if (inFlight) {
                applyOutcome(record, RemoteOutcome.TRANSIENT, null, NullNode.getInstance(),
                        "Local error: " + cause.getMessage(), counters);
            }
        } catch (Exception e) {
            log.error("Could not record failure of mutation {}; it will be recovered on restart", record.getId(), e);
        }
    }

    private static Map<Long, JsonNode> indexByLocalId(JsonNode entries) {
        Map<Long, JsonNode> index = new HashMap<>();
        for (JsonNode entry : entries) {
            JsonNode localId = entry.get("local_id");
            if (localId != null && !localId.isNull()) {
                index.put(localId.asLong(), entry);
            }
        }
        return index;
    }

    private SyncPassResult remember(SyncPassResult result) {
        lastResult.set(result);
        return result;
    }

    private static class PassCounters {
        final String passId;
        final Instant startedAt;
        int attempted;
        int succeeded;
        int retried;
        int failed;
        int conflicted;
        int deferred;
        int repaired;
        int pulled;
        boolean authRequired;
        boolean cancelled;
        String error;

        PassCounters(String passId, Instant startedAt) {
            this.passId = passId;
            this.startedAt = startedAt;
        }

        SyncPassResult toResult(Instant finishedAt) {
            return SyncPassResult.builder()
                    .passId(passId)
                    .startedAt(startedAt)
                    .finishedAt(finishedAt)
                    .attempted(attempted)
                    .succeeded(succeeded)
                    .retried(retried)
                    .failed(failed)
                    .conflicted(conflicted)
                    .deferred(deferred)
                    .repaired(repaired)
                    .pulled(pulled)
                    .authRequired(authRequired)
                    .cancelled(cancelled)
                    .error(error)
                    .build();
        }
    }
}
