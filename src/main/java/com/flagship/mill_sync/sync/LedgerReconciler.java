package com.flagship.mill_sync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.queue.MutationOperation;
import com.flagship.mill_sync.queue.MutationRecord;
import com.flagship.mill_sync.queue.SyncQueueService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Applies a record outcome to the queue and to the entity ledger in one
 * local transaction, so a confirmed record and the server id it carries are
 * never stored apart.
 *
 * After every outcome the entity's sync status is recomputed from its
 * outstanding records: none left means SYNCED, otherwise the worst of
 * CONFLICT, FAILED, PENDING.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerReconciler {

    private final SyncQueueService syncQueue;
    private final LedgerRegistry registry;

    /**
     * Marks the record SYNCED and merges the reply into the ledger. A record
     * that is already SYNCED is left alone, so a duplicate reply changes
     * nothing.
     */
    @Transactional
    public MutationRecord confirm(MutationRecord record, String remoteId, JsonNode canonical) {
        MutationRecord current = syncQueue.findById(record.getId()).orElse(record);
        if (current.getStatus() == SyncStatus.SYNCED) {
            log.debug("Mutation {} already synced, reply ignored", record.getId());
            return current;
        }
        EntityLedger ledger = registry.get(record.getEntityType());

        String entityServerId = record.getOperation() == MutationOperation.CREATE
                ? remoteId
                : ledger.findServerId(record.getEntityId()).orElse(record.getEntityServerId());

        MutationRecord synced = syncQueue.markSynced(record.getId(), entityServerId);
        ledger.applySuccess(synced, remoteId, canonical);
        refreshStatus(synced.getEntityRef());

        log.debug("Mutation {} synced: entity={}, serverId={}", record.getId(), record.getEntityRef(), entityServerId);
        return synced;
    }

    @Transactional
    public MutationRecord recordTransientFailure(MutationRecord record, String error) {
        MutationRecord updated = syncQueue.markTransientFailure(record.getId(), error);
        afterStatusChange(updated);
        return updated;
    }

    @Transactional
    public MutationRecord recordConflict(MutationRecord record, String details) {
        MutationRecord updated = syncQueue.markConflict(record.getId(), details);
        afterStatusChange(updated);
        return updated;
    }

    @Transactional
    public MutationRecord release(MutationRecord record) {
        MutationRecord updated = syncQueue.release(record.getId());
        refreshStatus(updated.getEntityRef());
        return updated;
    }

    @Transactional
    public MutationRecord retry(UUID recordId) {
        MutationRecord updated = syncQueue.resetForRetry(recordId);
        afterStatusChange(updated);
        return updated;
    }

    /**
     * Closes a CONFLICT record without sending it and accepts the local state.
     */
    @Transactional
    public MutationRecord discard(UUID recordId) {
        MutationRecord discarded = syncQueue.discard(recordId);
        registry.get(discarded.getEntityType()).onDiscarded(discarded);
        refreshStatus(discarded.getEntityRef());
        return discarded;
    }

    private void afterStatusChange(MutationRecord record) {
        registry.get(record.getEntityType()).onRecordStatus(record);
        refreshStatus(record.getEntityRef());
    }

    void refreshStatus(EntityRef entity) {
        List<SyncStatus> outstanding = syncQueue.outstandingStatuses(entity);
        registry.get(entity.getType()).updateSyncStatus(entity.getLocalId(), aggregate(outstanding));
    }

    static SyncStatus aggregate(List<SyncStatus> outstanding) {
        if (outstanding.isEmpty()) {
            return SyncStatus.SYNCED;
        }
        if (outstanding.contains(SyncStatus.CONFLICT)) {
            return SyncStatus.CONFLICT;
        }
        if (outstanding.contains(SyncStatus.FAILED)) {
            return SyncStatus.FAILED;
        }
        return SyncStatus.PENDING;
    }
}
