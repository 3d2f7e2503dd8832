package com.flagship.mill_sync.milling;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.queue.MutationOperation;
import com.flagship.mill_sync.queue.MutationPriority;
import com.flagship.mill_sync.queue.MutationRecord;
import com.flagship.mill_sync.queue.SyncQueueService;
import com.flagship.mill_sync.queue.payload.MillingPayload;
import com.flagship.mill_sync.sync.EntityLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class MillingLedger implements EntityLedger {

    private final MillingRepository repository;
    private final SyncQueueService syncQueue;
    private final Clock clock;

    @Override
    public EntityType entityType() {
        return EntityType.MILLING;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> findServerId(long localId) {
        return repository.findById(localId).map(MillingRecordEntity::getServerId);
    }

    @Override
    @Transactional
    public void applySuccess(MutationRecord record, String remoteId, JsonNode canonical) {
        repository.findById(record.getEntityId()).ifPresent(milling -> milling.assignServerId(remoteId));
    }

    @Override
    @Transactional
    public void updateSyncStatus(long localId, SyncStatus status) {
        repository.findById(localId).ifPresent(milling -> milling.markSyncStatus(status, clock.instant()));
    }

    @Override
    @Transactional
    public int repairMissingMutations() {
        int enqueued = 0;
        for (MillingRecordEntity milling : repository.findBySyncStatusNot(SyncStatus.SYNCED)) {
            EntityRef ref = EntityRef.of(EntityType.MILLING, milling.getLocalId());
            if (syncQueue.hasOutstanding(ref)) {
                continue;
            }
            if (milling.getServerId() != null) {
                milling.markSyncStatus(SyncStatus.SYNCED, clock.instant());
                continue;
            }
            syncQueue.enqueue(ref, null, MutationOperation.CREATE, MutationPriority.NORMAL,
                    MillingPayload.from(milling));
            enqueued++;
        }
        return enqueued;
    }
}
