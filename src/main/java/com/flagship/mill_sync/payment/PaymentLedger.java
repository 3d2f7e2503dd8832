package com.flagship.mill_sync.payment;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.queue.MutationOperation;
import com.flagship.mill_sync.queue.MutationPriority;
import com.flagship.mill_sync.queue.MutationRecord;
import com.flagship.mill_sync.queue.SyncQueueService;
import com.flagship.mill_sync.queue.payload.PaymentPayload;
import com.flagship.mill_sync.sync.EntityLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;

/**
 * Payments are create-only; the remote derives transaction totals from them.
 */
@Component
@RequiredArgsConstructor
public class PaymentLedger implements EntityLedger {

    private final PaymentRepository repository;
    private final SyncQueueService syncQueue;
    private final Clock clock;

    @Override
    public EntityType entityType() {
        return EntityType.PAYMENT;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> findServerId(long localId) {
        return repository.findById(localId).map(PaymentEntity::getServerId);
    }

    @Override
    @Transactional
    public void applySuccess(MutationRecord record, String remoteId, JsonNode canonical) {
        repository.findById(record.getEntityId()).ifPresent(payment -> payment.assignServerId(remoteId));
    }

    @Override
    @Transactional
    public void updateSyncStatus(long localId, SyncStatus status) {
        repository.findById(localId).ifPresent(payment -> payment.markSyncStatus(status, clock.instant()));
    }

    @Override
    @Transactional
    public int repairMissingMutations() {
        int enqueued = 0;
        for (PaymentEntity payment : repository.findBySyncStatusNot(SyncStatus.SYNCED)) {
            EntityRef ref = EntityRef.of(EntityType.PAYMENT, payment.getLocalId());
            if (syncQueue.hasOutstanding(ref)) {
                continue;
            }
            if (payment.getServerId() != null) {
                payment.markSyncStatus(SyncStatus.SYNCED, clock.instant());
                continue;
            }
            syncQueue.enqueue(ref, null, MutationOperation.CREATE, MutationPriority.HIGH, PaymentPayload.from(payment));
            enqueued++;
        }
        return enqueued;
    }
}
