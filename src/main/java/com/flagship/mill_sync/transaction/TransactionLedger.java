package com.flagship.mill_sync.transaction;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.payment.PaymentRepository;
import com.flagship.mill_sync.payment.PaymentStatus;
import com.flagship.mill_sync.queue.MutationOperation;
import com.flagship.mill_sync.queue.MutationPriority;
import com.flagship.mill_sync.queue.MutationRecord;
import com.flagship.mill_sync.queue.SyncQueueService;
import com.flagship.mill_sync.queue.payload.TransactionCancelPayload;
import com.flagship.mill_sync.queue.payload.TransactionPayload;
import com.flagship.mill_sync.sync.EntityLedger;
import com.flagship.mill_sync.sync.RemoteFields;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Transactions and their lines. Lines have no records of their own: they
 * take their server ids and sync status from the transaction.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransactionLedger implements EntityLedger {

    private final TransactionRepository repository;
    private final PaymentRepository paymentRepository;
    private final SyncQueueService syncQueue;
    private final Clock clock;

    @Override
    public EntityType entityType() {
        return EntityType.TRANSACTION;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> findServerId(long localId) {
        return repository.findById(localId).map(TransactionEntity::getServerId);
    }

    /**
     * On create, stores the server ids of the transaction and its lines and
     * takes the remote's totals. Paid and due amounts are only taken while
     * no local payment is still unsent, since the remote cannot know it yet.
     */
    @Override
    @Transactional
    public void applySuccess(MutationRecord record, String remoteId, JsonNode canonical) {
        if (record.getOperation() != MutationOperation.CREATE) {
            return;
        }
        TransactionEntity transaction = repository.findById(record.getEntityId()).orElse(null);
        if (transaction == null) {
            return;
        }
        if (!transaction.assignServerId(remoteId) && !remoteId.equals(transaction.getServerId())) {
            log.warn("Transaction {} keeps server id {}, reply carried {}",
                    transaction.getTransactionNumber(), transaction.getServerId(), remoteId);
        }
        assignLineIds(transaction, canonical.path("items"));

        boolean unsentPayments = paymentRepository.existsByTransactionLocalIdAndSyncStatusNot(
                transaction.getLocalId(), SyncStatus.SYNCED);
        transaction.applyCanonicalTotals(
                RemoteFields.decimal(canonical, "total_amount"),
                unsentPayments ? null : RemoteFields.decimal(canonical, "paid_amount"),
                unsentPayments ? null : RemoteFields.decimal(canonical, "due_amount"),
                unsentPayments ? null : RemoteFields.enumValue(canonical, "payment_status", PaymentStatus.class));
    }

    @Override
    @Transactional
    public void updateSyncStatus(long localId, SyncStatus status) {
        Instant now = clock.instant();
        repository.findById(localId).ifPresent(transaction -> {
            transaction.markSyncStatus(status, now);
            transaction.getItems().forEach(line -> line.markSyncStatus(status, now));
        });
    }

    /**
     * A transaction that never synced is re-sent whole; one that synced
     * but was cancelled since gets its cancel re-sent. Anything else the
     * remote derives from payments, so the row is simply marked synced.
     */
    @Override
    @Transactional
    public int repairMissingMutations() {
        int enqueued = 0;
        for (TransactionEntity transaction : repository.findBySyncStatusNot(SyncStatus.SYNCED)) {
            EntityRef ref = EntityRef.of(EntityType.TRANSACTION, transaction.getLocalId());
            if (syncQueue.hasOutstanding(ref)) {
                continue;
            }
            if (transaction.getServerId() == null) {
                syncQueue.enqueue(ref, null, MutationOperation.CREATE, MutationPriority.HIGH,
                        TransactionPayload.from(transaction));
                enqueued++;
            } else if (transaction.isCancelled()) {
                syncQueue.enqueue(ref, transaction.getServerId(), MutationOperation.UPDATE, MutationPriority.CRITICAL,
                        new TransactionCancelPayload(transaction.getCancelReason(), transaction.getUpdatedAt()));
                enqueued++;
            } else {
                updateSyncStatus(transaction.getLocalId(), SyncStatus.SYNCED);
            }
        }
        return enqueued;
    }

    @Override
    public Optional<String> pullPath() {
        return Optional.of("/transactions");
    }

    /**
     * Settlement and status changes made on the remote. Transactions never
     * seen on this device are not imported.
     */
    @Override
    @Transactional
    public boolean applyRemote(JsonNode remote) {
        String serverId = RemoteFields.text(remote, "id");
        if (serverId == null) {
            return false;
        }
        Optional<TransactionEntity> existing = repository.findByServerId(serverId);
        if (existing.isEmpty()) {
            log.debug("Remote transaction {} is not known on this device, skipped", serverId);
            return false;
        }
        TransactionEntity transaction = existing.get();
        if (syncQueue.hasOutstanding(EntityRef.of(EntityType.TRANSACTION, transaction.getLocalId()))) {
            log.debug("Transaction {} has local changes in flight, remote version ignored",
                    transaction.getTransactionNumber());
            return false;
        }
        Instant now = clock.instant();
        Instant remoteUpdatedAt = Optional.ofNullable(RemoteFields.instant(remote, "updated_at")).orElse(now);
        if (!remoteUpdatedAt.isAfter(transaction.getUpdatedAt())) {
            return false;
        }
        transaction.applyRemote(
                RemoteFields.enumValue(remote, "status", TransactionStatus.class),
                RemoteFields.decimal(remote, "paid_amount"),
                RemoteFields.decimal(remote, "due_amount"),
                RemoteFields.enumValue(remote, "payment_status", PaymentStatus.class),
                remoteUpdatedAt,
                now);
        return true;
    }

    /**
     * Matches reply lines by local id, falling back to position.
     */
    private static void assignLineIds(TransactionEntity transaction, JsonNode replyItems) {
        if (!replyItems.isArray()) {
            return;
        }
        List<TransactionItemEntity> lines = transaction.getItems();
        Map<Long, String> byLocalId = new HashMap<>();
        for (JsonNode item : replyItems) {
            long localId = item.path("local_id").asLong(-1);
            String id = RemoteFields.text(item, "id");
            if (localId >= 0 && id != null) {
                byLocalId.put(localId, id);
            }
        }
        for (int i = 0; i < lines.size(); i++) {
            TransactionItemEntity line = lines.get(i);
            String id = byLocalId.get(line.getLocalId());
            if (id == null && byLocalId.isEmpty() && i < replyItems.size()) {
                id = RemoteFields.text(replyItems.get(i), "id");
            }
            line.assignServerId(id);
        }
    }
}
