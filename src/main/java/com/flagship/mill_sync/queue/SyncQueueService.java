package com.flagship.mill_sync.queue;

import com.flagship.mill_sync.common.EntityNotFoundException;
import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.LocalIdAllocator;
import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.config.PersistenceConfig;
import com.flagship.mill_sync.config.SyncProperties;
import com.flagship.mill_sync.queue.payload.MutationPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

/**
 * Durable, priority-aware queue of mutation records.
 *
 * Domain operations call {@link #enqueue} inside their own transaction, so a
 * ledger write and its mutation record commit or roll back together:
 * "if the domain write commits, the record describing it exists".
 *
 * The orchestrator drives records through their state machine with the
 * mark* methods. Each transition loads the row, applies the domain
 * transition and saves it under optimistic locking.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SyncQueueService {

    private static final Set<SyncStatus> PROBLEM_STATUSES = EnumSet.of(SyncStatus.FAILED, SyncStatus.CONFLICT);

    private final MutationRecordRepository repository;
    private final MutationPayloadCodec codec;
    @Qualifier(PersistenceConfig.MUTATION_SEQUENCE_ALLOCATOR)
    private final LocalIdAllocator sequenceAllocator;
    private final EntityLockRegistry lockRegistry;
    private final SyncProperties properties;
    private final Clock clock;

    /**
     * Appends a record for a local change, within the caller's transaction.
     *
     * A full snapshot replaces the payload of the entity's latest record when
     * that record is still PENDING, not in flight, and carries the same kind
     * of snapshot. Otherwise a new record is appended behind the existing
     * ones, so per-entity order is kept either way.
     *
     * @param entityServerId the entity's server id if already known
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public MutationRecord enqueue(EntityRef entity, String entityServerId, MutationOperation operation,
                                  MutationPriority priority, MutationPayload payload) {
        Instant now = clock.instant();

        if (operation == MutationOperation.UPDATE && payload.isSnapshot()) {
            Optional<MutationRecord> coalesced = coalesce(entity, payload, now);
            if (coalesced.isPresent()) {
                return coalesced.get();
            }
        }

        MutationRecord record = MutationRecord.create(sequenceAllocator.nextId(), entity, entityServerId,
                operation, priority, payload, properties.getMaxRetries(), now);
        repository.save(MutationRecordEntity.fromDomain(record, codec));

        log.debug("Enqueued mutation: id={}, entity={}, operation={}, priority={}",
                record.getId(), entity, operation, priority);

        return record;
    }

    /**
     * The latest record is read under its row lock: a claim by the sync
     * thread either committed before the read, and the record is seen as
     * SYNCING, or waits for this transaction and then loses on the version.
     */
    private Optional<MutationRecord> coalesce(EntityRef entity, MutationPayload payload, Instant now) {
        if (lockRegistry.isLocked(entity)) {
            return Optional.empty();
        }
        return repository.findIdsNewestFirst(entity.getType(), entity.getLocalId()).stream()
                .findFirst()
                .flatMap(repository::findByIdForUpdate)
                .filter(row -> row.getStatus() == SyncStatus.PENDING)
                .filter(row -> row.getOperation() != MutationOperation.DELETE)
                .flatMap(row -> {
                    MutationRecord latest = row.toDomain(codec);
                    if (latest.getPayload().getClass() != payload.getClass()) {
                        return Optional.empty();
                    }
                    MutationRecord updated = latest.withPayload(payload, now);
                    row.apply(updated, codec);
                    repository.save(row);
                    log.debug("Coalesced snapshot into pending mutation: id={}, entity={}", updated.getId(), entity);
                    return Optional.of(updated);
                });
    }

    /**
     * Next records to transmit, see {@link EligibilitySelector}.
     */
    @Transactional(readOnly = true)
    public List<MutationRecord> findEligible(int limit, Set<UUID> excluded) {
        List<MutationRecord> unsynced = repository.findUnsynced().stream()
                .map(row -> row.toDomain(codec))
                .toList();
        return EligibilitySelector.select(unsynced, clock.instant(), limit, excluded);
    }

    /**
     * PENDING -> SYNCING. Returns the fresh record, or empty when the record
     * is no longer PENDING and due (already taken, resolved, or backing off).
     */
    @Transactional
    public Optional<MutationRecord> claim(UUID id) {
        Instant now = clock.instant();
        return repository.findById(id)
                .map(row -> row.toDomain(codec))
                .filter(record -> record.isDueAt(now))
                .map(record -> store(record.markSyncing(now)));
    }

    @Transactional
    public MutationRecord markSynced(UUID id, String entityServerId) {
        return transition(id, record -> record.markSynced(entityServerId, clock.instant()));
    }

    @Transactional
    public MutationRecord markTransientFailure(UUID id, String error) {
        MutationRecord updated = transition(id, record -> record.markTransientFailure(error, clock.instant()));
        if (updated.getStatus() == SyncStatus.FAILED) {
            log.warn("Mutation {} failed after {} attempts: {}", id, updated.getRetryCount(), error);
        } else {
            log.warn("Mutation {} will be retried at {} (retry #{}): {}",
                    id, updated.getNextRetryAt(), updated.getRetryCount(), error);
        }
        return updated;
    }

    @Transactional
    public MutationRecord markConflict(UUID id, String details) {
        MutationRecord updated = transition(id, record -> record.markConflict(details, clock.instant()));
        log.warn("Mutation {} conflicted: {}", id, details);
        return updated;
    }

    @Transactional
    public MutationRecord release(UUID id) {
        return transition(id, record -> record.release(clock.instant()));
    }

    @Transactional
    public MutationRecord resetForRetry(UUID id) {
        MutationRecord updated = transition(id, record -> record.resetForRetry(clock.instant()));
        log.info("Mutation {} reset for retry", id);
        return updated;
    }

    /**
     * Closes a CONFLICT record without sending it: the local state is
     * accepted as is.
     */
    @Transactional
    public MutationRecord discard(UUID id) {
        MutationRecordEntity row = repository.findById(id)
                .orElseThrow(() -> new EntityNotFoundException("Mutation record " + id + " not found"));
        MutationRecord record = row.toDomain(codec);
        if (record.getStatus() != SyncStatus.CONFLICT) {
            throw new IllegalStateException(String.format(
                    "Cannot discard record %s in %s status. Only CONFLICT records can be discarded.",
                    id, record.getStatus()));
        }
        repository.delete(row);
        log.info("Mutation {} discarded for entity {}", id, record.getEntityRef());
        return record;
    }

    /**
     * Returns records left SYNCING by an interrupted run to PENDING,
     * without backoff.
     */
    @Transactional
    public int recoverInterrupted() {
        List<MutationRecordEntity> stuck = repository.findByStatus(SyncStatus.SYNCING);
        Instant now = clock.instant();
        for (MutationRecordEntity row : stuck) {
            row.apply(row.toDomain(codec).release(now), codec);
        }
        repository.saveAll(stuck);
        if (!stuck.isEmpty()) {
            log.info("Recovered {} interrupted mutation(s) to PENDING", stuck.size());
        }
        return stuck.size();
    }

    @Transactional
    public int purgeSynced() {
        int purged = repository.deleteSynced();
        if (purged > 0) {
            log.debug("Purged {} synced mutation(s)", purged);
        }
        return purged;
    }

    @Transactional(readOnly = true)
    public Optional<MutationRecord> findById(UUID id) {
        return repository.findById(id).map(row -> row.toDomain(codec));
    }

    @Transactional(readOnly = true)
    public List<MutationRecord> findForEntity(EntityRef entity) {
        return repository.findByEntityTypeAndEntityIdOrderBySequenceNumberAsc(entity.getType(), entity.getLocalId())
                .stream()
                .map(row -> row.toDomain(codec))
                .toList();
    }

    /**
     * Statuses of the entity's records that are not yet SYNCED.
     */
    @Transactional(readOnly = true)
    public List<SyncStatus> outstandingStatuses(EntityRef entity) {
        return repository.findOutstandingStatuses(entity.getType(), entity.getLocalId());
    }

    /**
     * Whether a create for the entity is still waiting to be confirmed, in
     * any status other than SYNCED.
     */
    @Transactional(readOnly = true)
    public boolean hasOutstandingCreate(EntityRef entity) {
        return repository.existsByEntityTypeAndEntityIdAndOperationAndStatusNot(
                entity.getType(), entity.getLocalId(), MutationOperation.CREATE, SyncStatus.SYNCED);
    }

    @Transactional(readOnly = true)
    public boolean hasOutstanding(EntityRef entity) {
        return !outstandingStatuses(entity).isEmpty();
    }

    /**
     * FAILED and CONFLICT records waiting for the user.
     */
    @Transactional(readOnly = true)
    public List<MutationRecord> findProblems() {
        return repository.findByStatusInOrderByCreatedAtAsc(PROBLEM_STATUSES).stream()
                .map(row -> row.toDomain(codec))
                .toList();
    }

    /**
     * Records not yet confirmed, including FAILED and CONFLICT ones.
     */
    @Transactional(readOnly = true)
    public long countPending() {
        return repository.countByStatusIn(EnumSet.complementOf(EnumSet.of(SyncStatus.SYNCED)));
    }

    @Transactional(readOnly = true)
    public long countByStatus(SyncStatus status) {
        return repository.countByStatus(status);
    }

    @Transactional(readOnly = true)
    public Optional<Instant> oldestOutstandingCreatedAt() {
        return repository.findOldestOutstandingCreatedAt();
    }

    private MutationRecord transition(UUID id, Function<MutationRecord, MutationRecord> change) {
        MutationRecordEntity row = repository.findById(id)
                .orElseThrow(() -> new EntityNotFoundException("Mutation record " + id + " not found"));
        MutationRecord updated = change.apply(row.toDomain(codec));
        row.apply(updated, codec);
        repository.save(row);
        return updated;
    }

    private MutationRecord store(MutationRecord record) {
        MutationRecordEntity row = repository.findById(record.getId())
                .orElseThrow(() -> new EntityNotFoundException("Mutation record " + record.getId() + " not found"));
        row.apply(record, codec);
        repository.save(row);
        return record;
    }
}
