package com.flagship.mill_sync.queue;

import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.queue.payload.MutationPayload;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One pending change to one entity, captured by value at enqueue time.
 *
 * Immutable: every transition returns a new instance, and illegal
 * transitions throw {@link IllegalStateException}.
 *
 * <pre>
 * PENDING -> SYNCING            claim for transmission
 * SYNCING -> SYNCED             remote accepted
 * SYNCING -> PENDING            transient failure, backoff applied
 * SYNCING -> FAILED             transient failure with the retry budget spent
 * SYNCING -> CONFLICT           remote semantically rejected the change
 * SYNCING -> PENDING            released (auth lost, shutdown) without a retry
 * FAILED | CONFLICT -> PENDING  explicit user reset
 * </pre>
 */
@Value
@Builder(toBuilder = true)
public class MutationRecord {
    UUID id;
    long sequenceNumber;
    EntityType entityType;
    long entityId;
    String entityServerId;
    MutationOperation operation;
    SyncStatus status;
    MutationPriority priority;
    MutationPayload payload;
    List<EntityRef> dependencies;
    String errorMessage;
    int retryCount;
    int maxRetries;
    Instant lastAttemptAt;
    Instant nextRetryAt;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new PENDING record.
     */
    public static MutationRecord create(long sequenceNumber, EntityRef entity, String entityServerId,
                                        MutationOperation operation, MutationPriority priority,
                                        MutationPayload payload, int maxRetries, Instant now) {
        return MutationRecord.builder()
                .id(UUID.randomUUID())
                .sequenceNumber(sequenceNumber)
                .entityType(entity.getType())
                .entityId(entity.getLocalId())
                .entityServerId(entityServerId)
                .operation(operation)
                .status(SyncStatus.PENDING)
                .priority(priority)
                .payload(payload)
                .dependencies(List.copyOf(payload.references()))
                .retryCount(0)
                .maxRetries(maxRetries)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public EntityRef getEntityRef() {
        return EntityRef.of(entityType, entityId);
    }

    /**
     * Entities whose server ids must be known before this record can be sent.
     * An update or delete also needs the entity's own server id.
     */
    public List<EntityRef> requiredServerIds() {
        List<EntityRef> required = new ArrayList<>(dependencies);
        if (operation != MutationOperation.CREATE) {
            required.add(getEntityRef());
        }
        return required;
    }

    public boolean isTerminal() {
        return status == SyncStatus.SYNCED || status == SyncStatus.FAILED || status == SyncStatus.CONFLICT;
    }

    /**
     * PENDING and past its backoff window.
     */
    public boolean isDueAt(Instant now) {
        return status == SyncStatus.PENDING && (nextRetryAt == null || !now.isBefore(nextRetryAt));
    }

    public boolean canTransitionTo(SyncStatus target) {
        return switch (status) {
            case PENDING -> target == SyncStatus.SYNCING;
            case SYNCING -> target != SyncStatus.SYNCING;
            case FAILED, CONFLICT -> target == SyncStatus.PENDING;
            case SYNCED -> false;
        };
    }

    public MutationRecord markSyncing(Instant now) {
        requireTransition(SyncStatus.SYNCING, "claim");
        return toBuilder()
                .status(SyncStatus.SYNCING)
                .lastAttemptAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Remote accepted the change. Calling this on an already SYNCED record
     * returns it unchanged so a duplicate confirmation is harmless.
     */
    public MutationRecord markSynced(String serverId, Instant now) {
        if (status == SyncStatus.SYNCED) {
            return this;
        }
        requireTransition(SyncStatus.SYNCED, "mark synced");
        return toBuilder()
                .status(SyncStatus.SYNCED)
                .entityServerId(entityServerId != null ? entityServerId : serverId)
                .errorMessage(null)
                .nextRetryAt(null)
                .updatedAt(now)
                .build();
    }

    /**
     * Transient failure: consumes one retry. The record goes back to PENDING
     * with a backoff window, or to FAILED once the budget is spent.
     */
    public MutationRecord markTransientFailure(String error, Instant now) {
        if (status != SyncStatus.SYNCING) {
            throw illegal("record a transient failure");
        }
        int attempts = retryCount + 1;
        if (attempts >= maxRetries) {
            return toBuilder()
                    .status(SyncStatus.FAILED)
                    .retryCount(attempts)
                    .errorMessage(error)
                    .nextRetryAt(null)
                    .updatedAt(now)
                    .build();
        }
        return toBuilder()
                .status(SyncStatus.PENDING)
                .retryCount(attempts)
                .errorMessage(error)
                .nextRetryAt(now.plus(BackoffPolicy.delayFor(attempts)))
                .updatedAt(now)
                .build();
    }

    /**
     * Semantic conflict: terminal, no retry consumed.
     */
    public MutationRecord markConflict(String details, Instant now) {
        requireTransition(SyncStatus.CONFLICT, "mark conflict");
        return toBuilder()
                .status(SyncStatus.CONFLICT)
                .errorMessage(details)
                .nextRetryAt(null)
                .updatedAt(now)
                .build();
    }

    /**
     * Gives an in-flight record back to the queue without touching its retry
     * budget, for calls abandoned on shutdown or after the session expired.
     */
    public MutationRecord release(Instant now) {
        if (status != SyncStatus.SYNCING) {
            throw illegal("release");
        }
        return toBuilder()
                .status(SyncStatus.PENDING)
                .nextRetryAt(null)
                .updatedAt(now)
                .build();
    }

    /**
     * Manual retry of a FAILED or CONFLICT record.
     */
    public MutationRecord resetForRetry(Instant now) {
        if (status != SyncStatus.FAILED && status != SyncStatus.CONFLICT) {
            throw new IllegalStateException(String.format(
                    "Cannot reset record %s in %s status. Only FAILED or CONFLICT records can be retried.",
                    id, status));
        }
        return toBuilder()
                .status(SyncStatus.PENDING)
                .retryCount(0)
                .errorMessage(null)
                .nextRetryAt(null)
                .updatedAt(now)
                .build();
    }

    /**
     * Coalesces a newer snapshot into a record that has not been sent yet.
     */
    public MutationRecord withPayload(MutationPayload newPayload, Instant now) {
        if (status != SyncStatus.PENDING) {
            throw illegal("replace the payload");
        }
        return toBuilder()
                .payload(newPayload)
                .dependencies(List.copyOf(newPayload.references()))
                .updatedAt(now)
                .build();
    }

    private void requireTransition(SyncStatus target, String action) {
        if (!canTransitionTo(target)) {
            throw illegal(action);
        }
    }

    private IllegalStateException illegal(String action) {
        return new IllegalStateException(String.format(
                "Cannot %s for record %s in %s status", action, id, status));
    }
}
