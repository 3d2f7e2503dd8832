package com.flagship.mill_sync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.queue.MutationRecord;

import java.util.Optional;

/**
 * The sync engine's view of one kind of ledger row.
 *
 * The engine never writes business fields. It fills server ids, flips sync
 * status and merges canonical values the remote returns, all through this
 * interface. Implementations are called inside the reconciler's transaction.
 */
public interface EntityLedger {

    EntityType entityType();

    Optional<String> findServerId(long localId);

    /**
     * A record for this entity was accepted by the remote.
     *
     * @param remoteId  id in the reply: the entity's server id for a create,
     *                  the movement's server id for a stock movement
     * @param canonical the unwrapped reply, possibly a null node
     */
    void applySuccess(MutationRecord record, String remoteId, JsonNode canonical);

    void updateSyncStatus(long localId, SyncStatus status);

    /**
     * A record for this entity moved to a new status other than SYNCED.
     */
    default void onRecordStatus(MutationRecord record) {
    }

    /**
     * A CONFLICT record was closed by the user; the local state stands.
     */
    default void onDiscarded(MutationRecord record) {
    }

    /**
     * Enqueues a fresh mutation for every unsynced row that has no
     * outstanding record, for example after an enqueue was lost.
     *
     * @return number of records enqueued
     */
    int repairMissingMutations();

    /**
     * Remote collection to poll for changes, if this ledger accepts them.
     */
    default Optional<String> pullPath() {
        return Optional.empty();
    }

    /**
     * Merges one remotely changed row.
     *
     * @return true if local state changed
     */
    default boolean applyRemote(JsonNode remote) {
        return false;
    }
}
