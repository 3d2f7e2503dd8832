package com.flagship.mill_sync.queue;

import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.SyncStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Picks the records that may be transmitted next.
 *
 * The entity is the serialization key: only the oldest unsynced record of an
 * entity can be eligible, so a later update never overtakes its create and
 * two records of one entity are never in flight together. A FAILED or
 * CONFLICT record therefore holds back everything queued after it for the
 * same entity until it is resolved.
 *
 * Eligible records are ordered by priority (highest first), then by
 * creation time (oldest first), then by enqueue sequence.
 */
public final class EligibilitySelector {

    static final Comparator<MutationRecord> ENTITY_ORDER = Comparator
            .comparing(MutationRecord::getCreatedAt)
            .thenComparingLong(MutationRecord::getSequenceNumber);

    static final Comparator<MutationRecord> DRAIN_ORDER = Comparator
            .comparingInt((MutationRecord r) -> r.getPriority().rank()).reversed()
            .thenComparing(MutationRecord::getCreatedAt)
            .thenComparingLong(MutationRecord::getSequenceNumber);

    private EligibilitySelector() {
    }

    /**
     * @param unsynced every record not yet SYNCED, in any order
     * @param now      current time, for backoff windows
     * @param limit    maximum number of records to return
     * @param excluded records to skip in this round (already deferred)
     */
    public static List<MutationRecord> select(Collection<MutationRecord> unsynced, Instant now,
                                              int limit, Set<UUID> excluded) {
        List<MutationRecord> ordered = new ArrayList<>(unsynced);
        ordered.sort(ENTITY_ORDER);

        Set<EntityRef> seen = new HashSet<>();
        List<MutationRecord> eligible = new ArrayList<>();
        for (MutationRecord record : ordered) {
            if (record.getStatus() == SyncStatus.SYNCED) {
                continue;
            }
            // first unsynced record of the entity is the head, everything after it waits
            if (!seen.add(record.getEntityRef())) {
                continue;
            }
            if (record.isDueAt(now) && !excluded.contains(record.getId())) {
                eligible.add(record);
            }
        }

        eligible.sort(DRAIN_ORDER);
        return eligible.size() > limit ? List.copyOf(eligible.subList(0, limit)) : eligible;
    }
}
