package com.flagship.mill_sync.queue;

import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.queue.payload.DeletePayload;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EligibilitySelectorTest {

    private static final Instant T0 = Instant.parse("2026-03-01T08:00:00Z");

    private long sequence;

    private MutationRecord record(EntityType type, long entityId, MutationOperation operation,
                                  MutationPriority priority, Instant createdAt) {
        return MutationRecord.create(++sequence, EntityRef.of(type, entityId), null, operation, priority,
                new DeletePayload(createdAt), 3, createdAt);
    }

    @Test
    @DisplayName("Only the oldest unsynced record of an entity is eligible")
    void testPerEntityHead() {
        MutationRecord create = record(EntityType.CUSTOMER, 1, MutationOperation.CREATE, MutationPriority.NORMAL, T0);
        MutationRecord update = record(EntityType.CUSTOMER, 1, MutationOperation.UPDATE, MutationPriority.CRITICAL,
                T0.plusSeconds(1));

        List<MutationRecord> eligible = EligibilitySelector.select(List.of(update, create), T0.plusSeconds(5), 10, Set.of());

        assertEquals(List.of(create), eligible, "Higher priority never lets an update overtake its create");
    }

    @Test
    @DisplayName("A synced head lets the next record of the entity through")
    void testSyncedHeadSkipped() {
        MutationRecord create = record(EntityType.CUSTOMER, 1, MutationOperation.CREATE, MutationPriority.NORMAL, T0)
                .markSyncing(T0).markSynced("c-1", T0);
        MutationRecord update = record(EntityType.CUSTOMER, 1, MutationOperation.UPDATE, MutationPriority.NORMAL,
                T0.plusSeconds(1));

        List<MutationRecord> eligible = EligibilitySelector.select(List.of(create, update), T0.plusSeconds(5), 10, Set.of());

        assertEquals(List.of(update), eligible);
    }

    @Test
    @DisplayName("A CONFLICT head blocks later records of the same entity")
    void testConflictHeadBlocks() {
        MutationRecord failed = record(EntityType.INVENTORY, 7, MutationOperation.CREATE, MutationPriority.NORMAL, T0)
                .markSyncing(T0).markConflict("rejected", T0);
        MutationRecord movement = record(EntityType.INVENTORY, 7, MutationOperation.UPDATE, MutationPriority.HIGH,
                T0.plusSeconds(1));
        MutationRecord other = record(EntityType.INVENTORY, 8, MutationOperation.CREATE, MutationPriority.NORMAL,
                T0.plusSeconds(2));

        List<MutationRecord> eligible = EligibilitySelector.select(List.of(failed, movement, other),
                T0.plusSeconds(5), 10, Set.of());

        assertEquals(List.of(other), eligible);
        assertEquals(SyncStatus.CONFLICT, failed.getStatus());
    }

    @Test
    @DisplayName("Records in a backoff window are not eligible and still block their entity")
    void testBackoffWindow() {
        MutationRecord backingOff = record(EntityType.CUSTOMER, 3, MutationOperation.CREATE, MutationPriority.NORMAL, T0)
                .markSyncing(T0).markTransientFailure("timeout", T0);
        MutationRecord next = record(EntityType.CUSTOMER, 3, MutationOperation.UPDATE, MutationPriority.NORMAL,
                T0.plusSeconds(1));

        assertTrue(EligibilitySelector.select(List.of(backingOff, next), T0.plusSeconds(30), 10, Set.of()).isEmpty());
        assertEquals(List.of(backingOff),
                EligibilitySelector.select(List.of(backingOff, next), T0.plusSeconds(600), 10, Set.of()));
    }

    @Test
    @DisplayName("Eligible records drain by priority, then age")
    void testDrainOrder() {
        MutationRecord normalOld = record(EntityType.CUSTOMER, 1, MutationOperation.CREATE, MutationPriority.NORMAL, T0);
        MutationRecord highNew = record(EntityType.TRANSACTION, 2, MutationOperation.CREATE, MutationPriority.HIGH,
                T0.plusSeconds(10));
        MutationRecord critical = record(EntityType.TRANSACTION, 3, MutationOperation.UPDATE, MutationPriority.CRITICAL,
                T0.plusSeconds(20));
        MutationRecord normalNew = record(EntityType.CUSTOMER, 4, MutationOperation.CREATE, MutationPriority.NORMAL,
                T0.plusSeconds(30));

        List<MutationRecord> eligible = EligibilitySelector.select(
                List.of(normalNew, normalOld, highNew, critical), T0.plusSeconds(60), 10, Set.of());

        assertEquals(List.of(critical, highNew, normalOld, normalNew), eligible);
    }

    @Test
    @DisplayName("Excluded records and the limit are honoured")
    void testExcludedAndLimit() {
        MutationRecord a = record(EntityType.CUSTOMER, 1, MutationOperation.CREATE, MutationPriority.NORMAL, T0);
        MutationRecord b = record(EntityType.CUSTOMER, 2, MutationOperation.CREATE, MutationPriority.NORMAL,
                T0.plusSeconds(1));
        MutationRecord c = record(EntityType.CUSTOMER, 3, MutationOperation.CREATE, MutationPriority.NORMAL,
                T0.plusSeconds(2));

        List<MutationRecord> eligible = EligibilitySelector.select(List.of(a, b, c), T0.plusSeconds(5), 1,
                Set.of(a.getId()));

        assertEquals(List.of(b), eligible);
    }
}
