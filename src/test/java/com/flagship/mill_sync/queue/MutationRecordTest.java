package com.flagship.mill_sync.queue;

import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.queue.payload.DeletePayload;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Mutation record state machine: legal transitions, retry budget and
 * stickiness of terminal states.
 */
class MutationRecordTest {

    private static final Instant NOW = Instant.parse("2026-03-01T08:00:00Z");

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private MutationRecord newRecord(int maxRetries) {
        return MutationRecord.create(1L, EntityRef.of(EntityType.CUSTOMER, 42L), "srv-42",
                MutationOperation.DELETE, MutationPriority.NORMAL, new DeletePayload(NOW), maxRetries, NOW);
    }

    @Test
    @DisplayName("New record is PENDING with no retries consumed")
    void testNewRecordIsPending() {
        printTestHeader("New record is PENDING");

        MutationRecord record = newRecord(3);
        printOutput("Status", record.getStatus());

        assertEquals(SyncStatus.PENDING, record.getStatus());
        assertEquals(0, record.getRetryCount());
        assertTrue(record.isDueAt(NOW));
        assertFalse(record.isTerminal());
        printSuccess("Record starts PENDING and due");
    }

    @Test
    @DisplayName("PENDING -> SYNCING -> SYNCED keeps the server id")
    void testHappyPath() {
        printTestHeader("Happy path");

        MutationRecord synced = newRecord(3)
                .markSyncing(NOW)
                .markSynced("ignored", NOW.plusSeconds(1));
        printOutput("Status", synced.getStatus());

        assertEquals(SyncStatus.SYNCED, synced.getStatus());
        assertEquals("srv-42", synced.getEntityServerId(), "Known server id is never replaced");
        assertEquals(NOW, synced.getLastAttemptAt());
        assertTrue(synced.isTerminal());
        printSuccess("Record synced");
    }

    @Test
    @DisplayName("Confirming an already SYNCED record is a no-op")
    void testDuplicateConfirmation() {
        printTestHeader("Duplicate confirmation");

        MutationRecord synced = newRecord(3).markSyncing(NOW).markSynced(null, NOW);
        MutationRecord again = synced.markSynced("other", NOW.plusSeconds(60));

        assertSame(synced, again);
        printSuccess("Replay leaves the record untouched");
    }

    @Test
    @DisplayName("Transient failure goes back to PENDING with a backoff window")
    void testTransientFailureBacksOff() {
        printTestHeader("Transient failure");

        MutationRecord failed = newRecord(3).markSyncing(NOW).markTransientFailure("timeout", NOW);
        printOutput("Next retry", failed.getNextRetryAt());

        assertEquals(SyncStatus.PENDING, failed.getStatus());
        assertEquals(1, failed.getRetryCount());
        assertEquals("timeout", failed.getErrorMessage());
        assertEquals(NOW.plus(Duration.ofMinutes(2)), failed.getNextRetryAt());
        assertFalse(failed.isDueAt(NOW.plusSeconds(60)));
        assertTrue(failed.isDueAt(NOW.plus(Duration.ofMinutes(2))));
        printSuccess("Record waits out its backoff");
    }

    @Test
    @DisplayName("Spending the retry budget makes the record FAILED")
    void testRetryBudgetExhausted() {
        printTestHeader("Retry budget exhausted");

        MutationRecord record = newRecord(2);
        record = record.markSyncing(NOW).markTransientFailure("503", NOW);
        record = record.markSyncing(NOW).markTransientFailure("503 again", NOW);
        printOutput("Status", record.getStatus());

        assertEquals(SyncStatus.FAILED, record.getStatus());
        assertEquals(2, record.getRetryCount());
        assertNull(record.getNextRetryAt());
        assertFalse(record.isDueAt(NOW.plus(Duration.ofDays(1))));
        printSuccess("Record reached FAILED");
    }

    @Test
    @DisplayName("Conflict is terminal and consumes no retry")
    void testConflict() {
        printTestHeader("Conflict");

        MutationRecord conflict = newRecord(3).markSyncing(NOW).markConflict("duplicate phone", NOW);

        assertEquals(SyncStatus.CONFLICT, conflict.getStatus());
        assertEquals(0, conflict.getRetryCount());
        assertTrue(conflict.isTerminal());
        printSuccess("Conflict recorded");
    }

    @Test
    @DisplayName("Terminal records reject every automatic transition")
    void testTerminalStatesAreSticky() {
        printTestHeader("Terminal states are sticky");

        MutationRecord synced = newRecord(3).markSyncing(NOW).markSynced(null, NOW);
        MutationRecord conflict = newRecord(3).markSyncing(NOW).markConflict("stale", NOW);
        MutationRecord failed = newRecord(1).markSyncing(NOW).markTransientFailure("down", NOW);

        for (MutationRecord record : new MutationRecord[]{synced, conflict, failed}) {
            assertThrows(IllegalStateException.class, () -> record.markSyncing(NOW));
            assertThrows(IllegalStateException.class, () -> record.markTransientFailure("x", NOW));
            assertThrows(IllegalStateException.class, () -> record.release(NOW));
        }
        assertThrows(IllegalStateException.class, () -> synced.resetForRetry(NOW));
        printSuccess("Only an explicit reset leaves FAILED or CONFLICT");
    }

    @Test
    @DisplayName("Reset gives a FAILED record a fresh budget")
    void testResetForRetry() {
        printTestHeader("Reset for retry");

        MutationRecord reset = newRecord(1).markSyncing(NOW).markTransientFailure("down", NOW)
                .resetForRetry(NOW.plusSeconds(5));

        assertEquals(SyncStatus.PENDING, reset.getStatus());
        assertEquals(0, reset.getRetryCount());
        assertNull(reset.getErrorMessage());
        assertTrue(reset.isDueAt(NOW.plusSeconds(5)));
        printSuccess("Record is PENDING again");
    }

    @Test
    @DisplayName("Release returns an in-flight record without consuming a retry")
    void testRelease() {
        printTestHeader("Release");

        MutationRecord released = newRecord(3).markSyncing(NOW).release(NOW);

        assertEquals(SyncStatus.PENDING, released.getStatus());
        assertEquals(0, released.getRetryCount());
        assertTrue(released.isDueAt(NOW));
        assertThrows(IllegalStateException.class, () -> newRecord(3).release(NOW));
        printSuccess("Released record is immediately due");
    }

    @Test
    @DisplayName("Update and delete need the entity's own server id")
    void testRequiredServerIds() {
        MutationRecord delete = newRecord(3);

        assertTrue(delete.requiredServerIds().contains(EntityRef.of(EntityType.CUSTOMER, 42L)));
    }
}
