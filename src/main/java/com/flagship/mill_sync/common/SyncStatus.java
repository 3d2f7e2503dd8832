package com.flagship.mill_sync.common;

/**
 * Sync state shared by mutation records and the ledger rows they describe.
 *
 * State machine for a mutation record:
 * PENDING -> SYNCING -> SYNCED | PENDING (retry) | FAILED | CONFLICT
 *
 * SYNCED, FAILED and CONFLICT are terminal for the record. FAILED and
 * CONFLICT only leave through an explicit reset by the user.
 *
 * A ledger row mirrors the outcome of its outstanding records and is never
 * SYNCING itself.
 */
public enum SyncStatus {
    PENDING,
    SYNCING,
    SYNCED,
    FAILED,
    CONFLICT
}
