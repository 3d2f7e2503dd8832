package com.flagship.mill_sync.common;

import jakarta.persistence.Column;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Transient;
import lombok.Getter;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Sync metadata carried by every local-first ledger row.
 *
 * The local id is assigned by the device before the row is first saved; the
 * server id stays null until the row's own create mutation has synced. The
 * sync engine may only fill the server id, flip the sync status and apply
 * server-returned canonical values. Everything else is written by domain
 * operations through the subclass methods.
 */
@MappedSuperclass
@Getter
public abstract class LedgerRecord implements Persistable<Long> {

    @Id
    @Column(name = "local_id", nullable = false, updatable = false)
    private Long localId;

    @Column(name = "server_id", length = 64)
    private String serverId;

    @Enumerated(EnumType.STRING)
    @Column(name = "sync_status", nullable = false, length = 16)
    private SyncStatus syncStatus;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "synced_at")
    private Instant syncedAt;

    @Transient
    private boolean fresh;

    protected LedgerRecord() {
        // JPA
    }

    protected LedgerRecord(long localId, Instant now) {
        this.localId = localId;
        this.syncStatus = SyncStatus.PENDING;
        this.createdAt = now;
        this.updatedAt = now;
        this.fresh = true;
    }

    @Override
    public Long getId() {
        return localId;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.fresh = false;
    }

    public boolean isSynced() {
        return syncStatus == SyncStatus.SYNCED;
    }

    /**
     * Records a local modification. The row is unsynced until the mutation
     * describing this change reaches the remote.
     */
    public void touch(Instant now) {
        this.updatedAt = now;
        this.syncStatus = SyncStatus.PENDING;
    }

    /**
     * Records a change the remote derives on its own (for example the paid
     * amount of a transaction after a payment). The sync status is kept.
     */
    protected void stampUpdated(Instant now) {
        this.updatedAt = now;
    }

    /**
     * Soft delete. The row stays until its delete mutation is confirmed.
     */
    public void markDeleted(Instant now) {
        this.deleted = true;
        touch(now);
    }

    /**
     * Fills the server id once. A later, different id is ignored so a
     * replayed create never rewrites the identity.
     *
     * @return true if the id was assigned by this call
     */
    public boolean assignServerId(String serverId) {
        if (serverId == null || this.serverId != null) {
            return false;
        }
        this.serverId = serverId;
        return true;
    }

    public void markSyncStatus(SyncStatus status, Instant now) {
        if (status == SyncStatus.SYNCING) {
            throw new IllegalArgumentException("Ledger rows are never SYNCING");
        }
        this.syncStatus = status;
        if (status == SyncStatus.SYNCED) {
            this.syncedAt = now;
        }
    }

    /**
     * Applies a change that originated on the remote: the row adopts the
     * remote modification time and is considered in sync.
     */
    protected void acceptRemote(Instant remoteUpdatedAt, Instant now) {
        this.updatedAt = remoteUpdatedAt;
        this.syncStatus = SyncStatus.SYNCED;
        this.syncedAt = now;
    }
}
