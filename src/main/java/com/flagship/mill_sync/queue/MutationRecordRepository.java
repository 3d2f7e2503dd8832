package com.flagship.mill_sync.queue;

import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.common.SyncStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MutationRecordRepository extends JpaRepository<MutationRecordEntity, UUID> {

    /**
     * Every record still owed to the remote, oldest first.
     */
    @Query("""
        SELECT r FROM MutationRecordEntity r
        WHERE r.status <> com.flagship.mill_sync.common.SyncStatus.SYNCED
        ORDER BY r.createdAt ASC, r.sequenceNumber ASC
        """)
    List<MutationRecordEntity> findUnsynced();

    List<MutationRecordEntity> findByEntityTypeAndEntityIdOrderBySequenceNumberAsc(EntityType entityType, long entityId);

    @Query("""
        SELECT r.id FROM MutationRecordEntity r
        WHERE r.entityType = :entityType AND r.entityId = :entityId
        ORDER BY r.sequenceNumber DESC
        """)
    List<UUID> findIdsNewestFirst(@Param("entityType") EntityType entityType, @Param("entityId") long entityId);

    /**
     * Loads a record holding its row lock until the caller's transaction
     * ends, so a concurrent claim waits instead of racing the caller.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM MutationRecordEntity r WHERE r.id = :id")
    Optional<MutationRecordEntity> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
        SELECT r.status FROM MutationRecordEntity r
        WHERE r.entityType = :entityType AND r.entityId = :entityId
          AND r.status <> com.flagship.mill_sync.common.SyncStatus.SYNCED
        """)
    List<SyncStatus> findOutstandingStatuses(@Param("entityType") EntityType entityType,
                                             @Param("entityId") long entityId);

    boolean existsByEntityTypeAndEntityIdAndOperationAndStatusNot(EntityType entityType, long entityId,
                                                                 MutationOperation operation, SyncStatus status);

    List<MutationRecordEntity> findByStatus(SyncStatus status);

    List<MutationRecordEntity> findByStatusInOrderByCreatedAtAsc(Collection<SyncStatus> statuses);

    long countByStatus(SyncStatus status);

    long countByStatusIn(Collection<SyncStatus> statuses);

    @Query("""
        SELECT MIN(r.createdAt) FROM MutationRecordEntity r
        WHERE r.status IN (com.flagship.mill_sync.common.SyncStatus.PENDING,
                           com.flagship.mill_sync.common.SyncStatus.SYNCING)
        """)
    Optional<Instant> findOldestOutstandingCreatedAt();

    @Modifying
    @Query("DELETE FROM MutationRecordEntity r WHERE r.status = com.flagship.mill_sync.common.SyncStatus.SYNCED")
    int deleteSynced();
}
