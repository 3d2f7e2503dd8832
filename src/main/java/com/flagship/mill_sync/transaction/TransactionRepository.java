package com.flagship.mill_sync.transaction;

import com.flagship.mill_sync.common.SyncStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TransactionRepository extends JpaRepository<TransactionEntity, Long> {

    long countByTransactionNumberStartingWith(String prefix);

    Optional<TransactionEntity> findByServerId(String serverId);

    List<TransactionEntity> findBySyncStatusNot(SyncStatus status);

    List<TransactionEntity> findByCustomerLocalIdOrderByTransactionDateDesc(long customerLocalId);
}
