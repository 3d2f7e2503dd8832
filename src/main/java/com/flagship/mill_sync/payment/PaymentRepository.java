package com.flagship.mill_sync.payment;

import com.flagship.mill_sync.common.SyncStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, Long> {

    List<PaymentEntity> findByTransactionLocalIdOrderByPaidAtAsc(long transactionLocalId);

    Optional<PaymentEntity> findByServerId(String serverId);

    List<PaymentEntity> findBySyncStatusNot(SyncStatus status);

    boolean existsByTransactionLocalIdAndSyncStatusNot(long transactionLocalId, SyncStatus status);
}
