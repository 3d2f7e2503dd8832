package com.flagship.mill_sync.customer;

import com.flagship.mill_sync.common.SyncStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CustomerRepository extends JpaRepository<CustomerEntity, Long> {

    boolean existsByPhoneAndDeletedFalse(String phone);

    boolean existsByPhoneAndDeletedFalseAndLocalIdNot(String phone, Long localId);

    Optional<CustomerEntity> findByServerId(String serverId);

    List<CustomerEntity> findBySyncStatusNot(SyncStatus status);

    List<CustomerEntity> findByDeletedFalseOrderByNameAsc();
}
