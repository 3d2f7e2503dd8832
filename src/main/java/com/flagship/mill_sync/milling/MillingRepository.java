package com.flagship.mill_sync.milling;

import com.flagship.mill_sync.common.SyncStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MillingRepository extends JpaRepository<MillingRecordEntity, Long> {

    Optional<MillingRecordEntity> findByServerId(String serverId);

    List<MillingRecordEntity> findBySyncStatusNot(SyncStatus status);

    List<MillingRecordEntity> findAllByOrderByMillingDateDesc();
}
