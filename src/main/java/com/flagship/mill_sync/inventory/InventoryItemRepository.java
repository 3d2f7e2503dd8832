package com.flagship.mill_sync.inventory;

import com.flagship.mill_sync.common.SyncStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface InventoryItemRepository extends JpaRepository<InventoryItemEntity, Long> {

    Optional<InventoryItemEntity> findByServerId(String serverId);

    List<InventoryItemEntity> findBySyncStatusNot(SyncStatus status);

    List<InventoryItemEntity> findByDeletedFalseOrderByNameAsc();

    @Query("""
        SELECT i FROM InventoryItemEntity i
        WHERE i.deleted = false AND i.currentQuantity <= i.minimumStock
        ORDER BY i.name ASC
        """)
    List<InventoryItemEntity> findLowStock();
}
