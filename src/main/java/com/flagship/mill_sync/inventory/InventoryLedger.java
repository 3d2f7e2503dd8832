package com.flagship.mill_sync.inventory;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.common.LocalIdAllocator;
import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.queue.MutationOperation;
import com.flagship.mill_sync.queue.MutationPriority;
import com.flagship.mill_sync.queue.MutationRecord;
import com.flagship.mill_sync.queue.SyncQueueService;
import com.flagship.mill_sync.queue.payload.InventoryItemPayload;
import com.flagship.mill_sync.queue.payload.StockMovementPayload;
import com.flagship.mill_sync.stock.StockLedgerService;
import com.flagship.mill_sync.stock.StockMovement;
import com.flagship.mill_sync.sync.EntityLedger;
import com.flagship.mill_sync.sync.RemoteFields;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Inventory items and their stock movements. A movement travels as an
 * update of its item, so its outcome is also written to the movement row.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InventoryLedger implements EntityLedger {

    private final InventoryItemRepository repository;
    private final StockLedgerService stockLedger;
    private final SyncQueueService syncQueue;
    private final LocalIdAllocator idAllocator;
    private final Clock clock;

    @Override
    public EntityType entityType() {
        return EntityType.INVENTORY;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> findServerId(long localId) {
        return repository.findById(localId).map(InventoryItemEntity::getServerId);
    }

    @Override
    @Transactional
    public void applySuccess(MutationRecord record, String remoteId, JsonNode canonical) {
        if (record.getPayload() instanceof StockMovementPayload movement) {
            stockLedger.markSynced(movement.getMovementLocalId(), remoteId);
            return;
        }
        if (record.getOperation() == MutationOperation.CREATE) {
            repository.findById(record.getEntityId()).ifPresent(item -> {
                if (!item.assignServerId(remoteId) && !remoteId.equals(item.getServerId())) {
                    log.warn("Inventory item {} keeps server id {}, reply carried {}",
                            item.getLocalId(), item.getServerId(), remoteId);
                }
            });
        }
    }

    @Override
    public void onRecordStatus(MutationRecord record) {
        if (record.getPayload() instanceof StockMovementPayload movement) {
            stockLedger.markStatus(movement.getMovementLocalId(), record.getStatus());
        }
    }

    @Override
    public void onDiscarded(MutationRecord record) {
        if (record.getPayload() instanceof StockMovementPayload movement) {
            stockLedger.markSynced(movement.getMovementLocalId(), null);
        }
    }

    @Override
    @Transactional
    public void updateSyncStatus(long localId, SyncStatus status) {
        repository.findById(localId).ifPresent(item -> item.markSyncStatus(status, clock.instant()));
    }

    /**
     * An item without a queue entry gets its snapshot re-enqueued if it never
     * synced or has no unsent movements; unsent movements are re-enqueued in
     * ledger order behind it.
     */
    @Override
    @Transactional
    public int repairMissingMutations() {
        Map<Long, List<StockMovement>> unsentMovements = new LinkedHashMap<>();
        for (StockMovement movement : stockLedger.findUnsynced()) {
            unsentMovements.computeIfAbsent(movement.getInventoryItemLocalId(), id -> new ArrayList<>()).add(movement);
        }
        Map<Long, InventoryItemEntity> candidates = new LinkedHashMap<>();
        repository.findBySyncStatusNot(SyncStatus.SYNCED).forEach(item -> candidates.put(item.getLocalId(), item));
        unsentMovements.keySet().forEach(id -> repository.findById(id).ifPresent(item -> candidates.putIfAbsent(id, item)));

        int enqueued = 0;
        for (InventoryItemEntity item : candidates.values()) {
            EntityRef ref = EntityRef.of(EntityType.INVENTORY, item.getLocalId());
            if (syncQueue.hasOutstanding(ref)) {
                continue;
            }
            List<StockMovement> movements = unsentMovements.getOrDefault(item.getLocalId(), List.of());
            if (item.getServerId() == null) {
                syncQueue.enqueue(ref, null, MutationOperation.CREATE, MutationPriority.NORMAL,
                        InventoryItemPayload.from(item));
                enqueued++;
            } else if (movements.isEmpty()) {
                syncQueue.enqueue(ref, item.getServerId(), MutationOperation.UPDATE, MutationPriority.NORMAL,
                        InventoryItemPayload.from(item));
                enqueued++;
            }
            for (StockMovement movement : movements) {
                syncQueue.enqueue(ref, item.getServerId(), MutationOperation.UPDATE, priorityOf(movement),
                        StockMovementPayload.from(movement));
                enqueued++;
            }
        }
        return enqueued;
    }

    @Override
    public Optional<String> pullPath() {
        return Optional.of("/inventory");
    }

    /**
     * Descriptive fields follow the remote; a different remote stock level
     * is recorded as an already synced adjustment, so the movement ledger
     * still sums to the cached quantity.
     */
    @Override
    @Transactional
    public boolean applyRemote(JsonNode remote) {
        String serverId = RemoteFields.text(remote, "id");
        if (serverId == null) {
            return false;
        }
        Instant now = clock.instant();
        Instant remoteUpdatedAt = Optional.ofNullable(RemoteFields.instant(remote, "updated_at")).orElse(now);
        BigDecimal remoteQuantity = RemoteFields.decimal(remote, "current_quantity");
        Integer remoteBags = RemoteFields.integer(remote, "current_bags");

        Optional<InventoryItemEntity> existing = repository.findByServerId(serverId);
        if (existing.isEmpty()) {
            ItemType itemType = RemoteFields.enumValue(remote, "item_type", ItemType.class);
            String name = RemoteFields.text(remote, "name");
            if (itemType == null || name == null) {
                return false;
            }
            InventoryItemDetails details = detailsOf(remote, itemType, null);
            InventoryItemEntity item = new InventoryItemEntity(idAllocator.nextId(), now, details);
            item.assignServerId(serverId);
            repository.saveAndFlush(item);
            reconcileStock(item, remoteQuantity, remoteBags);
            item.applyRemote(details, remoteUpdatedAt, now);
            log.debug("Pulled new inventory item {} as local {}", serverId, item.getLocalId());
            return true;
        }

        InventoryItemEntity item = existing.get();
        if (syncQueue.hasOutstanding(EntityRef.of(EntityType.INVENTORY, item.getLocalId()))) {
            log.debug("Inventory item {} has local changes in flight, remote version ignored", item.getLocalId());
            return false;
        }
        if (!remoteUpdatedAt.isAfter(item.getUpdatedAt())) {
            return false;
        }
        reconcileStock(item, remoteQuantity, remoteBags);
        item.applyRemote(detailsOf(remote, item.getItemType(), item), remoteUpdatedAt, now);
        return true;
    }

    private void reconcileStock(InventoryItemEntity item, BigDecimal remoteQuantity, Integer remoteBags) {
        if (remoteQuantity == null) {
            return;
        }
        int bags = remoteBags != null ? remoteBags : item.getCurrentBags();
        if (remoteQuantity.compareTo(item.getCurrentQuantity()) != 0 || bags != item.getCurrentBags()) {
            stockLedger.recordRemoteAdjustment(item, remoteQuantity, bags);
        }
    }

    private static InventoryItemDetails detailsOf(JsonNode remote, ItemType itemType, InventoryItemEntity local) {
        String name = RemoteFields.text(remote, "name");
        BigDecimal minimumStock = RemoteFields.decimal(remote, "minimum_stock");
        return InventoryItemDetails.builder()
                .itemType(itemType)
                .name(name != null || local == null ? name : local.getName())
                .variety(RemoteFields.text(remote, "variety"))
                .sellingPricePerKg(RemoteFields.decimal(remote, "selling_price_per_kg"))
                .minimumStock(minimumStock != null || local == null ? minimumStock : local.getMinimumStock())
                .warehouseLocation(RemoteFields.text(remote, "warehouse_location"))
                .build();
    }

    private static MutationPriority priorityOf(StockMovement movement) {
        return switch (movement.getMovementType()) {
            case REVERSAL_IN, REVERSAL_OUT -> MutationPriority.CRITICAL;
            case INITIAL -> MutationPriority.NORMAL;
            default -> MutationPriority.HIGH;
        };
    }
}
