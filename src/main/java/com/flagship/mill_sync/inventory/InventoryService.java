package com.flagship.mill_sync.inventory;

import com.flagship.mill_sync.common.EntityNotFoundException;
import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.common.LocalIdAllocator;
import com.flagship.mill_sync.common.ValidationException;
import com.flagship.mill_sync.queue.MutationOperation;
import com.flagship.mill_sync.queue.MutationPriority;
import com.flagship.mill_sync.queue.SyncQueueService;
import com.flagship.mill_sync.queue.payload.InventoryItemPayload;
import com.flagship.mill_sync.queue.payload.StockMovementPayload;
import com.flagship.mill_sync.stock.MovementType;
import com.flagship.mill_sync.stock.StockLedgerService;
import com.flagship.mill_sync.stock.StockMovement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Inventory items and manual stock corrections.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InventoryService {

    private final InventoryItemRepository repository;
    private final StockLedgerService stockLedger;
    private final SyncQueueService syncQueue;
    private final LocalIdAllocator idAllocator;
    private final Clock clock;

    /**
     * Creates an item, optionally with opening stock recorded as an INITIAL
     * movement queued behind the item's create.
     */
    @Transactional
    public InventoryItemEntity createInventoryItem(InventoryItemDetails details, BigDecimal openingQuantity,
                                                   int openingBags, BigDecimal openingPricePerKg) {
        if (details.getItemType() == null) {
            throw new ValidationException("Item type is required");
        }
        if (details.getName() == null || details.getName().isBlank()) {
            throw new ValidationException("Item name is required");
        }
        if (openingQuantity != null && openingQuantity.signum() < 0) {
            throw new ValidationException("Opening quantity must be zero or positive");
        }

        InventoryItemEntity item = new InventoryItemEntity(idAllocator.nextId(), clock.instant(), details);
        // movements reference the row through a foreign key
        repository.saveAndFlush(item);

        StockMovement opening = null;
        if (openingQuantity != null && openingQuantity.signum() > 0) {
            opening = stockLedger.addStock(item, openingQuantity, openingBags, openingPricePerKg,
                    MovementType.INITIAL, null, "Opening stock");
        }

        EntityRef ref = ref(item);
        syncQueue.enqueue(ref, null, MutationOperation.CREATE, MutationPriority.NORMAL,
                InventoryItemPayload.from(item));
        if (opening != null) {
            syncQueue.enqueue(ref, null, MutationOperation.UPDATE, MutationPriority.NORMAL,
                    StockMovementPayload.from(opening));
        }

        log.info("Created inventory item {}: type={}, name={}, opening={}",
                item.getLocalId(), item.getItemType(), item.getName(), item.getCurrentQuantity());
        return item;
    }

    /**
     * Updates descriptive fields. Quantities only change through movements.
     */
    @Transactional
    public InventoryItemEntity updateInventoryItem(long itemId, InventoryItemDetails details) {
        if (details.getName() == null || details.getName().isBlank()) {
            throw new ValidationException("Item name is required");
        }
        InventoryItemEntity item = loadActive(itemId);
        item.updateDetails(details, clock.instant());

        syncQueue.enqueue(ref(item), item.getServerId(), MutationOperation.UPDATE, MutationPriority.NORMAL,
                InventoryItemPayload.from(item));

        log.info("Updated inventory item {}", itemId);
        return item;
    }

    /**
     * Corrects stock to a counted quantity and bag count.
     */
    @Transactional
    public StockMovement adjustStock(long itemId, BigDecimal quantity, int bags, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("A reason is required for stock adjustments");
        }
        InventoryItemEntity item = loadActive(itemId);
        StockMovement movement = stockLedger.adjustTo(item, quantity, bags, reason);

        syncQueue.enqueue(ref(item), item.getServerId(), MutationOperation.UPDATE, MutationPriority.HIGH,
                StockMovementPayload.from(movement));

        log.info("Adjusted stock of item {} by {} kg: {}", itemId, movement.getQuantityDelta(), reason);
        return movement;
    }

    @Transactional(readOnly = true)
    public Optional<InventoryItemEntity> findById(long itemId) {
        return repository.findById(itemId);
    }

    @Transactional(readOnly = true)
    public List<InventoryItemEntity> findAll() {
        return repository.findByDeletedFalseOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public List<InventoryItemEntity> findLowStock() {
        return repository.findLowStock();
    }

    @Transactional(readOnly = true)
    public List<StockMovement> findMovements(long itemId) {
        return stockLedger.findByItem(itemId);
    }

    private InventoryItemEntity loadActive(long itemId) {
        InventoryItemEntity item = repository.findById(itemId)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.INVENTORY, itemId));
        if (item.isDeleted()) {
            throw new EntityNotFoundException(EntityType.INVENTORY, itemId);
        }
        return item;
    }

    private static EntityRef ref(InventoryItemEntity item) {
        return EntityRef.of(EntityType.INVENTORY, item.getLocalId());
    }
}
