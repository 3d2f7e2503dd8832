package com.flagship.mill_sync.milling;

import com.flagship.mill_sync.common.EntityNotFoundException;
import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.common.LocalIdAllocator;
import com.flagship.mill_sync.common.ValidationException;
import com.flagship.mill_sync.inventory.InventoryItemEntity;
import com.flagship.mill_sync.inventory.InventoryItemRepository;
import com.flagship.mill_sync.inventory.ItemType;
import com.flagship.mill_sync.queue.MutationOperation;
import com.flagship.mill_sync.queue.MutationPriority;
import com.flagship.mill_sync.queue.SyncQueueService;
import com.flagship.mill_sync.queue.payload.MillingPayload;
import com.flagship.mill_sync.queue.payload.StockMovementPayload;
import com.flagship.mill_sync.stock.MovementType;
import com.flagship.mill_sync.stock.StockCalculator;
import com.flagship.mill_sync.stock.StockLedgerService;
import com.flagship.mill_sync.stock.StockMovement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;

/**
 * Milling: paddy out of one item, rice into another, and the audit record,
 * all in one local transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MillingService {

    private final MillingRepository millingRepository;
    private final InventoryItemRepository inventoryRepository;
    private final StockLedgerService stockLedger;
    private final SyncQueueService syncQueue;
    private final LocalIdAllocator idAllocator;
    private final Clock clock;

    /**
     * Records a milling run. The cost of the consumed paddy is carried into
     * the rice average price.
     */
    @Transactional
    public MillingRecordEntity recordMilling(RecordMillingCommand command) {
        validate(command);

        InventoryItemEntity paddy = loadItem(command.getPaddyItemId());
        InventoryItemEntity rice = loadItem(command.getRiceItemId());
        if (paddy.getItemType() != ItemType.PADDY) {
            throw new ValidationException("Item " + paddy.getLocalId() + " is not paddy");
        }
        if (rice.getItemType() == ItemType.PADDY) {
            throw new ValidationException("Milling output item " + rice.getLocalId() + " cannot be paddy");
        }
        stockLedger.requireAvailable(paddy, command.getPaddyQuantity());

        MillingRecordEntity record = new MillingRecordEntity(idAllocator.nextId(), clock.instant(),
                paddy.getLocalId(), rice.getLocalId(), command.getPaddyQuantity(), command.getRiceQuantity(),
                command.getPaddyBags(), command.getRiceBags(), command.getNotes());
        millingRepository.save(record);

        EntityRef reference = EntityRef.of(EntityType.MILLING, record.getLocalId());
        BigDecimal riceCost = StockCalculator.carriedCost(
                command.getPaddyQuantity(), paddy.getAveragePricePerKg(), command.getRiceQuantity());
        String reason = "Milling " + record.getLocalId();

        StockMovement paddyOut = stockLedger.deductStock(paddy, command.getPaddyQuantity(), command.getPaddyBags(),
                MovementType.MILLING_OUT, reference, reason);
        StockMovement riceIn = stockLedger.addStock(rice, command.getRiceQuantity(), command.getRiceBags(), riceCost,
                MovementType.MILLING_IN, reference, reason);

        syncQueue.enqueue(reference, null, MutationOperation.CREATE, MutationPriority.NORMAL,
                MillingPayload.from(record));
        syncQueue.enqueue(EntityRef.of(EntityType.INVENTORY, paddy.getLocalId()), paddy.getServerId(),
                MutationOperation.UPDATE, MutationPriority.HIGH, StockMovementPayload.from(paddyOut));
        syncQueue.enqueue(EntityRef.of(EntityType.INVENTORY, rice.getLocalId()), rice.getServerId(),
                MutationOperation.UPDATE, MutationPriority.HIGH, StockMovementPayload.from(riceIn));

        log.info("Recorded milling {}: paddy={} kg from item {}, rice={} kg into item {}, wastage={} kg",
                record.getLocalId(), record.getPaddyQuantity(), paddy.getLocalId(),
                record.getRiceQuantity(), rice.getLocalId(), record.getWastageQuantity());

        return record;
    }

    @Transactional(readOnly = true)
    public List<MillingRecordEntity> findAll() {
        return millingRepository.findAllByOrderByMillingDateDesc();
    }

    private static void validate(RecordMillingCommand command) {
        if (command.getPaddyItemId() == command.getRiceItemId()) {
            throw new ValidationException("Paddy and rice items must be different");
        }
        if (command.getPaddyQuantity() == null || command.getPaddyQuantity().signum() <= 0) {
            throw new ValidationException("Paddy quantity must be greater than zero");
        }
        if (command.getRiceQuantity() == null || command.getRiceQuantity().signum() <= 0) {
            throw new ValidationException("Rice quantity must be greater than zero");
        }
        if (command.getRiceQuantity().compareTo(command.getPaddyQuantity()) > 0) {
            throw new ValidationException("Rice quantity cannot exceed paddy quantity");
        }
        if (command.getPaddyBags() < 0 || command.getRiceBags() < 0) {
            throw new ValidationException("Bag counts must be zero or positive");
        }
    }

    private InventoryItemEntity loadItem(long itemId) {
        InventoryItemEntity item = inventoryRepository.findById(itemId)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.INVENTORY, itemId));
        if (item.isDeleted()) {
            throw new ValidationException("Inventory item " + itemId + " has been deleted");
        }
        return item;
    }
}
