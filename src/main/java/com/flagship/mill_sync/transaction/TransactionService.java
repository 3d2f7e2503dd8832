package com.flagship.mill_sync.transaction;

import com.flagship.mill_sync.common.EntityNotFoundException;
import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.common.LocalIdAllocator;
import com.flagship.mill_sync.common.ValidationException;
import com.flagship.mill_sync.customer.CustomerEntity;
import com.flagship.mill_sync.customer.CustomerRepository;
import com.flagship.mill_sync.inventory.InventoryItemEntity;
import com.flagship.mill_sync.inventory.InventoryItemRepository;
import com.flagship.mill_sync.queue.MutationOperation;
import com.flagship.mill_sync.queue.MutationPriority;
import com.flagship.mill_sync.queue.SyncQueueService;
import com.flagship.mill_sync.queue.payload.CustomerPayload;
import com.flagship.mill_sync.queue.payload.StockMovementPayload;
import com.flagship.mill_sync.queue.payload.TransactionCancelPayload;
import com.flagship.mill_sync.queue.payload.TransactionPayload;
import com.flagship.mill_sync.stock.MovementType;
import com.flagship.mill_sync.stock.StockLedgerService;
import com.flagship.mill_sync.stock.StockMovement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
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
 * Buy, sell and cancel.
 *
 * Each operation is one local transaction covering the transaction row,
 * its stock movements, the customer balance and every mutation record
 * describing those changes. A validation failure is raised before anything
 * is written, and any later failure rolls the whole unit back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionService {

    private final TransactionRepository transactionRepository;
    private final CustomerRepository customerRepository;
    private final InventoryItemRepository inventoryRepository;
    private final StockLedgerService stockLedger;
    private final SyncQueueService syncQueue;
    private final TransactionNumberGenerator numberGenerator;
    private final LocalIdAllocator idAllocator;
    private final Clock clock;

    /**
     * Buys from a customer: stock is added at the line price and the
     * weighted average price recomputed.
     */
    @Transactional
    public TransactionEntity createBuyTransaction(CreateTransactionCommand command) {
        return create(TransactionType.BUY, command);
    }

    /**
     * Sells to a customer. Every line is checked against the stock on hand
     * before the first deduction, so an insufficient line rejects the whole
     * sale.
     */
    @Transactional
    public TransactionEntity createSellTransaction(CreateTransactionCommand command) {
        return create(TransactionType.SELL, command);
    }

    private TransactionEntity create(TransactionType type, CreateTransactionCommand command) {
        validateCommand(command);
        Instant now = clock.instant();

        CustomerEntity customer = loadCustomer(command.getCustomerId());
        Map<Long, InventoryItemEntity> items = loadItems(command.getLines());

        if (type == TransactionType.SELL) {
            requireStockForLines(command.getLines(), items);
        }

        TransactionEntity transaction = new TransactionEntity(idAllocator.nextId(), now, type,
                numberGenerator.next(type), customer.getLocalId(), command.getPaymentMethod(), command.getNotes());
        for (LineItemCommand line : command.getLines()) {
            InventoryItemEntity item = items.get(line.getInventoryItemId());
            transaction.addItem(new TransactionItemEntity(idAllocator.nextId(), now, item.getLocalId(),
                    item.getItemType(), item.getVariety(), line.getBags(), line.getQuantity(), line.getPricePerKg()));
        }

        BigDecimal discount = orZero(command.getDiscount());
        BigDecimal paid = orZero(command.getPaidAmount());
        transaction.settleTotals(discount, paid);
        if (transaction.getTotalAmount().signum() < 0) {
            throw new ValidationException("Discount cannot exceed the subtotal of " + transaction.getSubtotal());
        }
        if (paid.compareTo(transaction.getTotalAmount()) > 0) {
            throw new ValidationException("Paid amount cannot exceed the total of " + transaction.getTotalAmount());
        }

        transactionRepository.save(transaction);
        EntityRef reference = EntityRef.of(EntityType.TRANSACTION, transaction.getLocalId());

        List<StockMovement> movements = new ArrayList<>();
        for (LineItemCommand line : command.getLines()) {
            InventoryItemEntity item = items.get(line.getInventoryItemId());
            StockMovement movement = type == TransactionType.BUY
                    ? stockLedger.addStock(item, line.getQuantity(), line.getBags(), line.getPricePerKg(),
                            MovementType.STOCK_IN, reference, transaction.getTransactionNumber())
                    : stockLedger.deductStock(item, line.getQuantity(), line.getBags(),
                            MovementType.STOCK_OUT, reference, transaction.getTransactionNumber());
            movements.add(movement);
        }

        if (type == TransactionType.BUY) {
            customer.recordPurchase(transaction.getTotalAmount(), transaction.getDueAmount(), now);
        } else {
            customer.recordSale(transaction.getTotalAmount(), transaction.getDueAmount(), now);
        }

        syncQueue.enqueue(reference, null, MutationOperation.CREATE, MutationPriority.HIGH,
                TransactionPayload.from(transaction));
        enqueueMovements(movements, items, MutationPriority.HIGH);
        enqueueCustomer(customer);

        log.info("Created {} transaction {}: customer={}, lines={}, total={}",
                type, transaction.getTransactionNumber(), customer.getLocalId(),
                transaction.getItems().size(), transaction.getTotalAmount());

        return transaction;
    }

    /**
     * Cancels a transaction with compensating stock movements of the same
     * magnitude as the originals, whether or not the transaction has synced.
     * Cancelling a buy whose stock has since left the mill is rejected.
     */
    @Transactional
    public TransactionEntity cancelTransaction(long transactionId, String reason) {
        TransactionEntity transaction = transactionRepository.findById(transactionId)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.TRANSACTION, transactionId));
        if (transaction.isCancelled()) {
            throw new ValidationException("Transaction " + transaction.getTransactionNumber() + " is already cancelled");
        }
        Instant now = clock.instant();

        EntityRef reference = EntityRef.of(EntityType.TRANSACTION, transactionId);
        Map<Long, InventoryItemEntity> items = new LinkedHashMap<>();
        for (TransactionItemEntity line : transaction.getItems()) {
            items.computeIfAbsent(line.getInventoryItemLocalId(), this::loadItem);
        }

        String movementReason = "Cancel " + transaction.getTransactionNumber()
                + (reason != null && !reason.isBlank() ? ": " + reason : "");
        List<StockMovement> reversals = stockLedger.reverse(reference, new ArrayList<>(items.values()), movementReason);

        CustomerEntity customer = loadCustomer(transaction.getCustomerLocalId());
        if (transaction.getTransactionType() == TransactionType.BUY) {
            customer.reversePurchase(transaction.getTotalAmount(), transaction.getDueAmount(), now);
        } else {
            customer.reverseSale(transaction.getTotalAmount(), transaction.getDueAmount(), now);
        }

        transaction.cancel(reason, now);

        syncQueue.enqueue(reference, transaction.getServerId(), MutationOperation.UPDATE, MutationPriority.CRITICAL,
                new TransactionCancelPayload(reason, now));
        enqueueMovements(reversals, items, MutationPriority.CRITICAL);
        enqueueCustomer(customer);

        log.info("Cancelled transaction {}: reversals={}, reason={}",
                transaction.getTransactionNumber(), reversals.size(), reason);

        return transaction;
    }

    @Transactional(readOnly = true)
    public Optional<TransactionEntity> findById(long transactionId) {
        return transactionRepository.findById(transactionId);
    }

    private void enqueueMovements(List<StockMovement> movements, Map<Long, InventoryItemEntity> items,
                                  MutationPriority priority) {
        for (StockMovement movement : movements) {
            InventoryItemEntity item = items.get(movement.getInventoryItemLocalId());
            syncQueue.enqueue(EntityRef.of(EntityType.INVENTORY, item.getLocalId()), item.getServerId(),
                    MutationOperation.UPDATE, priority, StockMovementPayload.from(movement));
        }
    }

    private void enqueueCustomer(CustomerEntity customer) {
        syncQueue.enqueue(EntityRef.of(EntityType.CUSTOMER, customer.getLocalId()), customer.getServerId(),
                MutationOperation.UPDATE, MutationPriority.NORMAL, CustomerPayload.from(customer));
    }

    private void requireStockForLines(List<LineItemCommand> lines, Map<Long, InventoryItemEntity> items) {
        Map<Long, BigDecimal> requested = new LinkedHashMap<>();
        for (LineItemCommand line : lines) {
            requested.merge(line.getInventoryItemId(), line.getQuantity(), BigDecimal::add);
        }
        requested.forEach((itemId, quantity) -> stockLedger.requireAvailable(items.get(itemId), quantity));
    }

    private void validateCommand(CreateTransactionCommand command) {
        if (command.getLines() == null || command.getLines().isEmpty()) {
            throw new ValidationException("A transaction needs at least one line item");
        }
        for (LineItemCommand line : command.getLines()) {
            if (line.getQuantity() == null || line.getQuantity().signum() <= 0) {
                throw new ValidationException("Line quantity must be greater than zero");
            }
            if (line.getPricePerKg() == null || line.getPricePerKg().signum() < 0) {
                throw new ValidationException("Line price per kg must be zero or positive");
            }
            if (line.getBags() < 0) {
                throw new ValidationException("Line bags must be zero or positive");
            }
        }
        if (orZero(command.getDiscount()).signum() < 0) {
            throw new ValidationException("Discount must be zero or positive");
        }
        if (orZero(command.getPaidAmount()).signum() < 0) {
            throw new ValidationException("Paid amount must be zero or positive");
        }
    }

    private CustomerEntity loadCustomer(long customerId) {
        CustomerEntity customer = customerRepository.findById(customerId)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.CUSTOMER, customerId));
        if (customer.isDeleted()) {
            throw new ValidationException("Customer " + customerId + " has been deleted");
        }
        return customer;
    }

    private Map<Long, InventoryItemEntity> loadItems(List<LineItemCommand> lines) {
        Map<Long, InventoryItemEntity> items = new LinkedHashMap<>();
        for (LineItemCommand line : lines) {
            InventoryItemEntity item = items.computeIfAbsent(line.getInventoryItemId(), this::loadItem);
            if (item.isDeleted()) {
                throw new ValidationException("Inventory item " + item.getLocalId() + " has been deleted");
            }
        }
        return items;
    }

    private InventoryItemEntity loadItem(long itemId) {
        return inventoryRepository.findById(itemId)
                .orElseThrow(() -> new EntityNotFoundException(EntityType.INVENTORY, itemId));
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
