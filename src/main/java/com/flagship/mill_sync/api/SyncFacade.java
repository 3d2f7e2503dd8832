package com.flagship.mill_sync.api;

import com.flagship.mill_sync.common.EntityNotFoundException;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.common.FailureType;
import com.flagship.mill_sync.common.OperationResult;
import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.common.ValidationException;
import com.flagship.mill_sync.customer.CustomerDetails;
import com.flagship.mill_sync.customer.CustomerEntity;
import com.flagship.mill_sync.customer.CustomerService;
import com.flagship.mill_sync.inventory.InventoryItemDetails;
import com.flagship.mill_sync.inventory.InventoryItemEntity;
import com.flagship.mill_sync.inventory.InventoryService;
import com.flagship.mill_sync.milling.MillingRecordEntity;
import com.flagship.mill_sync.milling.MillingService;
import com.flagship.mill_sync.milling.RecordMillingCommand;
import com.flagship.mill_sync.payment.PaymentEntity;
import com.flagship.mill_sync.payment.PaymentMethod;
import com.flagship.mill_sync.payment.PaymentService;
import com.flagship.mill_sync.queue.SyncQueueService;
import com.flagship.mill_sync.remote.ConnectivityMonitor;
import com.flagship.mill_sync.stock.StockMovement;
import com.flagship.mill_sync.sync.LedgerReconciler;
import com.flagship.mill_sync.sync.SyncOrchestrator;
import com.flagship.mill_sync.sync.SyncPassResult;
import com.flagship.mill_sync.sync.SyncProblem;
import com.flagship.mill_sync.sync.SyncStateStore;
import com.flagship.mill_sync.sync.SyncStatusSnapshot;
import com.flagship.mill_sync.sync.SyncTrigger;
import com.flagship.mill_sync.transaction.CreateTransactionCommand;
import com.flagship.mill_sync.transaction.TransactionEntity;
import com.flagship.mill_sync.transaction.TransactionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Entry point of the UI shell into the engine.
 *
 * Every domain write runs synchronously in one local transaction and is
 * visible as soon as the call returns, online or not. Failures come back as
 * {@link OperationResult} values; queue rows never leave the engine.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SyncFacade {

    private final CustomerService customerService;
    private final InventoryService inventoryService;
    private final TransactionService transactionService;
    private final PaymentService paymentService;
    private final MillingService millingService;
    private final SyncQueueService syncQueue;
    private final SyncOrchestrator orchestrator;
    private final SyncTrigger syncTrigger;
    private final LedgerReconciler reconciler;
    private final ConnectivityMonitor connectivity;
    private final SyncStateStore syncState;

    public OperationResult<CustomerEntity> createCustomer(CustomerDetails details) {
        return execute("createCustomer", () -> customerService.createCustomer(details));
    }

    public OperationResult<CustomerEntity> updateCustomer(long customerId, CustomerDetails details) {
        return execute("updateCustomer", () -> customerService.updateCustomer(customerId, details));
    }

    public OperationResult<Void> deleteCustomer(long customerId) {
        return execute("deleteCustomer", () -> {
            customerService.deleteCustomer(customerId);
            return null;
        });
    }

    public OperationResult<InventoryItemEntity> createInventoryItem(InventoryItemDetails details,
                                                                    BigDecimal openingQuantity,
                                                                    int openingBags,
                                                                    BigDecimal openingPricePerKg) {
        return execute("createInventoryItem", () ->
                inventoryService.createInventoryItem(details, openingQuantity, openingBags, openingPricePerKg));
    }

    public OperationResult<InventoryItemEntity> updateInventoryItem(long itemId, InventoryItemDetails details) {
        return execute("updateInventoryItem", () -> inventoryService.updateInventoryItem(itemId, details));
    }

    public OperationResult<StockMovement> adjustStock(long itemId, BigDecimal quantity, int bags, String reason) {
        return execute("adjustStock", () -> inventoryService.adjustStock(itemId, quantity, bags, reason));
    }

    public OperationResult<InventoryItemEntity> findInventoryItem(long itemId) {
        return execute("findInventoryItem", () -> inventoryService.findById(itemId)
                .filter(item -> !item.isDeleted())
                .orElseThrow(() -> new EntityNotFoundException(EntityType.INVENTORY, itemId)));
    }

    public OperationResult<List<StockMovement>> findStockMovements(long itemId) {
        return execute("findStockMovements", () -> inventoryService.findMovements(itemId));
    }

    public OperationResult<TransactionEntity> createBuyTransaction(CreateTransactionCommand command) {
        return execute("createBuyTransaction", () -> transactionService.createBuyTransaction(command));
    }

    public OperationResult<TransactionEntity> createSellTransaction(CreateTransactionCommand command) {
        return execute("createSellTransaction", () -> transactionService.createSellTransaction(command));
    }

    public OperationResult<TransactionEntity> cancelTransaction(long transactionId, String reason) {
        return execute("cancelTransaction", () -> transactionService.cancelTransaction(transactionId, reason));
    }

    public OperationResult<PaymentEntity> recordPayment(long transactionId, BigDecimal amount,
                                                        PaymentMethod method, String notes) {
        return execute("recordPayment", () -> paymentService.recordPayment(transactionId, amount, method, notes));
    }

    public OperationResult<MillingRecordEntity> recordMilling(RecordMillingCommand command) {
        return execute("recordMilling", () -> millingService.recordMilling(command));
    }

    /**
     * Queues a pass on the sync thread. The future completes with the pass
     * result, or a skipped result when offline or already running.
     */
    public CompletableFuture<SyncPassResult> syncNow() {
        return syncTrigger.requestSync("requested by user");
    }

    public OperationResult<Long> getPendingSyncCount() {
        return execute("getPendingSyncCount", syncQueue::countPending);
    }

    public OperationResult<SyncStatusSnapshot> getSyncStatus() {
        return execute("getSyncStatus", () -> SyncStatusSnapshot.builder()
                .pending(syncQueue.countPending())
                .failed(syncQueue.countByStatus(SyncStatus.FAILED))
                .conflicts(syncQueue.countByStatus(SyncStatus.CONFLICT))
                .online(connectivity.isOnline())
                .passRunning(orchestrator.isPassRunning())
                .lastPullAt(syncState.lastPullAt().orElse(null))
                .lastPass(orchestrator.getLastResult().orElse(null))
                .build());
    }

    public OperationResult<List<SyncProblem>> getProblems() {
        return execute("getProblems", () -> syncQueue.findProblems().stream()
                .map(SyncProblem::from)
                .toList());
    }

    /**
     * Gives a FAILED or CONFLICT record a fresh retry budget.
     */
    public OperationResult<SyncProblem> retryRecord(UUID recordId) {
        return execute("retryRecord", () -> SyncProblem.from(reconciler.retry(recordId)));
    }

    /**
     * Accepts the local state of a CONFLICT record's entity and closes the record.
     */
    public OperationResult<SyncProblem> discardRecord(UUID recordId) {
        return execute("discardRecord", () -> SyncProblem.from(reconciler.discard(recordId)));
    }

    public OperationResult<Integer> purgeSynced() {
        return execute("purgeSynced", syncQueue::purgeSynced);
    }

    public void reportConnectivity(boolean online) {
        connectivity.reportConnectivity(online);
    }

    private <T> OperationResult<T> execute(String operation, Supplier<T> action) {
        try {
            return OperationResult.success(action.get());
        } catch (ValidationException e) {
            log.info("{} rejected: {}", operation, e.getMessage());
            return OperationResult.failure(FailureType.VALIDATION, e.getMessage());
        } catch (EntityNotFoundException e) {
            log.info("{} rejected: {}", operation, e.getMessage());
            return OperationResult.failure(FailureType.NOT_FOUND, e.getMessage());
        } catch (IllegalStateException e) {
            log.warn("{} refused: {}", operation, e.getMessage());
            return OperationResult.failure(FailureType.CONFLICT, e.getMessage());
        } catch (DataAccessException e) {
            log.error("{} failed on local storage", operation, e);
            return OperationResult.failure(FailureType.STORAGE, "Local storage error: " + e.getMostSpecificCause().getMessage());
        }
    }
}
