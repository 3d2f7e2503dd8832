package com.flagship.mill_sync.sync;

import com.fasterxml.jackson.databind.node.NullNode;
import com.flagship.mill_sync.api.SyncFacade;
import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.common.FailureType;
import com.flagship.mill_sync.common.OperationResult;
import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.customer.CustomerDetails;
import com.flagship.mill_sync.customer.CustomerEntity;
import com.flagship.mill_sync.customer.CustomerService;
import com.flagship.mill_sync.customer.CustomerType;
import com.flagship.mill_sync.inventory.InventoryItemDetails;
import com.flagship.mill_sync.inventory.InventoryItemEntity;
import com.flagship.mill_sync.inventory.InventoryService;
import com.flagship.mill_sync.inventory.ItemType;
import com.flagship.mill_sync.payment.PaymentMethod;
import com.flagship.mill_sync.queue.MutationOperation;
import com.flagship.mill_sync.queue.MutationRecord;
import com.flagship.mill_sync.queue.SyncQueueService;
import com.flagship.mill_sync.queue.payload.StockMovementPayload;
import com.flagship.mill_sync.remote.ConnectivityMonitor;
import com.flagship.mill_sync.remote.RemoteApi;
import com.flagship.mill_sync.remote.RemoteRequest;
import com.flagship.mill_sync.remote.RemoteResult;
import com.flagship.mill_sync.support.MutableClock;
import com.flagship.mill_sync.support.ScriptedRemote;
import com.flagship.mill_sync.support.TestClockConfig;
import com.flagship.mill_sync.support.TestDatabase;
import com.flagship.mill_sync.transaction.CreateTransactionCommand;
import com.flagship.mill_sync.transaction.LineItemCommand;
import com.flagship.mill_sync.transaction.TransactionEntity;
import com.flagship.mill_sync.transaction.TransactionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpMethod;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static com.flagship.mill_sync.support.ScriptedRemote.method;
import static com.flagship.mill_sync.support.ScriptedRemote.path;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Push side of a sync pass against a scripted remote: outcome routing,
 * backoff, per-entity order, deferral, auth and cancellation.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class SyncOrchestratorTest {

    @MockBean
    private RemoteApi remoteApi;

    @Autowired
    private SyncOrchestrator orchestrator;

    @Autowired
    private SyncQueueService syncQueue;

    @Autowired
    private LedgerReconciler reconciler;

    @Autowired
    private SyncFacade facade;

    @Autowired
    private CustomerService customerService;

    @Autowired
    private InventoryService inventoryService;

    @Autowired
    private TransactionService transactionService;

    @Autowired
    private ConnectivityMonitor connectivity;

    @Autowired
    private MutableClock clock;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private final ScriptedRemote remote = new ScriptedRemote();

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        TestDatabase.clean(jdbcTemplate);
        clock.reset();
        remote.reset();
        when(remoteApi.send(any())).thenAnswer(invocation -> remote.answer(invocation.getArgument(0)));
        connectivity.reportConnectivity(true);
    }

    private CustomerEntity customer(String name, String phone) {
        return customerService.createCustomer(CustomerDetails.builder()
                .name(name)
                .phone(phone)
                .customerType(CustomerType.FARMER)
                .build());
    }

    private InventoryItemEntity paddy(BigDecimal openingQuantity) {
        return inventoryService.createInventoryItem(InventoryItemDetails.builder()
                .itemType(ItemType.PADDY)
                .name("Samba Paddy")
                .variety("Samba")
                .build(), openingQuantity, 0, openingQuantity.signum() > 0 ? new BigDecimal("60") : null);
    }

    private MutationRecord onlyRecord(EntityType type, long localId) {
        List<MutationRecord> records = syncQueue.findForEntity(EntityRef.of(type, localId));
        assertEquals(1, records.size());
        return records.get(0);
    }

    private static RemoteResult failure(FailureType type, int status) {
        return RemoteResult.failure(type, "scripted " + status, status);
    }

    @Test
    @DisplayName("A synced create stores the server id and marks the record SYNCED")
    void testCreateSyncs() {
        printTestHeader("Create customer and sync");

        CustomerEntity sunil = customer("Sunil Perera", "0771234567");
        MutationRecord record = onlyRecord(EntityType.CUSTOMER, sunil.getLocalId());

        SyncPassResult pass = orchestrator.runSyncPass();
        printOutput("Pass", pass);

        assertEquals(1, pass.getAttempted());
        assertEquals(1, pass.getSucceeded());
        RemoteRequest sent = remote.writes().get(0);
        assertEquals(HttpMethod.POST, sent.getMethod());
        assertEquals("/customers", sent.getPath());
        assertEquals(record.getId().toString(), sent.getIdempotencyKey());
        assertEquals(sunil.getLocalId(), sent.getBody().get("local_id").asLong());

        CustomerEntity synced = customerService.findById(sunil.getLocalId()).orElseThrow();
        assertNotNull(synced.getServerId());
        assertEquals(SyncStatus.SYNCED, synced.getSyncStatus());
        MutationRecord done = syncQueue.findById(record.getId()).orElseThrow();
        assertEquals(SyncStatus.SYNCED, done.getStatus());
        assertEquals(synced.getServerId(), done.getEntityServerId());

        printSuccess("Customer synced as " + synced.getServerId());
    }

    @Test
    @DisplayName("Transient failures back off and end in FAILED once the budget is spent")
    void testTransientFailureBacksOffUntilFailed() {
        printTestHeader("Server keeps answering 503");

        remote.always(path("/customers"), request -> failure(FailureType.SERVER, 503));
        CustomerEntity sunil = customer("Sunil Perera", "0771234567");
        MutationRecord record = onlyRecord(EntityType.CUSTOMER, sunil.getLocalId());

        SyncPassResult first = orchestrator.runSyncPass();
        assertEquals(1, first.getRetried());
        MutationRecord afterFirst = syncQueue.findById(record.getId()).orElseThrow();
        assertEquals(SyncStatus.PENDING, afterFirst.getStatus());
        assertEquals(1, afterFirst.getRetryCount());
        assertEquals(clock.instant().plus(Duration.ofMinutes(2)), afterFirst.getNextRetryAt());
        assertNotNull(afterFirst.getErrorMessage());

        SyncPassResult tooEarly = orchestrator.runSyncPass();
        assertEquals(0, tooEarly.getAttempted(), "Record is still inside its backoff window");

        clock.advance(Duration.ofMinutes(2));
        SyncPassResult second = orchestrator.runSyncPass();
        assertEquals(1, second.getRetried());
        assertEquals(2, syncQueue.findById(record.getId()).orElseThrow().getRetryCount());

        clock.advance(Duration.ofMinutes(4));
        SyncPassResult third = orchestrator.runSyncPass();
        printOutput("Third pass", third);
        assertEquals(1, third.getFailed());

        MutationRecord failed = syncQueue.findById(record.getId()).orElseThrow();
        assertEquals(SyncStatus.FAILED, failed.getStatus());
        assertEquals(3, failed.getRetryCount());
        assertEquals(SyncStatus.FAILED, customerService.findById(sunil.getLocalId()).orElseThrow().getSyncStatus());

        clock.advance(Duration.ofHours(2));
        int sentBefore = remote.writes().size();
        orchestrator.runSyncPass();
        assertEquals(sentBefore, remote.writes().size(), "FAILED records are not retried automatically");

        printSuccess("Three attempts, then FAILED");
    }

    @Test
    @DisplayName("A rejected payload becomes CONFLICT without consuming the retry budget")
    void testConflictIsTerminalUntilRetried() {
        printTestHeader("Remote answers 409");

        remote.always(path("/customers"), request -> failure(FailureType.CONFLICT, 409));
        CustomerEntity sunil = customer("Sunil Perera", "0771234567");
        MutationRecord record = onlyRecord(EntityType.CUSTOMER, sunil.getLocalId());

        SyncPassResult pass = orchestrator.runSyncPass();
        assertEquals(1, pass.getConflicted());
        MutationRecord conflicted = syncQueue.findById(record.getId()).orElseThrow();
        assertEquals(SyncStatus.CONFLICT, conflicted.getStatus());
        assertEquals(0, conflicted.getRetryCount());
        assertEquals(SyncStatus.CONFLICT, customerService.findById(sunil.getLocalId()).orElseThrow().getSyncStatus());

        clock.advance(Duration.ofHours(1));
        orchestrator.runSyncPass();
        assertEquals(1, remote.writes().size(), "A CONFLICT record is never resent on its own");

        List<SyncProblem> problems = facade.getProblems().getOrThrow();
        assertEquals(1, problems.size());
        assertEquals(record.getId(), problems.get(0).getRecordId());

        remote.reset();
        SyncProblem retried = facade.retryRecord(record.getId()).getOrThrow();
        assertEquals(SyncStatus.PENDING, retried.getStatus());

        SyncPassResult afterRetry = orchestrator.runSyncPass();
        assertEquals(1, afterRetry.getSucceeded());
        assertEquals(SyncStatus.SYNCED, customerService.findById(sunil.getLocalId()).orElseThrow().getSyncStatus());

        printSuccess("Conflict resolved by an explicit retry");
    }

    @Test
    @DisplayName("Discarding a conflict accepts the local state")
    void testDiscardConflict() {
        printTestHeader("Discard a CONFLICT record");

        remote.always(path("/customers"), request -> failure(FailureType.VALIDATION, 422));
        CustomerEntity sunil = customer("Sunil Perera", "0771234567");
        MutationRecord record = onlyRecord(EntityType.CUSTOMER, sunil.getLocalId());
        orchestrator.runSyncPass();

        OperationResult<SyncProblem> pendingDiscard = facade.discardRecord(record.getId());
        assertTrue(pendingDiscard.isSuccess());
        assertTrue(syncQueue.findById(record.getId()).isEmpty());
        assertTrue(facade.getProblems().getOrThrow().isEmpty());

        OperationResult<SyncProblem> again = facade.discardRecord(record.getId());
        assertFalse(again.isSuccess());
        assertEquals(FailureType.NOT_FOUND, again.getFailure().getType());

        printSuccess("Record closed; a second discard is reported as not found");
    }

    @Test
    @DisplayName("Work that needs the server id of a discarded create becomes a conflict")
    void testFollowUpsOfDiscardedCreateSurface() {
        printTestHeader("Edit and buy after discarding a rejected create");

        remote.always(path("/customers"), request -> failure(FailureType.VALIDATION, 422));
        CustomerEntity sunil = customer("Sunil Perera", "0771234567");
        InventoryItemEntity samba = paddy(BigDecimal.ZERO);
        MutationRecord create = onlyRecord(EntityType.CUSTOMER, sunil.getLocalId());
        orchestrator.runSyncPass();
        assertTrue(facade.discardRecord(create.getId()).isSuccess());

        customerService.updateCustomer(sunil.getLocalId(), CustomerDetails.builder()
                .name("Sunil K. Perera")
                .phone("0771234567")
                .customerType(CustomerType.FARMER)
                .build());
        TransactionEntity buy = transactionService.createBuyTransaction(CreateTransactionCommand.builder()
                .customerId(sunil.getLocalId())
                .line(new LineItemCommand(samba.getLocalId(), new BigDecimal("100"), 2, new BigDecimal("55")))
                .paidAmount(BigDecimal.ZERO)
                .paymentMethod(PaymentMethod.CASH)
                .build());

        remote.reset();
        clock.advance(Duration.ofHours(2));
        SyncPassResult pass = orchestrator.runSyncPass();
        printOutput("Pass", pass);

        MutationRecord update = onlyRecord(EntityType.CUSTOMER, sunil.getLocalId());
        assertEquals(MutationOperation.UPDATE, update.getOperation());
        assertEquals(SyncStatus.CONFLICT, update.getStatus());
        assertEquals(0, update.getRetryCount());
        assertEquals(SyncStatus.CONFLICT, onlyRecord(EntityType.TRANSACTION, buy.getLocalId()).getStatus());
        assertEquals(SyncStatus.CONFLICT, customerService.findById(sunil.getLocalId()).orElseThrow().getSyncStatus());

        List<SyncProblem> problems = facade.getProblems().getOrThrow();
        assertTrue(problems.stream().anyMatch(problem -> problem.getRecordId().equals(update.getId())));
        assertTrue(remote.writes().stream().noneMatch(r -> r.getPath().startsWith("/customers")
                || r.getPath().startsWith("/transactions")));

        printSuccess("Stranded records listed as problems instead of waiting forever");
    }

    @Test
    @DisplayName("Only CONFLICT records can be discarded")
    void testDiscardPendingRefused() {
        printTestHeader("Discard a PENDING record");

        CustomerEntity sunil = customer("Sunil Perera", "0771234567");
        MutationRecord record = onlyRecord(EntityType.CUSTOMER, sunil.getLocalId());

        OperationResult<SyncProblem> result = facade.discardRecord(record.getId());
        assertFalse(result.isSuccess());
        assertEquals(FailureType.CONFLICT, result.getFailure().getType());
        assertEquals(SyncStatus.PENDING, syncQueue.findById(record.getId()).orElseThrow().getStatus());

        printSuccess("PENDING record left untouched");
    }

    @Test
    @DisplayName("A later mutation of the same entity waits for the earlier one")
    void testPerEntityOrder() {
        printTestHeader("Delete queued behind a create in backoff");

        remote.once(path("/customers"), request -> failure(FailureType.NETWORK, 0));
        CustomerEntity sunil = customer("Sunil Perera", "0771234567");
        orchestrator.runSyncPass();

        customerService.deleteCustomer(sunil.getLocalId());
        List<MutationRecord> records = syncQueue.findForEntity(EntityRef.of(EntityType.CUSTOMER, sunil.getLocalId()));
        assertEquals(2, records.size());
        MutationRecord delete = records.get(1);
        assertEquals(MutationOperation.DELETE, delete.getOperation());

        SyncPassResult blocked = orchestrator.runSyncPass();
        assertEquals(0, blocked.getAttempted(), "Delete may not overtake the create");
        assertEquals(SyncStatus.PENDING, syncQueue.findById(delete.getId()).orElseThrow().getStatus());

        clock.advance(Duration.ofMinutes(2));
        SyncPassResult pass = orchestrator.runSyncPass();
        printOutput("Pass", pass);
        assertEquals(2, pass.getSucceeded());

        List<RemoteRequest> writes = remote.writes();
        RemoteRequest create = writes.get(writes.size() - 2);
        RemoteRequest remove = writes.get(writes.size() - 1);
        assertEquals(HttpMethod.POST, create.getMethod());
        assertEquals(HttpMethod.DELETE, remove.getMethod());
        String serverId = customerService.findById(sunil.getLocalId()).orElseThrow().getServerId();
        assertEquals("/customers/" + serverId, remove.getPath());

        printSuccess("Create then delete, in order");
    }

    @Test
    @DisplayName("A 404 on delete counts as done")
    void testDeleteOfMissingRemoteEntity() {
        printTestHeader("Delete of a customer already gone on the remote");

        CustomerEntity sunil = customer("Sunil Perera", "0771234567");
        orchestrator.runSyncPass();
        customerService.deleteCustomer(sunil.getLocalId());

        remote.always(method(HttpMethod.DELETE, "/customers"), request -> failure(FailureType.VALIDATION, 404));
        SyncPassResult pass = orchestrator.runSyncPass();

        assertEquals(1, pass.getSucceeded());
        assertEquals(0, pass.getConflicted());
        assertEquals(0, syncQueue.countPending());

        printSuccess("Delete confirmed");
    }

    @Test
    @DisplayName("Records waiting for a parent's server id are deferred, not failed")
    void testDeferredWhileParentConflicted() {
        printTestHeader("Buy from a customer the remote rejects");

        remote.always(path("/customers"), request -> failure(FailureType.CONFLICT, 409));
        CustomerEntity sunil = customer("Sunil Perera", "0771234567");
        InventoryItemEntity samba = paddy(BigDecimal.ZERO);
        TransactionEntity buy = transactionService.createBuyTransaction(CreateTransactionCommand.builder()
                .customerId(sunil.getLocalId())
                .line(new LineItemCommand(samba.getLocalId(), new BigDecimal("100"), 2, new BigDecimal("55")))
                .paidAmount(BigDecimal.ZERO)
                .paymentMethod(PaymentMethod.CASH)
                .build());

        SyncPassResult pass = orchestrator.runSyncPass();
        printOutput("Pass", pass);

        assertEquals(1, pass.getConflicted());
        assertTrue(pass.getDeferred() >= 1);
        MutationRecord transaction = onlyRecord(EntityType.TRANSACTION, buy.getLocalId());
        assertEquals(SyncStatus.PENDING, transaction.getStatus());
        assertEquals(0, transaction.getRetryCount());
        assertTrue(remote.writes().stream().noneMatch(r -> r.getPath().startsWith("/transactions")));
        assertNotNull(inventoryService.findById(samba.getLocalId()).orElseThrow().getServerId(),
                "Independent work still syncs");

        printSuccess("Transaction waits for its customer");
    }

    @Test
    @DisplayName("Replaying a confirmed reply changes nothing")
    void testReplayIsIdempotent() {
        printTestHeader("Confirm a synced stock movement twice");

        InventoryItemEntity samba = paddy(new BigDecimal("100"));
        orchestrator.runSyncPass();

        MutationRecord movement = syncQueue.findForEntity(EntityRef.of(EntityType.INVENTORY, samba.getLocalId()))
                .stream()
                .filter(r -> r.getPayload() instanceof StockMovementPayload)
                .findFirst()
                .orElseThrow();
        assertEquals(SyncStatus.SYNCED, movement.getStatus());
        InventoryItemEntity before = inventoryService.findById(samba.getLocalId()).orElseThrow();

        MutationRecord replayed = reconciler.confirm(movement, "srv-other", NullNode.getInstance());

        InventoryItemEntity after = inventoryService.findById(samba.getLocalId()).orElseThrow();
        assertEquals(movement.getEntityServerId(), replayed.getEntityServerId());
        assertEquals(before.getServerId(), after.getServerId());
        assertEquals(0, before.getCurrentQuantity().compareTo(after.getCurrentQuantity()));
        assertEquals(0, new BigDecimal("100").compareTo(after.getCurrentQuantity()));

        printSuccess("Stock and server ids unchanged");
    }

    @Test
    @DisplayName("Creates of one type travel in a single batch call")
    void testBatchCreate() {
        printTestHeader("Two customers, one call");

        CustomerEntity sunil = customer("Sunil Perera", "0771234567");
        CustomerEntity nimal = customer("Nimal Silva", "0777654321");

        SyncPassResult pass = orchestrator.runSyncPass();
        printOutput("Pass", pass);

        assertEquals(2, pass.getSucceeded());
        List<RemoteRequest> writes = remote.writes();
        assertEquals(1, writes.size());
        assertEquals("/customers/batch", writes.get(0).getPath());
        assertEquals(2, writes.get(0).getBody().get("customers").size());
        assertNotNull(customerService.findById(sunil.getLocalId()).orElseThrow().getServerId());
        assertNotNull(customerService.findById(nimal.getLocalId()).orElseThrow().getServerId());

        printSuccess("Both customers acknowledged by local id");
    }

    @Test
    @DisplayName("An auth failure stops the pass and leaves records PENDING")
    void testAuthRequiredStopsPass() {
        printTestHeader("Remote answers 401");

        remote.always(path("/customers"), request -> failure(FailureType.AUTH, 401));
        CustomerEntity sunil = customer("Sunil Perera", "0771234567");
        CustomerEntity nimal = customer("Nimal Silva", "0777654321");

        SyncPassResult pass = orchestrator.runSyncPass();
        printOutput("Pass", pass);

        assertTrue(pass.isAuthRequired());
        for (CustomerEntity customer : List.of(sunil, nimal)) {
            MutationRecord record = onlyRecord(EntityType.CUSTOMER, customer.getLocalId());
            assertEquals(SyncStatus.PENDING, record.getStatus());
            assertEquals(0, record.getRetryCount());
            assertNull(record.getNextRetryAt());
        }
        assertTrue(remote.requests().stream().noneMatch(r -> r.getMethod() == HttpMethod.GET),
                "No pull after an auth failure");

        printSuccess("Pass stopped, nothing consumed");
    }

    @Test
    @DisplayName("Cancelling a pass releases in-flight and untouched records")
    void testCancelReleasesRecords() {
        printTestHeader("Cancel during the first call");

        remote.once(path("/"), request -> {
            orchestrator.cancelCurrentPass();
            return remote.defaultReply(request);
        });
        CustomerEntity sunil = customer("Sunil Perera", "0771234567");
        InventoryItemEntity samba = paddy(BigDecimal.ZERO);

        SyncPassResult pass = orchestrator.runSyncPass();
        printOutput("Pass", pass);

        assertTrue(pass.isCancelled());
        assertEquals(1, remote.writes().size());
        for (MutationRecord record : List.of(onlyRecord(EntityType.CUSTOMER, sunil.getLocalId()),
                onlyRecord(EntityType.INVENTORY, samba.getLocalId()))) {
            assertEquals(SyncStatus.PENDING, record.getStatus());
            assertEquals(0, record.getRetryCount());
        }
        assertFalse(orchestrator.isPassRunning());

        SyncPassResult next = orchestrator.runSyncPass();
        assertEquals(2, next.getSucceeded());

        printSuccess("Both records sent by the next pass");
    }

    @Test
    @DisplayName("Records left SYNCING by a crash return to PENDING")
    void testRecoverInterrupted() {
        printTestHeader("Recover a record stuck in SYNCING");

        CustomerEntity sunil = customer("Sunil Perera", "0771234567");
        MutationRecord record = onlyRecord(EntityType.CUSTOMER, sunil.getLocalId());
        syncQueue.claim(record.getId()).orElseThrow();
        assertEquals(SyncStatus.SYNCING, syncQueue.findById(record.getId()).orElseThrow().getStatus());

        orchestrator.recoverInterruptedRecords();

        MutationRecord recovered = syncQueue.findById(record.getId()).orElseThrow();
        assertEquals(SyncStatus.PENDING, recovered.getStatus());
        assertEquals(0, recovered.getRetryCount());
        assertTrue(recovered.isDueAt(clock.instant()));

        printSuccess("Record eligible again without backoff");
    }

    @Test
    @DisplayName("Unsynced rows with no queue entry are re-enqueued before the push")
    void testRepairMissingMutations() {
        printTestHeader("Queue row lost for an unsynced customer");

        CustomerEntity sunil = customer("Sunil Perera", "0771234567");
        jdbcTemplate.update("DELETE FROM mutation_records");

        SyncPassResult pass = orchestrator.runSyncPass();
        printOutput("Pass", pass);

        assertEquals(1, pass.getRepaired());
        assertEquals(1, pass.getSucceeded());
        assertNotNull(customerService.findById(sunil.getLocalId()).orElseThrow().getServerId());

        printSuccess("Customer repaired and synced");
    }

    @Test
    @DisplayName("A pass is skipped while offline")
    void testOfflineSkip() {
        printTestHeader("Offline pass");

        customer("Sunil Perera", "0771234567");
        connectivity.reportConnectivity(false);

        SyncPassResult pass = orchestrator.runSyncPass();

        assertTrue(pass.isSkipped());
        assertEquals("offline", pass.getSkippedReason());
        assertTrue(remote.requests().isEmpty());
        assertEquals(1, facade.getPendingSyncCount().getOrThrow());

        printSuccess("Nothing sent, record still pending");
    }
}
