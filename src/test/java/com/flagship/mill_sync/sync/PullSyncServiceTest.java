package com.flagship.mill_sync.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.common.FailureType;
import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.customer.CustomerDetails;
import com.flagship.mill_sync.customer.CustomerEntity;
import com.flagship.mill_sync.customer.CustomerService;
import com.flagship.mill_sync.customer.CustomerType;
import com.flagship.mill_sync.inventory.InventoryItemDetails;
import com.flagship.mill_sync.inventory.InventoryItemEntity;
import com.flagship.mill_sync.inventory.InventoryService;
import com.flagship.mill_sync.inventory.ItemType;
import com.flagship.mill_sync.remote.ConnectivityMonitor;
import com.flagship.mill_sync.remote.RemoteApi;
import com.flagship.mill_sync.remote.RemoteRequest;
import com.flagship.mill_sync.remote.RemoteResponse;
import com.flagship.mill_sync.remote.RemoteResult;
import com.flagship.mill_sync.stock.MovementType;
import com.flagship.mill_sync.stock.StockLedgerService;
import com.flagship.mill_sync.stock.StockMovement;
import com.flagship.mill_sync.support.MutableClock;
import com.flagship.mill_sync.support.ScriptedRemote;
import com.flagship.mill_sync.support.TestClockConfig;
import com.flagship.mill_sync.support.TestDatabase;
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
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Last-write-wins merge of rows changed on the remote.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class PullSyncServiceTest {

    @MockBean
    private RemoteApi remoteApi;

    @Autowired
    private PullSyncService pullSyncService;

    @Autowired
    private SyncOrchestrator orchestrator;

    @Autowired
    private SyncStateStore stateStore;

    @Autowired
    private CustomerService customerService;

    @Autowired
    private InventoryService inventoryService;

    @Autowired
    private StockLedgerService stockLedger;

    @Autowired
    private ConnectivityMonitor connectivity;

    @Autowired
    private MutableClock clock;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private final ScriptedRemote remote = new ScriptedRemote();
    private final ObjectMapper mapper = new ObjectMapper();

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

    private void serve(String collection, ObjectNode... rows) {
        ArrayNode body = mapper.createArrayNode();
        for (ObjectNode row : rows) {
            body.add(row);
        }
        remote.always(method(HttpMethod.GET, collection),
                request -> RemoteResult.success(RemoteResponse.ok(body)));
    }

    private ObjectNode remoteCustomer(String id, String name, String phone, Duration age) {
        ObjectNode row = mapper.createObjectNode();
        row.put("id", id);
        row.put("name", name);
        row.put("phone", phone);
        row.put("customer_type", "trader");
        row.put("balance", "1250.00");
        row.put("updated_at", clock.instant().plus(age).toString());
        return row;
    }

    private CustomerEntity syncedCustomer() {
        CustomerEntity customer = customerService.createCustomer(CustomerDetails.builder()
                .name("Sunil Perera")
                .phone("0771234567")
                .customerType(CustomerType.FARMER)
                .build());
        orchestrator.runSyncPass();
        return customerService.findById(customer.getLocalId()).orElseThrow();
    }

    @Test
    @DisplayName("A customer created on the remote is inserted locally")
    void testPullInsertsNewCustomer() {
        printTestHeader("Pull a new remote customer");

        serve("/customers", remoteCustomer("remote-7", "Nimal Silva", "0777654321", Duration.ZERO));

        PullSummary summary = pullSyncService.pullAll(new CancellationToken());
        printOutput("Summary", summary);

        assertEquals(1, summary.getApplied());
        assertFalse(summary.isAuthRequired());
        List<CustomerEntity> customers = customerService.findAll();
        assertEquals(1, customers.size());
        CustomerEntity pulled = customers.get(0);
        assertEquals("remote-7", pulled.getServerId());
        assertEquals(CustomerType.TRADER, pulled.getCustomerType());
        assertEquals(0, new BigDecimal("1250.00").compareTo(pulled.getBalance()));
        assertEquals(SyncStatus.SYNCED, pulled.getSyncStatus());
        assertEquals(0, orchestrator.runSyncPass().getAttempted(), "Pulled rows are not pushed back");

        printSuccess("Customer inserted with its server id");
    }

    @Test
    @DisplayName("A newer remote row wins when nothing is pending locally")
    void testNewerRemoteWins() {
        printTestHeader("Remote rename of a synced customer");

        CustomerEntity local = syncedCustomer();
        serve("/customers", remoteCustomer(local.getServerId(), "Sunil P. Perera", "0771234567", Duration.ofHours(1)));

        PullSummary summary = pullSyncService.pullAll(new CancellationToken());

        assertEquals(1, summary.getApplied());
        assertEquals("Sunil P. Perera", customerService.findById(local.getLocalId()).orElseThrow().getName());
        printSuccess("Remote name applied");
    }

    @Test
    @DisplayName("An older remote row is ignored")
    void testOlderRemoteIgnored() {
        printTestHeader("Stale remote row");

        CustomerEntity local = syncedCustomer();
        serve("/customers", remoteCustomer(local.getServerId(), "Old Name", "0771234567", Duration.ofHours(-1)));

        PullSummary summary = pullSyncService.pullAll(new CancellationToken());

        assertEquals(0, summary.getApplied());
        assertEquals("Sunil Perera", customerService.findById(local.getLocalId()).orElseThrow().getName());
        printSuccess("Local row kept");
    }

    @Test
    @DisplayName("A row with a pending local change keeps the local version")
    void testPendingLocalChangeWins() {
        printTestHeader("Remote edit while a local edit is queued");

        CustomerEntity local = syncedCustomer();
        customerService.updateCustomer(local.getLocalId(), CustomerDetails.builder()
                .name("Sunil Local")
                .phone("0771234567")
                .customerType(CustomerType.FARMER)
                .build());
        serve("/customers", remoteCustomer(local.getServerId(), "Sunil Remote", "0771234567", Duration.ofHours(1)));

        PullSummary summary = pullSyncService.pullAll(new CancellationToken());

        assertEquals(0, summary.getApplied());
        assertEquals("Sunil Local", customerService.findById(local.getLocalId()).orElseThrow().getName());
        printSuccess("Local edit will be pushed over the remote one");
    }

    @Test
    @DisplayName("A different remote stock level becomes a synced adjustment movement")
    void testRemoteStockLevelRecordedAsMovement() {
        printTestHeader("Remote reports 120 kg where 100 kg are known locally");

        InventoryItemEntity samba = inventoryService.createInventoryItem(InventoryItemDetails.builder()
                .itemType(ItemType.PADDY)
                .name("Samba Paddy")
                .build(), new BigDecimal("100"), 2, new BigDecimal("60"));
        orchestrator.runSyncPass();
        String serverId = inventoryService.findById(samba.getLocalId()).orElseThrow().getServerId();

        ObjectNode row = mapper.createObjectNode();
        row.put("id", serverId);
        row.put("item_type", "PADDY");
        row.put("name", "Samba Paddy");
        row.put("current_quantity", "120");
        row.put("current_bags", 3);
        row.put("updated_at", clock.instant().plus(Duration.ofHours(1)).toString());
        serve("/inventory", row);

        PullSummary summary = pullSyncService.pullAll(new CancellationToken());
        assertEquals(1, summary.getApplied());

        InventoryItemEntity after = inventoryService.findById(samba.getLocalId()).orElseThrow();
        assertEquals(0, new BigDecimal("120").compareTo(after.getCurrentQuantity()));
        assertEquals(3, after.getCurrentBags());
        assertTrue(stockLedger.isConsistent(after), "Quantity is still the sum of its movements");

        StockMovement adjustment = stockLedger.findByItem(samba.getLocalId()).stream()
                .filter(m -> m.getMovementType() == MovementType.ADJUSTMENT)
                .findFirst()
                .orElseThrow();
        assertEquals(0, new BigDecimal("20").compareTo(adjustment.getQuantityDelta()));
        assertEquals(SyncStatus.SYNCED, adjustment.getSyncStatus());

        printSuccess("Adjustment of +20 kg recorded");
    }

    @Test
    @DisplayName("The pull watermark advances only after a successful pull")
    void testWatermark() {
        printTestHeader("Incremental pull");

        remote.once(method(HttpMethod.GET, "/inventory"),
                request -> RemoteResult.failure(FailureType.SERVER, "unavailable", 503));

        pullSyncService.pullAll(new CancellationToken());
        assertTrue(stateStore.lastPullAt(EntityType.CUSTOMER).isPresent());
        assertTrue(stateStore.lastPullAt(EntityType.INVENTORY).isEmpty());

        clock.advance(Duration.ofMinutes(5));
        pullSyncService.pullAll(new CancellationToken());

        List<RemoteRequest> customerPulls = remote.requests().stream()
                .filter(r -> r.getPath().startsWith("/customers"))
                .toList();
        assertEquals("/customers", customerPulls.get(0).getPath());
        assertTrue(customerPulls.get(1).getPath().startsWith("/customers?updated_after="));
        assertTrue(stateStore.lastPullAt(EntityType.INVENTORY).isPresent());

        printSuccess("Second pull asks only for newer rows");
    }

    @Test
    @DisplayName("An auth failure stops the pull")
    void testPullAuthRequired() {
        printTestHeader("Pull with an expired session");

        remote.always(method(HttpMethod.GET, "/"), request -> RemoteResult.failure(FailureType.AUTH, "expired", 401));

        PullSummary summary = pullSyncService.pullAll(new CancellationToken());

        assertTrue(summary.isAuthRequired());
        assertEquals(1, remote.requests().size());
        printSuccess("Pull stopped after the first request");
    }
}
