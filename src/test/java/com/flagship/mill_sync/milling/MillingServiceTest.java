package com.flagship.mill_sync.milling;

import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.common.InsufficientStockException;
import com.flagship.mill_sync.common.ValidationException;
import com.flagship.mill_sync.inventory.InventoryItemDetails;
import com.flagship.mill_sync.inventory.InventoryItemEntity;
import com.flagship.mill_sync.inventory.InventoryService;
import com.flagship.mill_sync.inventory.ItemType;
import com.flagship.mill_sync.queue.MutationPriority;
import com.flagship.mill_sync.queue.MutationRecord;
import com.flagship.mill_sync.queue.SyncQueueService;
import com.flagship.mill_sync.queue.payload.StockMovementPayload;
import com.flagship.mill_sync.remote.ConnectivityMonitor;
import com.flagship.mill_sync.remote.RemoteApi;
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
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Milling moves paddy into rice and carries the paddy cost over.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class MillingServiceTest {

    @MockBean
    private RemoteApi remoteApi;

    @Autowired
    private MillingService millingService;

    @Autowired
    private InventoryService inventoryService;

    @Autowired
    private StockLedgerService stockLedger;

    @Autowired
    private SyncQueueService syncQueue;

    @Autowired
    private ConnectivityMonitor connectivity;

    @Autowired
    private MutableClock clock;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private final ScriptedRemote remote = new ScriptedRemote();

    private InventoryItemEntity paddy;
    private InventoryItemEntity rice;

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

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    @BeforeEach
    void setUp() {
        TestDatabase.clean(jdbcTemplate);
        clock.reset();
        remote.reset();
        when(remoteApi.send(any())).thenAnswer(invocation -> remote.answer(invocation.getArgument(0)));
        connectivity.reportConnectivity(true);

        paddy = inventoryService.createInventoryItem(InventoryItemDetails.builder()
                .itemType(ItemType.PADDY)
                .name("Keeri Samba Paddy")
                .variety("Keeri Samba")
                .build(), new BigDecimal("1000"), 20, new BigDecimal("50"));
        rice = inventoryService.createInventoryItem(InventoryItemDetails.builder()
                .itemType(ItemType.RICE)
                .name("Keeri Samba Rice")
                .variety("Keeri Samba")
                .build(), BigDecimal.ZERO, 0, null);
    }

    private RecordMillingCommand.RecordMillingCommandBuilder milling(String paddyKg, String riceKg) {
        return RecordMillingCommand.builder()
                .paddyItemId(paddy.getLocalId())
                .riceItemId(rice.getLocalId())
                .paddyQuantity(new BigDecimal(paddyKg))
                .riceQuantity(new BigDecimal(riceKg))
                .paddyBags(20)
                .riceBags(13);
    }

    @Test
    @DisplayName("Milling deducts paddy, adds rice and records wastage")
    void testRecordMilling() {
        printTestHeader("Mill 1000 kg paddy into 650 kg rice");

        MillingRecordEntity record = millingService.recordMilling(milling("1000", "650").build());
        printOutput("Milling", record.getLocalId());

        assertEquals(0, new BigDecimal("350").compareTo(record.getWastageQuantity()));
        assertEquals(0, new BigDecimal("65.00").compareTo(record.getMillingPercentage()));

        InventoryItemEntity paddyAfter = inventoryService.findById(paddy.getLocalId()).orElseThrow();
        InventoryItemEntity riceAfter = inventoryService.findById(rice.getLocalId()).orElseThrow();
        assertEquals(0, paddyAfter.getCurrentQuantity().signum());
        assertEquals(0, paddyAfter.getCurrentBags());
        assertEquals(0, new BigDecimal("650").compareTo(riceAfter.getCurrentQuantity()));
        assertEquals(13, riceAfter.getCurrentBags());
        assertEquals(0, new BigDecimal("76.9231").compareTo(riceAfter.getAveragePricePerKg()),
                "Paddy cost is carried into the rice price");

        List<StockMovement> movements = stockLedger.findByReference(EntityRef.of(EntityType.MILLING, record.getLocalId()));
        assertEquals(2, movements.size());
        assertTrue(movements.stream().anyMatch(m -> m.getMovementType() == MovementType.MILLING_OUT
                && m.getQuantityDelta().compareTo(new BigDecimal("-1000")) == 0));
        assertTrue(movements.stream().anyMatch(m -> m.getMovementType() == MovementType.MILLING_IN
                && m.getQuantityDelta().compareTo(new BigDecimal("650")) == 0));
        assertTrue(stockLedger.isConsistent(paddyAfter));
        assertTrue(stockLedger.isConsistent(riceAfter));

        printSuccess("Stock moved and wastage recorded");
    }

    @Test
    @DisplayName("Milling queues the record and both stock movements")
    void testMillingQueuesMutations() {
        printTestHeader("Queue entries of a milling run");

        MillingRecordEntity record = millingService.recordMilling(milling("400", "260").paddyBags(8).riceBags(5).build());

        assertEquals(1, syncQueue.findForEntity(EntityRef.of(EntityType.MILLING, record.getLocalId())).size());
        for (InventoryItemEntity item : List.of(paddy, rice)) {
            List<MutationRecord> movementRecords = syncQueue.findForEntity(EntityRef.of(EntityType.INVENTORY, item.getLocalId()))
                    .stream()
                    .filter(r -> r.getPayload() instanceof StockMovementPayload payload
                            && (payload.getMovementType() == MovementType.MILLING_OUT
                            || payload.getMovementType() == MovementType.MILLING_IN))
                    .toList();
            assertEquals(1, movementRecords.size());
            assertEquals(MutationPriority.HIGH, movementRecords.get(0).getPriority());
        }

        printSuccess("Three mutations queued");
    }

    @Test
    @DisplayName("Milling more paddy than on hand is rejected")
    void testInsufficientPaddy() {
        printTestHeader("Mill 1200 kg from 1000 kg");

        long before = syncQueue.countPending();
        InsufficientStockException e = assertThrows(InsufficientStockException.class,
                () -> millingService.recordMilling(milling("1200", "700").build()));
        printExpectedException("InsufficientStockException", e.getMessage());

        assertEquals(before, syncQueue.countPending());
        assertEquals(0, new BigDecimal("1000").compareTo(
                inventoryService.findById(paddy.getLocalId()).orElseThrow().getCurrentQuantity()));
        assertTrue(millingService.findAll().isEmpty());

        printSuccess("Nothing recorded");
    }

    @Test
    @DisplayName("Invalid milling input is rejected")
    void testValidation() {
        printTestHeader("Invalid milling commands");

        assertThrows(ValidationException.class,
                () -> millingService.recordMilling(milling("500", "600").build()),
                "More rice than paddy");
        assertThrows(ValidationException.class,
                () -> millingService.recordMilling(milling("0", "0").build()),
                "Zero paddy");
        assertThrows(ValidationException.class,
                () -> millingService.recordMilling(milling("500", "300").riceItemId(paddy.getLocalId()).build()),
                "Same item on both sides");
        assertThrows(ValidationException.class,
                () -> millingService.recordMilling(milling("500", "300")
                        .paddyItemId(rice.getLocalId())
                        .riceItemId(paddy.getLocalId())
                        .build()),
                "Rice used as input");
        printExpectedException("ValidationException", "every command rejected");

        printSuccess("No milling recorded");
        assertTrue(millingService.findAll().isEmpty());
    }
}
