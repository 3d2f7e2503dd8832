package com.flagship.mill_sync.transaction;

import com.flagship.mill_sync.customer.CustomerDetails;
import com.flagship.mill_sync.customer.CustomerEntity;
import com.flagship.mill_sync.customer.CustomerService;
import com.flagship.mill_sync.customer.CustomerType;
import com.flagship.mill_sync.inventory.InventoryItemDetails;
import com.flagship.mill_sync.inventory.InventoryItemEntity;
import com.flagship.mill_sync.inventory.InventoryService;
import com.flagship.mill_sync.inventory.ItemType;
import com.flagship.mill_sync.payment.PaymentMethod;
import com.flagship.mill_sync.queue.MutationRecordRepository;
import com.flagship.mill_sync.queue.SyncQueueService;
import com.flagship.mill_sync.remote.RemoteApi;
import com.flagship.mill_sync.support.MutableClock;
import com.flagship.mill_sync.support.TestClockConfig;
import com.flagship.mill_sync.support.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.util.AopTestUtils;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;

/**
 * A domain write and the records describing it commit together: a queue
 * write that fails halfway through a buy leaves no trace of the buy.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class TransactionRollbackTest {

    @MockBean
    private RemoteApi remoteApi;

    @SpyBean
    private SyncQueueService syncQueue;

    @Autowired
    private TransactionService transactionService;

    @Autowired
    private CustomerService customerService;

    @Autowired
    private InventoryService inventoryService;

    @Autowired
    private MutationRecordRepository mutationRepository;

    @Autowired
    private MutableClock clock;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private CustomerEntity farmer;
    private InventoryItemEntity paddy;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
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

        farmer = customerService.createCustomer(CustomerDetails.builder()
                .name("Sunil Perera")
                .phone("0771234567")
                .customerType(CustomerType.FARMER)
                .build());
        paddy = inventoryService.createInventoryItem(InventoryItemDetails.builder()
                .itemType(ItemType.PADDY)
                .name("Nadu Paddy")
                .variety("Nadu")
                .build(), new BigDecimal("100"), 2, new BigDecimal("50"));
    }

    private int count(String table) {
        return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
    }

    @Test
    @DisplayName("A failed enqueue rolls back the buy, its stock and its earlier records")
    void testEnqueueFailureRollsBackBuy() {
        printTestHeader("Queue write fails on the second record of a buy");

        long recordsBefore = mutationRepository.count();
        int movementsBefore = count("stock_movements");
        AtomicInteger enqueues = new AtomicInteger();
        doAnswer(invocation -> {
            if (enqueues.incrementAndGet() == 2) {
                throw new IllegalStateException("Queue write failed");
            }
            return invocation.callRealMethod();
        }).when(AopTestUtils.<SyncQueueService>getTargetObject(syncQueue)).enqueue(any(), any(), any(), any(), any());

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> transactionService.createBuyTransaction(CreateTransactionCommand.builder()
                        .customerId(farmer.getLocalId())
                        .line(new LineItemCommand(paddy.getLocalId(), new BigDecimal("400"), 8, new BigDecimal("55")))
                        .paidAmount(new BigDecimal("1000"))
                        .paymentMethod(PaymentMethod.CASH)
                        .build()));
        printExpectedException(e.getClass().getSimpleName(), e.getMessage());

        assertEquals(2, enqueues.get(), "The transaction record was written before the failure");
        assertEquals(0, count("transactions"));
        assertEquals(0, count("transaction_items"));
        assertEquals(movementsBefore, count("stock_movements"));
        assertEquals(recordsBefore, mutationRepository.count());

        InventoryItemEntity item = inventoryService.findById(paddy.getLocalId()).orElseThrow();
        assertEquals(0, new BigDecimal("100").compareTo(item.getCurrentQuantity()));
        assertEquals(2, item.getCurrentBags());
        assertEquals(0, new BigDecimal("50").compareTo(item.getAveragePricePerKg()));

        CustomerEntity customer = customerService.findById(farmer.getLocalId()).orElseThrow();
        assertEquals(0, customer.getBalance().signum());
        assertEquals(0, customer.getTotalPurchases().signum());

        printSuccess("Nothing of the buy survived");
    }
}
