package com.flagship.group_ledger.settlement;

import com.flagship.group_ledger.error.ErrorCode;
import com.flagship.group_ledger.error.Outcome;
import com.flagship.group_ledger.event.SettlementCancelledEvent;
import com.flagship.group_ledger.event.SettlementCompletedEvent;
import com.flagship.group_ledger.event.SettlementInitiatedEvent;
import com.flagship.group_ledger.event.SettlementReclaimedEvent;
import com.flagship.group_ledger.membership.InMemoryMembershipOracle;
import com.flagship.group_ledger.observability.LedgerMetrics;
import com.flagship.group_ledger.outbox.OutboxService;
import com.flagship.group_ledger.transfer.InMemoryTransferPrimitive;
import com.flagship.group_ledger.transfer.TransferContentionException;
import com.flagship.group_ledger.transfer.TransferPrimitive;
import com.flagship.group_ledger.transfer.TransferProof;
import com.flagship.group_ledger.transfer.TransferStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Settlement lifecycle against in-memory wallets: exactly-once execution,
 * expiry, authorization and transfer failure handling.
 */
class SettlementServiceTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");
    private static final Duration TTL = Duration.ofHours(1);

    private MutableClock clock;
    private InMemorySettlementStore store;
    private InMemoryTransferPrimitive wallets;
    private OutboxService outboxService;
    private ExecutorService executor;
    private SettlementService settlementService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new InMemorySettlementStore();
        wallets = new InMemoryTransferPrimitive(clock)
            .openAccount("alice", 0)
            .openAccount("bob", 500)
            .openAccount("carol", 20);
        outboxService = mock(OutboxService.class);
        executor = Executors.newFixedThreadPool(4);
        settlementService = newService(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private SettlementService newService(Duration executeTimeout) {
        InMemoryMembershipOracle membership = new InMemoryMembershipOracle()
            .addMembers("trip", "alice", "bob", "carol");
        return new SettlementService(store, wallets, membership, outboxService,
            new LedgerMetrics(new SimpleMeterRegistry()), clock, executor, Duration.ofHours(24), executeTimeout);
    }

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private Settlement initiate(String debtor, String creditor, long amount) {
        return settlementService.initiate(InitiateSettlementCommand.builder()
            .caller(debtor)
            .debtorId(debtor)
            .creditorId(creditor)
            .amount(amount)
            .ttl(TTL)
            .build()).getValue();
    }

    @Test
    @DisplayName("Initiate creates a PENDING settlement expiring after the TTL")
    void testInitiate_CreatesPendingSettlement() {
        printTestHeader("Initiate settlement");

        Settlement settlement = initiate("bob", "alice", 50);

        printOutput("Settlement", settlement);
        assertEquals(SettlementState.PENDING, settlement.getState());
        assertEquals(START, settlement.getCreatedAt());
        assertEquals(START.plus(TTL), settlement.getExpiresAt());
        assertFalse(settlementService.isExecuted(settlement.getId()));
        verify(outboxService).saveEvent(any(SettlementInitiatedEvent.class));
        printSuccess("Settlement is pending");
    }

    @Test
    void testInitiate_DefaultTtl() {
        Settlement settlement = settlementService.initiate(InitiateSettlementCommand.builder()
            .caller("bob").debtorId("bob").creditorId("alice").amount(10).build()).getValue();

        assertEquals(START.plus(Duration.ofHours(24)), settlement.getExpiresAt());
    }

    @Test
    void testInitiate_Rejections() {
        assertEquals(ErrorCode.SAME_PARTIES, initiateFailure("bob", "bob", "bob", 50, TTL, null));
        assertEquals(ErrorCode.INVALID_AMOUNT, initiateFailure("bob", "bob", "alice", 0, TTL, null));
        assertEquals(ErrorCode.NOT_AUTHORIZED, initiateFailure("alice", "bob", "alice", 50, TTL, null));
        assertEquals(ErrorCode.INVALID_TTL, initiateFailure("bob", "bob", "alice", 50, Duration.ZERO, null));
        assertEquals(ErrorCode.INVALID_TTL, initiateFailure("bob", "bob", "alice", 50, Duration.ofSeconds(-1), null));
        assertEquals(ErrorCode.INVALID_TTL,
            initiateFailure("bob", "bob", "alice", 50, Duration.ofSeconds(Long.MAX_VALUE), null));
        assertEquals(ErrorCode.NOT_A_MEMBER, initiateFailure("bob", "bob", "mallory", 50, TTL, "trip"));
        verifyNoInteractions(outboxService);
    }

    @Test
    void testInitiate_WithinGroup() {
        Settlement settlement = settlementService.initiate(InitiateSettlementCommand.builder()
            .caller("bob").debtorId("bob").creditorId("alice").amount(50).ttl(TTL)
            .groupId("trip").expenseRef(7L).build()).getValue();

        assertEquals("trip", settlement.getGroupId());
        assertEquals(7L, settlement.getExpenseRef());
    }

    @Test
    @DisplayName("Execute moves funds once; a second execute is ALREADY_EXECUTED")
    void testExecute_ExactlyOnce() {
        printTestHeader("Execute exactly once");
        Settlement settlement = initiate("bob", "alice", 50);

        Outcome<Settlement> first = settlementService.execute(settlement.getId(), "bob");
        Outcome<Settlement> second = settlementService.execute(settlement.getId(), "bob");

        printOutput("First", first);
        printOutput("Second", second);
        assertTrue(first.isSuccess());
        assertEquals(SettlementState.COMPLETED, first.getValue().getState());
        assertNotNull(first.getValue().getTransferRef());
        assertEquals(ErrorCode.ALREADY_EXECUTED, second.getError().getCode());
        assertEquals(450, wallets.balanceOf("bob"));
        assertEquals(50, wallets.balanceOf("alice"));
        assertEquals(1, wallets.confirmedCount());
        assertTrue(settlementService.isExecuted(settlement.getId()));
        verify(outboxService).saveEvent(any(SettlementCompletedEvent.class));
        printSuccess("Funds moved once");
    }

    @Test
    void testExecute_OnlyDebtor() {
        Settlement settlement = initiate("bob", "alice", 50);

        Outcome<Settlement> outcome = settlementService.execute(settlement.getId(), "alice");

        assertEquals(ErrorCode.NOT_AUTHORIZED, outcome.getError().getCode());
        assertEquals(500, wallets.balanceOf("bob"));
    }

    @Test
    void testExecute_UnknownSettlement() {
        assertEquals(ErrorCode.NOT_FOUND, settlementService.execute(404, "bob").getError().getCode());
        assertFalse(settlementService.isExecuted(404));
        assertEquals(ErrorCode.NOT_FOUND, settlementService.getSettlement(404).getError().getCode());
    }

    @Test
    @DisplayName("Expired settlement cannot execute, stays PENDING, and can then be reclaimed")
    void testExpiry_ExecuteFailsThenReclaim() {
        printTestHeader("Expiry and reclaim");
        Settlement settlement = initiate("bob", "alice", 50);

        assertEquals(ErrorCode.NOT_EXPIRED, settlementService.reclaim(settlement.getId()).getError().getCode());

        clock.advance(TTL);
        assertEquals(ErrorCode.NOT_EXPIRED, settlementService.reclaim(settlement.getId()).getError().getCode(),
            "still executable at the exact expiry instant");

        clock.advance(Duration.ofSeconds(1));
        Outcome<Settlement> execute = settlementService.execute(settlement.getId(), "bob");
        printOutput("Execute after expiry", execute);
        assertEquals(ErrorCode.EXPIRED, execute.getError().getCode());
        assertEquals(SettlementState.PENDING, settlementService.getSettlement(settlement.getId()).getValue().getState());
        assertEquals(List.of(settlement.getId()),
            settlementService.findReclaimable(10).stream().map(Settlement::getId).toList());

        Outcome<Settlement> reclaim = settlementService.reclaim(settlement.getId());
        printOutput("Reclaim", reclaim);
        assertEquals(SettlementState.RECLAIMED, reclaim.getValue().getState());
        assertEquals(ErrorCode.NOT_FOUND, settlementService.getSettlement(settlement.getId()).getError().getCode());
        assertEquals(ErrorCode.NOT_FOUND, settlementService.reclaim(settlement.getId()).getError().getCode());
        assertEquals(500, wallets.balanceOf("bob"));
        verify(outboxService).saveEvent(any(SettlementReclaimedEvent.class));
        printSuccess("Expired settlement reclaimed without moving funds");
    }

    @Test
    void testExecute_AtExactExpiryInstant() {
        Settlement settlement = initiate("bob", "alice", 50);
        clock.advance(TTL);

        assertTrue(settlementService.execute(settlement.getId(), "bob").isSuccess());
    }

    @Test
    @DisplayName("Completed settlements are never reclaimed")
    void testReclaim_CompletedIsKept() {
        Settlement settlement = initiate("bob", "alice", 50);
        settlementService.execute(settlement.getId(), "bob").orElseThrow();
        clock.advance(TTL.plusMinutes(1));

        assertEquals(ErrorCode.ALREADY_EXECUTED, settlementService.reclaim(settlement.getId()).getError().getCode());
        assertTrue(settlementService.findReclaimable(10).isEmpty());
        assertTrue(settlementService.isExecuted(settlement.getId()));
    }

    @Test
    void testCancel() {
        Settlement settlement = initiate("bob", "alice", 50);

        assertEquals(ErrorCode.NOT_AUTHORIZED, settlementService.cancel(settlement.getId(), "alice").getError().getCode());

        Outcome<Settlement> cancelled = settlementService.cancel(settlement.getId(), "bob");

        assertEquals(SettlementState.CANCELLED, cancelled.getValue().getState());
        assertEquals(ErrorCode.CANCELLED, settlementService.execute(settlement.getId(), "bob").getError().getCode());
        assertEquals(ErrorCode.CANCELLED, settlementService.cancel(settlement.getId(), "bob").getError().getCode());
        assertEquals(500, wallets.balanceOf("bob"));
        verify(outboxService).saveEvent(any(SettlementCancelledEvent.class));
    }

    @Test
    void testCancel_AfterExecute() {
        Settlement settlement = initiate("bob", "alice", 50);
        settlementService.execute(settlement.getId(), "bob").orElseThrow();

        assertEquals(ErrorCode.ALREADY_EXECUTED, settlementService.cancel(settlement.getId(), "bob").getError().getCode());
    }

    @Test
    @DisplayName("Insufficient wallet funds is TRANSFER_REJECTED and the settlement stays PENDING")
    void testExecute_TransferRejected() {
        Settlement settlement = initiate("carol", "alice", 50);

        Outcome<Settlement> outcome = settlementService.execute(settlement.getId(), "carol");

        assertEquals(ErrorCode.TRANSFER_REJECTED, outcome.getError().getCode());
        assertEquals(20, wallets.balanceOf("carol"));
        assertEquals(SettlementState.PENDING, store.findById(settlement.getId()).orElseThrow().getState());

        wallets.openAccount("carol", 80);
        assertTrue(settlementService.execute(settlement.getId(), "carol").isSuccess());
        assertEquals(30, wallets.balanceOf("carol"));
    }

    @Test
    @DisplayName("A proof that does not match the settlement undoes the transfer")
    void testExecute_TransferMismatch() {
        printTestHeader("Transfer mismatch");
        Settlement settlement = initiate("bob", "alice", 50);
        wallets.tamperWithNextProof(proof -> new TransferProof(proof.getTransferRef(), proof.getTransferKey(),
            proof.getFromMember(), proof.getToMember(), proof.getAmount() - 1, proof.getConfirmedAt()));
        printInput("Tampered amount", 49);

        Outcome<Settlement> outcome = settlementService.execute(settlement.getId(), "bob");

        printOutput("Outcome", outcome);
        assertEquals(ErrorCode.TRANSFER_MISMATCH, outcome.getError().getCode());
        assertEquals(500, wallets.balanceOf("bob"));
        assertEquals(0, wallets.balanceOf("alice"));
        assertEquals(0, wallets.confirmedCount());
        assertEquals(SettlementState.PENDING, store.findById(settlement.getId()).orElseThrow().getState());
        verify(outboxService, never()).saveEvent(any(SettlementCompletedEvent.class));

        assertTrue(settlementService.execute(settlement.getId(), "bob").isSuccess());
        assertEquals(450, wallets.balanceOf("bob"));
        printSuccess("Mismatch left no trace, retry succeeded");
    }

    @Test
    @DisplayName("Timeout, then retry while in flight, never submits a second transfer")
    void testExecute_TimeoutThenRetry() throws Exception {
        printTestHeader("Timeout and retry");
        SettlementService impatient = newService(Duration.ofMillis(100));
        Settlement settlement = initiate("bob", "alice", 50);
        wallets.setLatency(Duration.ofMillis(1500));

        Outcome<Settlement> first = impatient.execute(settlement.getId(), "bob");
        printOutput("First", first);
        assertEquals(ErrorCode.TRANSFER_TIMEOUT, first.getError().getCode());
        assertEquals(SettlementState.PENDING, store.findById(settlement.getId()).orElseThrow().getState());

        Outcome<Settlement> retry = impatient.execute(settlement.getId(), "bob");
        printOutput("Retry", retry);
        assertEquals(ErrorCode.TRANSFER_IN_FLIGHT, retry.getError().getCode());

        awaitExecuted(settlement.getId(), Duration.ofSeconds(10));
        wallets.setLatency(Duration.ZERO);

        Outcome<Settlement> afterConfirm = impatient.execute(settlement.getId(), "bob");
        printOutput("After confirmation", afterConfirm);
        assertEquals(ErrorCode.ALREADY_EXECUTED, afterConfirm.getError().getCode());
        assertEquals(TransferStatus.CONFIRMED, wallets.lookup(SettlementService.transferKey(settlement.getId())));
        assertEquals(1, wallets.confirmedCount());
        assertEquals(450, wallets.balanceOf("bob"));
        printSuccess("Exactly one transfer despite timeout and retry");
    }

    @Test
    @DisplayName("Racing execute and cancel: exactly one wins")
    void testExecuteVersusCancel_ExactlyOneWins() throws Exception {
        printTestHeader("Execute vs cancel race");
        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 20; round++) {
                long bobBefore = wallets.balanceOf("bob");
                Settlement settlement = initiate("bob", "alice", 5);
                CountDownLatch start = new CountDownLatch(1);

                Future<Outcome<Settlement>> execute = callers.submit(awaiting(start,
                    () -> settlementService.execute(settlement.getId(), "bob")));
                Future<Outcome<Settlement>> cancel = callers.submit(awaiting(start,
                    () -> settlementService.cancel(settlement.getId(), "bob")));
                start.countDown();

                Outcome<Settlement> executed = execute.get(10, TimeUnit.SECONDS);
                Outcome<Settlement> cancelled = cancel.get(10, TimeUnit.SECONDS);

                assertTrue(executed.isSuccess() ^ cancelled.isSuccess(),
                    "round " + round + ": execute=" + executed + ", cancel=" + cancelled);
                SettlementState finalState = store.findById(settlement.getId()).orElseThrow().getState();
                if (executed.isSuccess()) {
                    assertEquals(SettlementState.COMPLETED, finalState);
                    assertEquals(ErrorCode.ALREADY_EXECUTED, cancelled.getError().getCode());
                    assertEquals(bobBefore - 5, wallets.balanceOf("bob"));
                } else {
                    assertEquals(SettlementState.CANCELLED, finalState);
                    assertEquals(ErrorCode.CANCELLED, executed.getError().getCode());
                    assertEquals(bobBefore, wallets.balanceOf("bob"));
                }
            }
        } finally {
            callers.shutdownNow();
        }
        printSuccess("No round had two winners");
    }

    @Test
    @DisplayName("Settlement expiring while its transfer is in flight is EXPIRED and the transfer undone")
    void testExecute_ExpiresWhileInFlight() throws Exception {
        printTestHeader("Expiry between check and commit");
        Settlement settlement = initiate("bob", "alice", 50);
        wallets.setLatency(Duration.ofMillis(500));
        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<Outcome<Settlement>> execute = caller.submit(() -> settlementService.execute(settlement.getId(), "bob"));
            String transferKey = SettlementService.transferKey(settlement.getId());
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (wallets.lookup(transferKey) != TransferStatus.IN_FLIGHT) {
                assertTrue(System.nanoTime() < deadline, "transfer never went in flight");
                Thread.sleep(5);
            }
            clock.advance(TTL.plusSeconds(1));

            Outcome<Settlement> outcome = execute.get(10, TimeUnit.SECONDS);

            printOutput("Execute", outcome);
            assertEquals(ErrorCode.EXPIRED, outcome.getError().getCode());
        } finally {
            caller.shutdownNow();
        }
        assertEquals(SettlementState.PENDING, store.findById(settlement.getId()).orElseThrow().getState());
        assertEquals(500, wallets.balanceOf("bob"));
        assertEquals(0, wallets.balanceOf("alice"));
        assertEquals(0, wallets.confirmedCount());
        assertEquals(SettlementState.RECLAIMED, settlementService.reclaim(settlement.getId()).getValue().getState());
        printSuccess("Late commit refused, funds restored, settlement reclaimable");
    }

    @Test
    @DisplayName("Racing execute and reclaim across expiry: exactly one wins")
    void testExecuteVersusReclaim_ExactlyOneWins() throws Exception {
        printTestHeader("Execute vs reclaim race");
        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 20; round++) {
                long bobBefore = wallets.balanceOf("bob");
                Settlement settlement = initiate("bob", "alice", 5);
                CountDownLatch start = new CountDownLatch(1);

                Future<Outcome<Settlement>> execute = callers.submit(awaiting(start,
                    () -> settlementService.execute(settlement.getId(), "bob")));
                Future<Outcome<Settlement>> reclaim = callers.submit(awaiting(start, () -> {
                    clock.advance(TTL.plusSeconds(1));
                    return settlementService.reclaim(settlement.getId());
                }));
                start.countDown();

                Outcome<Settlement> executed = execute.get(10, TimeUnit.SECONDS);
                Outcome<Settlement> reclaimed = reclaim.get(10, TimeUnit.SECONDS);

                assertTrue(executed.isSuccess() ^ reclaimed.isSuccess(),
                    "round " + round + ": execute=" + executed + ", reclaim=" + reclaimed);
                if (executed.isSuccess()) {
                    assertEquals(SettlementState.COMPLETED, store.findById(settlement.getId()).orElseThrow().getState());
                    assertEquals(ErrorCode.ALREADY_EXECUTED, reclaimed.getError().getCode());
                    assertEquals(bobBefore - 5, wallets.balanceOf("bob"));
                } else {
                    assertTrue(store.findById(settlement.getId()).isEmpty());
                    assertTrue(executed.getError().getCode() == ErrorCode.EXPIRED
                        || executed.getError().getCode() == ErrorCode.NOT_FOUND, "round " + round + ": " + executed);
                    assertEquals(bobBefore, wallets.balanceOf("bob"));
                }
            }
        } finally {
            callers.shutdownNow();
        }
        printSuccess("No round both paid and reclaimed");
    }

    @Test
    void testExecute_CreditorWithoutWallet() {
        Settlement settlement = initiate("bob", "dave", 50);

        Outcome<Settlement> outcome = settlementService.execute(settlement.getId(), "bob");

        assertEquals(ErrorCode.TRANSFER_REJECTED, outcome.getError().getCode());
        assertEquals(500, wallets.balanceOf("bob"));
        assertEquals(SettlementState.PENDING, store.findById(settlement.getId()).orElseThrow().getState());
    }

    @Test
    @DisplayName("Wallet lock contention is TRANSFER_CONTENDED and can be retried")
    void testExecute_TransferContended() {
        TransferPrimitive contended = mock(TransferPrimitive.class);
        when(contended.lookup(any())).thenReturn(TransferStatus.NONE);
        when(contended.transferAndCommit(any(), any()))
            .thenThrow(new TransferContentionException("settlement-1", new IllegalStateException("deadlock detected")));
        SettlementService service = new SettlementService(store, contended, new InMemoryMembershipOracle(),
            outboxService, new LedgerMetrics(new SimpleMeterRegistry()), clock, executor,
            Duration.ofHours(24), Duration.ofSeconds(5));
        Settlement settlement = initiate("bob", "alice", 50);

        Outcome<Settlement> outcome = service.execute(settlement.getId(), "bob");

        assertEquals(ErrorCode.TRANSFER_CONTENDED, outcome.getError().getCode());
        assertEquals(SettlementState.PENDING, store.findById(settlement.getId()).orElseThrow().getState());
        assertTrue(settlementService.execute(settlement.getId(), "bob").isSuccess());
    }

    @Test
    void testListings() {
        Settlement first = initiate("bob", "alice", 10);
        Settlement second = initiate("carol", "bob", 5);
        settlementService.execute(first.getId(), "bob").orElseThrow();

        assertEquals(List.of(first.getId()),
            settlementService.listForDebtor("bob").stream().map(Settlement::getId).toList());
        assertEquals(List.of(second.getId()),
            settlementService.listForCreditor("bob").stream().map(Settlement::getId).toList());
        assertEquals(2, settlementService.listForMember("bob", null, null, 10).size());
        assertEquals(List.of(second.getId()),
            settlementService.listForMember("bob", null, SettlementState.PENDING, 10).stream()
                .map(Settlement::getId).toList());
    }

    private ErrorCode initiateFailure(String caller, String debtor, String creditor, long amount,
                                      Duration ttl, String groupId) {
        Outcome<Settlement> outcome = settlementService.initiate(InitiateSettlementCommand.builder()
            .caller(caller).debtorId(debtor).creditorId(creditor).amount(amount).ttl(ttl).groupId(groupId).build());
        assertTrue(outcome.isFailure(), "expected failure but got " + outcome);
        return outcome.getError().getCode();
    }

    private void awaitExecuted(long settlementId, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!settlementService.isExecuted(settlementId)) {
            if (System.nanoTime() > deadline) {
                fail("Settlement " + settlementId + " did not complete within " + timeout);
            }
            Thread.sleep(20);
        }
    }

    private static <T> Callable<T> awaiting(CountDownLatch start, Callable<T> call) {
        return () -> {
            start.await();
            return call.call();
        };
    }
}
