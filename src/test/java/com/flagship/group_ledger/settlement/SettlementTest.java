package com.flagship.group_ledger.settlement;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SettlementTest {

    private static final Instant CREATED = Instant.parse("2026-03-01T10:00:00Z");
    private static final Instant EXPIRES = Instant.parse("2026-03-02T10:00:00Z");

    private Settlement pending() {
        return new Settlement(1L, "trip", null, "bob", "alice", 50, SettlementState.PENDING,
            CREATED, EXPIRES, null, null);
    }

    @Test
    void testPendingTransitions() {
        Settlement settlement = pending();

        assertTrue(settlement.canTransitionTo(SettlementState.COMPLETED));
        assertTrue(settlement.canTransitionTo(SettlementState.CANCELLED));
        assertTrue(settlement.canTransitionTo(SettlementState.RECLAIMED));
        assertFalse(settlement.canTransitionTo(SettlementState.PENDING));
    }

    @Test
    void testCompletedIsFinal() {
        Settlement completed = pending().complete("tx-1", CREATED.plusSeconds(60));

        assertEquals(SettlementState.COMPLETED, completed.getState());
        assertEquals("tx-1", completed.getTransferRef());
        assertTrue(completed.isExecuted());
        assertThrows(IllegalStateException.class, completed::cancel);
        assertThrows(IllegalStateException.class, completed::reclaim);
        assertThrows(IllegalStateException.class, () -> completed.complete("tx-2", CREATED));
    }

    @Test
    void testCancelledIsFinal() {
        Settlement cancelled = pending().cancel();

        assertEquals(SettlementState.CANCELLED, cancelled.getState());
        assertFalse(cancelled.isExecuted());
        assertThrows(IllegalStateException.class, () -> cancelled.complete("tx-1", CREATED));
    }

    @Test
    void testExpiryBoundaryIsInclusive() {
        Settlement settlement = pending();

        assertFalse(settlement.isExpired(EXPIRES));
        assertTrue(settlement.isExpired(EXPIRES.plusMillis(1)));
    }

    @Test
    void testInvolves() {
        assertTrue(pending().involves("bob"));
        assertTrue(pending().involves("alice"));
        assertFalse(pending().involves("carol"));
    }
}
