package com.flagship.group_ledger.error;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeTest {

    @Test
    void testSuccess_CarriesValue() {
        Outcome<String> outcome = Outcome.success("ok");

        assertTrue(outcome.isSuccess());
        assertFalse(outcome.isFailure());
        assertEquals("ok", outcome.getValue());
        assertEquals(Optional.empty(), outcome.errorCode());
        assertThrows(IllegalStateException.class, outcome::getError);
    }

    @Test
    void testFailure_CarriesCodeAndCategory() {
        Outcome<String> outcome = Outcome.failure(ErrorCode.EXPIRED, "Settlement %d expired", 7);

        assertTrue(outcome.isFailure());
        assertEquals(ErrorCode.EXPIRED, outcome.getError().getCode());
        assertEquals(ErrorCategory.STATE, outcome.getError().getCategory());
        assertEquals("Settlement 7 expired", outcome.getError().getMessage());
        assertThrows(IllegalStateException.class, outcome::getValue);
    }

    @Test
    void testMapAndFlatMap_SkipFailures() {
        Outcome<Integer> failed = Outcome.failure(ErrorCode.NOT_FOUND, "missing");

        assertEquals(ErrorCode.NOT_FOUND, failed.map(i -> i + 1).getError().getCode());
        assertEquals(ErrorCode.NOT_FOUND, failed.flatMap(i -> Outcome.success(i * 2)).getError().getCode());
        assertEquals(4, Outcome.success(2).flatMap(i -> Outcome.success(i * 2)).getValue());
    }

    @Test
    void testOrElseThrow_WrapsError() {
        Outcome<String> outcome = Outcome.failure(ErrorCode.NOT_AUTHORIZED, "nope");

        LedgerOperationException e = assertThrows(LedgerOperationException.class, outcome::orElseThrow);
        assertEquals(ErrorCode.NOT_AUTHORIZED, e.getError().getCode());
        assertEquals(ErrorCategory.AUTHORIZATION, e.getError().getCategory());
    }

    @Test
    void testTransferCodesShareCategory() {
        for (ErrorCode code : new ErrorCode[] {ErrorCode.TRANSFER_MISMATCH, ErrorCode.TRANSFER_REJECTED,
                ErrorCode.TRANSFER_TIMEOUT, ErrorCode.TRANSFER_IN_FLIGHT}) {
            assertEquals(ErrorCategory.TRANSFER, code.getCategory());
        }
    }
}
