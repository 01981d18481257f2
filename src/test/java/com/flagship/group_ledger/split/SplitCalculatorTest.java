package com.flagship.group_ledger.split;

import com.flagship.group_ledger.error.ErrorCode;
import com.flagship.group_ledger.error.Outcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class SplitCalculatorTest {

    private final SplitCalculator calculator = new SplitCalculator(SplitCalculator.DEFAULT_MAX_PARTICIPANTS);

    @Test
    @DisplayName("100 across three participants gives 34/33/33 in participant order")
    void testSplit_RemainderGoesToFirstParticipants() {
        Outcome<List<SplitShare>> outcome = calculator.split(100, List.of("alice", "bob", "carol"));

        assertTrue(outcome.isSuccess());
        assertEquals(List.of(
            new SplitShare("alice", 34),
            new SplitShare("bob", 33),
            new SplitShare("carol", 33)
        ), outcome.getValue());
    }

    @Test
    @DisplayName("Remainder follows caller order, not member id order")
    void testSplit_DoesNotReorderParticipants() {
        List<SplitShare> shares = calculator.split(101, List.of("zed", "amy", "kim", "bob")).getValue();

        assertEquals("zed", shares.get(0).getMember());
        assertEquals(26, shares.get(0).getAmount());
        assertEquals(25, shares.get(1).getAmount());
        assertEquals(25, shares.get(2).getAmount());
        assertEquals(25, shares.get(3).getAmount());
    }

    @Test
    void testSplit_EvenAmountHasNoRemainder() {
        List<SplitShare> shares = calculator.split(150, List.of("alice", "bob", "carol")).getValue();

        assertTrue(shares.stream().allMatch(share -> share.getAmount() == 50));
    }

    @Test
    @DisplayName("Shares always sum to the amount")
    void testSplit_SumsExactly() {
        List<String> participants = List.of("a", "b", "c", "d", "e", "f", "g");
        for (long amount : new long[] {7, 8, 13, 99, 1_000_003, Long.MAX_VALUE}) {
            List<SplitShare> shares = calculator.split(amount, participants).getValue();
            long sum = 0;
            for (SplitShare share : shares) {
                assertTrue(share.getAmount() > 0);
                sum += share.getAmount();
            }
            assertEquals(amount, sum, "amount " + amount);
        }
    }

    @Test
    void testSplit_SingleParticipantOwesEverything() {
        assertEquals(List.of(new SplitShare("alice", 42)), calculator.split(42, List.of("alice")).getValue());
    }

    @Test
    void testSplit_RejectsNonPositiveAmount() {
        assertEquals(ErrorCode.INVALID_AMOUNT, calculator.split(0, List.of("alice")).getError().getCode());
        assertEquals(ErrorCode.INVALID_AMOUNT, calculator.split(-5, List.of("alice")).getError().getCode());
    }

    @Test
    void testSplit_RejectsEmptyParticipants() {
        assertEquals(ErrorCode.EMPTY_PARTICIPANTS, calculator.split(10, List.of()).getError().getCode());
        assertEquals(ErrorCode.EMPTY_PARTICIPANTS, calculator.split(10, null).getError().getCode());
    }

    @Test
    void testSplit_RejectsDuplicates() {
        Outcome<List<SplitShare>> outcome = calculator.split(10, List.of("alice", "bob", "alice"));

        assertEquals(ErrorCode.DUPLICATE_PARTICIPANT, outcome.getError().getCode());
    }

    @Test
    @DisplayName("Amount smaller than participant count would leave someone owing zero")
    void testSplit_RejectsAmountBelowParticipantCount() {
        Outcome<List<SplitShare>> outcome = calculator.split(2, List.of("alice", "bob", "carol"));

        assertEquals(ErrorCode.INVALID_AMOUNT, outcome.getError().getCode());
    }

    @Test
    void testSplit_EnforcesParticipantCap() {
        List<String> participants = new ArrayList<>();
        IntStream.rangeClosed(1, 101).forEach(i -> participants.add("member-" + i));

        Outcome<List<SplitShare>> outcome = calculator.split(10_000, participants);

        assertEquals(ErrorCode.TOO_MANY_PARTICIPANTS, outcome.getError().getCode());
        assertTrue(calculator.split(10_000, participants.subList(0, 100)).isSuccess());
    }

    @Test
    void testConstructor_RejectsNonPositiveCap() {
        assertThrows(IllegalArgumentException.class, () -> new SplitCalculator(0));
    }
}
