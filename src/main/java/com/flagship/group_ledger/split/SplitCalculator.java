package com.flagship.group_ledger.split;

import com.flagship.group_ledger.error.ErrorCode;
import com.flagship.group_ledger.error.Outcome;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Divides an amount across participants in integer units.
 *
 * The first {@code amount % n} participants, in the order given, receive one
 * unit more than the rest, so the shares always sum to the amount exactly.
 * The caller owns the order; it is never re-sorted here.
 */
@Component
public class SplitCalculator {

    public static final int DEFAULT_MAX_PARTICIPANTS = 100;

    private final int maxParticipants;

    public SplitCalculator(@Value("${ledger.split.max-participants:100}") int maxParticipants) {
        if (maxParticipants < 1) {
            throw new IllegalArgumentException("ledger.split.max-participants must be at least 1");
        }
        this.maxParticipants = maxParticipants;
    }

    public int getMaxParticipants() {
        return maxParticipants;
    }

    /**
     * Splits {@code amount} equally across {@code participants}.
     *
     * @param amount total in the smallest currency unit
     * @param participants ordered, duplicate-free member ids
     * @return one share per participant, in participant order
     */
    public Outcome<List<SplitShare>> split(long amount, List<String> participants) {
        if (amount <= 0) {
            return Outcome.failure(ErrorCode.INVALID_AMOUNT, "Amount must be positive, got %d", amount);
        }
        if (participants == null || participants.isEmpty()) {
            return Outcome.failure(ErrorCode.EMPTY_PARTICIPANTS, "At least one participant is required");
        }
        int n = participants.size();
        if (n > maxParticipants) {
            return Outcome.failure(ErrorCode.TOO_MANY_PARTICIPANTS,
                    "%d participants exceeds the limit of %d", n, maxParticipants);
        }
        Set<String> seen = new HashSet<>();
        for (String participant : participants) {
            if (participant == null || participant.isBlank()) {
                return Outcome.failure(ErrorCode.EMPTY_PARTICIPANTS, "Participant ids must not be blank");
            }
            if (!seen.add(participant)) {
                return Outcome.failure(ErrorCode.DUPLICATE_PARTICIPANT, "Duplicate participant: %s", participant);
            }
        }
        // Every participant must owe at least one unit
        if (amount < n) {
            return Outcome.failure(ErrorCode.INVALID_AMOUNT,
                    "Amount %d is smaller than the number of participants (%d)", amount, n);
        }

        long base = amount / n;
        long remainder = amount % n;

        List<SplitShare> shares = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            long share = i < remainder ? base + 1 : base;
            shares.add(new SplitShare(participants.get(i), share));
        }
        return Outcome.success(List.copyOf(shares));
    }
}
