package com.flagship.group_ledger.split;

import com.flagship.group_ledger.error.ErrorCode;
import com.flagship.group_ledger.error.Outcome;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Caller-supplied shares ("custom" split). The shares are checked, never adjusted.
 */
public class ExactSplitPolicy implements SplitPolicy {

    public static final String NAME = "EXACT";

    private final Map<String, Long> sharesByMember;

    public ExactSplitPolicy(Map<String, Long> sharesByMember) {
        this.sharesByMember = new LinkedHashMap<>(sharesByMember);
    }

    @Override
    public Outcome<List<SplitShare>> computeShares(long amount, List<String> participants) {
        if (sharesByMember.size() != participants.size()
                || !sharesByMember.keySet().containsAll(participants)) {
            return Outcome.failure(ErrorCode.SHARES_MISMATCH,
                    "Shares must be given for exactly the participants %s, got %s",
                    participants, sharesByMember.keySet());
        }

        List<SplitShare> shares = new ArrayList<>(participants.size());
        long total = 0;
        for (String participant : participants) {
            long share = sharesByMember.get(participant);
            if (share <= 0) {
                return Outcome.failure(ErrorCode.SHARES_MISMATCH,
                        "Share for %s must be positive, got %d", participant, share);
            }
            try {
                total = Math.addExact(total, share);
            } catch (ArithmeticException e) {
                return Outcome.failure(ErrorCode.SHARES_MISMATCH, "Shares overflow");
            }
            shares.add(new SplitShare(participant, share));
        }
        if (total != amount) {
            return Outcome.failure(ErrorCode.SHARES_MISMATCH,
                    "Shares sum to %d but the amount is %d", total, amount);
        }
        return Outcome.success(List.copyOf(shares));
    }

    @Override
    public String name() {
        return NAME;
    }
}
