package com.flagship.group_ledger.split;

import com.flagship.group_ledger.error.Outcome;

import java.util.List;

/**
 * Decides how an expense amount is divided among its participants.
 * Implementations must return exactly one positive share per participant,
 * in participant order, summing to {@code amount}.
 */
public interface SplitPolicy {

    Outcome<List<SplitShare>> computeShares(long amount, List<String> participants);

    /**
     * Short name recorded with the expense, e.g. {@code EQUAL}.
     */
    String name();
}
