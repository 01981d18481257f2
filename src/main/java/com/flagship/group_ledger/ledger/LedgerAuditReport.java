package com.flagship.group_ledger.ledger;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Comparison of a group's cached balances with the balances obtained by
 * replaying its expense history.
 */
@Value
public class LedgerAuditReport {
    String groupId;
    int expenseCount;
    long cachedSum;
    Map<String, Long> cachedBalances;
    Map<String, Long> replayedBalances;
    List<Discrepancy> discrepancies;

    public boolean isConsistent() {
        return cachedSum == 0 && discrepancies.isEmpty();
    }

    @Value
    public static class Discrepancy {
        String memberId;
        long cached;
        long replayed;
    }
}
