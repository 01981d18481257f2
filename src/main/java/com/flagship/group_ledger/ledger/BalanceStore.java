package com.flagship.group_ledger.ledger;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Cached per-(group, member) signed balances.
 *
 * Writers must hold the group scope ({@link #withGroupLock}); readers never
 * lock and always see a consistent snapshot of a group.
 */
public interface BalanceStore {

    /**
     * Runs {@code work} with exclusive write access to the group's balances.
     * Different groups do not block each other.
     */
    <T> T withGroupLock(String groupId, Supplier<T> work);

    /**
     * Adds each delta to the member's balance, creating missing balances at 0.
     * Either every delta is applied or none is.
     *
     * @throws com.flagship.group_ledger.error.LedgerCorruptionException on overflow
     */
    void applyDeltas(String groupId, Map<String, Long> deltas);

    /**
     * @return the member's balance, 0 if the member never appeared in the group
     */
    long getBalance(String groupId, String memberId);

    /**
     * Every member that ever appeared in the group, including zero balances,
     * sorted by member id.
     */
    Map<String, Long> getBalances(String groupId);

    /**
     * Overwrites the group's balances with {@code balances}. Recovery only.
     */
    void replaceBalances(String groupId, Map<String, Long> balances);
}
