package com.flagship.group_ledger.settlement;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Settlement records. State changes are compare-and-set on PENDING, so of
 * several concurrent transitions on one record exactly one succeeds.
 */
public interface SettlementStore {

    /**
     * Stores a PENDING settlement with the next id.
     */
    Settlement create(SettlementDraft draft);

    Optional<Settlement> findById(long settlementId);

    /**
     * PENDING to COMPLETED, only while {@code now <= expires_at}.
     *
     * @return false if the record is missing, not PENDING or expired
     */
    boolean markCompleted(long settlementId, String transferRef, Instant completedAt, Instant now);

    /**
     * PENDING to CANCELLED.
     *
     * @return false if the record is missing or not PENDING
     */
    boolean markCancelled(long settlementId);

    /**
     * Deletes the record if it is PENDING and {@code now > expires_at}.
     *
     * @return false if nothing was deleted
     */
    boolean deleteIfExpired(long settlementId, Instant now);

    /**
     * Oldest expiry first.
     */
    List<Settlement> findExpiredPending(Instant now, int limit);

    List<Settlement> findByDebtor(String debtorId);

    List<Settlement> findByCreditor(String creditorId);

    /**
     * Settlements where the member is debtor or creditor, newest first.
     *
     * @param groupId optional filter, may be null
     * @param state optional filter, may be null
     */
    List<Settlement> findByMember(String memberId, String groupId, SettlementState state, int limit);

    long countPending();

    long countExpiredPending(Instant now);
}
