package com.flagship.group_ledger.settlement;

import lombok.Value;

import java.time.Instant;

/**
 * A debtor's commitment to pay a creditor a fixed amount before
 * {@code expiresAt}. Immutable; transitions return new instances.
 */
@Value
public class Settlement {
    long id;
    String groupId;            // optional
    Long expenseRef;           // optional
    String debtorId;
    String creditorId;
    long amount;
    SettlementState state;
    Instant createdAt;
    Instant expiresAt;
    Instant completedAt;       // null until COMPLETED
    String transferRef;        // null until COMPLETED

    /**
     * Executable up to and including {@code expiresAt}; reclaimable strictly after.
     */
    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    public boolean isExecuted() {
        return state == SettlementState.COMPLETED;
    }

    public boolean involves(String memberId) {
        return debtorId.equals(memberId) || creditorId.equals(memberId);
    }

    public boolean canTransitionTo(SettlementState newState) {
        return switch (this.state) {
            case PENDING -> newState == SettlementState.COMPLETED
                || newState == SettlementState.CANCELLED
                || newState == SettlementState.RECLAIMED;
            case COMPLETED, CANCELLED, RECLAIMED -> false;
        };
    }

    public Settlement complete(String transferRef, Instant completedAt) {
        checkTransition(SettlementState.COMPLETED);
        return new Settlement(id, groupId, expenseRef, debtorId, creditorId, amount,
            SettlementState.COMPLETED, createdAt, expiresAt, completedAt, transferRef);
    }

    public Settlement cancel() {
        checkTransition(SettlementState.CANCELLED);
        return withState(SettlementState.CANCELLED);
    }

    public Settlement reclaim() {
        checkTransition(SettlementState.RECLAIMED);
        return withState(SettlementState.RECLAIMED);
    }

    private Settlement withState(SettlementState newState) {
        return new Settlement(id, groupId, expenseRef, debtorId, creditorId, amount,
            newState, createdAt, expiresAt, completedAt, transferRef);
    }

    private void checkTransition(SettlementState newState) {
        if (!canTransitionTo(newState)) {
            throw new IllegalStateException(
                String.format("Cannot transition settlement %d from %s to %s", id, state, newState));
        }
    }
}
