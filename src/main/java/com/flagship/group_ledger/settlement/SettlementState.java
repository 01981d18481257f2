package com.flagship.group_ledger.settlement;

/**
 * Lifecycle of a settlement.
 *
 * Allowed transitions:
 * PENDING -> COMPLETED
 * PENDING -> CANCELLED
 * PENDING -> RECLAIMED
 *
 * COMPLETED and CANCELLED are final and their records are kept for audit.
 * RECLAIMED is never stored: reclaiming deletes the record, and the state
 * only appears on the returned value and the emitted event.
 */
public enum SettlementState {

    /** Initiated by the debtor; awaiting execution, cancellation or expiry. */
    PENDING,

    /** Transfer confirmed and recorded. Final. */
    COMPLETED,

    /** Abandoned by the debtor before execution. Final. */
    CANCELLED,

    /** Expired without execution and removed. */
    RECLAIMED;

    public boolean isFinal() {
        return this != PENDING;
    }
}
