package com.flagship.group_ledger.transfer;

public enum TransferStatus {
    /** Never submitted, or submitted and rolled back. */
    NONE,
    /** Submitted and not yet finished; must not be resubmitted. */
    IN_FLIGHT,
    /** Applied and committed. */
    CONFIRMED
}
