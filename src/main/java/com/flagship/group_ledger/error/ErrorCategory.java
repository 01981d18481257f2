package com.flagship.group_ledger.error;

/**
 * Coarse classification of ledger failures.
 * All categories are recoverable by the caller; corruption is not a category
 * because it is never returned as a value (see {@link LedgerCorruptionException}).
 */
public enum ErrorCategory {
    VALIDATION,
    STATE,
    AUTHORIZATION,
    LOOKUP,
    TRANSFER
}
