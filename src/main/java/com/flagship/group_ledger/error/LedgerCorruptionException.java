package com.flagship.group_ledger.error;

/**
 * Raised when a ledger invariant no longer holds after a mutation:
 * a group's balances no longer sum to zero, an encoded balance crossed its
 * overflow ceiling, or a settlement plan fails its postcondition.
 *
 * This is a programmer error, never a user error. It is thrown (not returned
 * as an {@link Outcome}) so that the enclosing unit of work rolls back.
 */
public class LedgerCorruptionException extends RuntimeException {

    public LedgerCorruptionException(String message) {
        super(message);
    }

    public LedgerCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
