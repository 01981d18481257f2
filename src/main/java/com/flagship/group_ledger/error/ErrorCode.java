package com.flagship.group_ledger.error;

/**
 * Every typed failure a ledger or settlement operation can report.
 */
public enum ErrorCode {
    INVALID_AMOUNT(ErrorCategory.VALIDATION),
    EMPTY_PARTICIPANTS(ErrorCategory.VALIDATION),
    TOO_MANY_PARTICIPANTS(ErrorCategory.VALIDATION),
    DUPLICATE_PARTICIPANT(ErrorCategory.VALIDATION),
    PAYER_NOT_PARTICIPANT(ErrorCategory.VALIDATION),
    NOT_A_MEMBER(ErrorCategory.VALIDATION),
    SHARES_MISMATCH(ErrorCategory.VALIDATION),
    SAME_PARTIES(ErrorCategory.VALIDATION),
    INVALID_TTL(ErrorCategory.VALIDATION),
    IDEMPOTENCY_CONFLICT(ErrorCategory.VALIDATION),

    ALREADY_EXECUTED(ErrorCategory.STATE),
    EXPIRED(ErrorCategory.STATE),
    CANCELLED(ErrorCategory.STATE),
    NOT_EXPIRED(ErrorCategory.STATE),

    NOT_AUTHORIZED(ErrorCategory.AUTHORIZATION),

    NOT_FOUND(ErrorCategory.LOOKUP),

    /**
     * The confirmed transfer did not match the settlement record.
     * The bundle was aborted, settlement is still PENDING.
     */
    TRANSFER_MISMATCH(ErrorCategory.TRANSFER),
    /**
     * The transfer primitive refused the transfer (e.g. insufficient funds).
     */
    TRANSFER_REJECTED(ErrorCategory.TRANSFER),
    /**
     * No confirmation arrived in time. The settlement stays PENDING unless the
     * bundle confirms later; retrying is safe.
     */
    TRANSFER_TIMEOUT(ErrorCategory.TRANSFER),
    /**
     * A previous submission for the same settlement has not resolved yet.
     */
    TRANSFER_IN_FLIGHT(ErrorCategory.TRANSFER),
    /**
     * Wallet locks could not be taken. Nothing moved, retrying is safe.
     */
    TRANSFER_CONTENDED(ErrorCategory.TRANSFER);

    private final ErrorCategory category;

    ErrorCode(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
