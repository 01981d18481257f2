package com.flagship.group_ledger.error;

import lombok.Value;

/**
 * A typed, recoverable failure reported to the caller.
 */
@Value
public class LedgerError {
    ErrorCode code;
    String message;

    public static LedgerError of(ErrorCode code, String message) {
        return new LedgerError(code, message);
    }

    public static LedgerError of(ErrorCode code, String format, Object... args) {
        return new LedgerError(code, String.format(format, args));
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }
}
