package com.flagship.group_ledger.error;

import lombok.Getter;

/**
 * Exception form of a {@link LedgerError}, for callers that unwrap an
 * {@link Outcome} with {@link Outcome#orElseThrow()}.
 */
@Getter
public class LedgerOperationException extends RuntimeException {

    private final LedgerError error;

    public LedgerOperationException(LedgerError error) {
        super(error.getCode() + ": " + error.getMessage());
        this.error = error;
    }
}
