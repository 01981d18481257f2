package com.flagship.group_ledger.transfer;

import lombok.Getter;

/**
 * A transfer with the same key is already in flight or confirmed. Nothing new was moved.
 */
@Getter
public class DuplicateTransferException extends RuntimeException {

    private final String transferKey;

    public DuplicateTransferException(String transferKey) {
        super("Transfer already submitted: " + transferKey);
        this.transferKey = transferKey;
    }
}
