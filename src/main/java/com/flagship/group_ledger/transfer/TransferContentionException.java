package com.flagship.group_ledger.transfer;

import lombok.Getter;

/**
 * The wallet rows could not be locked, e.g. the database picked this
 * transaction as a deadlock victim. Nothing was moved; the same key may be retried.
 */
@Getter
public class TransferContentionException extends RuntimeException {

    private final String transferKey;

    public TransferContentionException(String transferKey, Throwable cause) {
        super("Wallet lock contention for transfer " + transferKey, cause);
        this.transferKey = transferKey;
    }
}
