package com.flagship.group_ledger.transfer;

/**
 * The primitive refused the transfer, e.g. insufficient funds or no wallet.
 * Nothing was moved.
 */
public class TransferRejectedException extends RuntimeException {

    public TransferRejectedException(String message) {
        super(message);
    }
}
