package com.flagship.group_ledger.settlement;

/**
 * The confirmed transfer does not match the settlement's debtor, creditor or
 * amount. Thrown from the commit so the transfer is undone.
 */
public class TransferMismatchException extends RuntimeException {

    public TransferMismatchException(String message) {
        super(message);
    }
}
