package com.flagship.group_ledger.transfer;

/**
 * Work that must commit together with a transfer. Throwing from
 * {@link #commit} undoes the transfer.
 */
@FunctionalInterface
public interface TransferCommit {

    void commit(TransferProof proof);
}
