package com.flagship.group_ledger.transfer;

/**
 * Moves funds between member wallets.
 *
 * The transfer and the caller's {@link TransferCommit} form one indivisible
 * unit: either both take effect or neither does.
 */
public interface TransferPrimitive {

    /**
     * Applies the transfer, then runs {@code commit} with the resulting proof.
     *
     * @throws TransferRejectedException if the transfer cannot be applied
     * @throws DuplicateTransferException if the key is in flight or already confirmed
     * @throws TransferContentionException if the wallets could not be locked; nothing moved
     * @throws RuntimeException whatever {@code commit} throws, after undoing the transfer
     */
    TransferProof transferAndCommit(TransferInstruction instruction, TransferCommit commit);

    TransferStatus lookup(String transferKey);
}
