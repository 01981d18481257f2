package com.flagship.group_ledger.transfer;

import lombok.Value;

/**
 * A request to move {@code amount} from one member's wallet to another's.
 *
 * {@code transferKey} identifies the transfer across retries; a primitive
 * applies at most one transfer per key.
 */
@Value
public class TransferInstruction {
    String transferKey;
    String fromMember;
    String toMember;
    long amount;
    String memo;
}
