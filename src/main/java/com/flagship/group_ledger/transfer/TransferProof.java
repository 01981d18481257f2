package com.flagship.group_ledger.transfer;

import lombok.Value;

import java.time.Instant;

/**
 * What the primitive reports it actually moved. Callers verify it against
 * what they asked for before committing their own state.
 */
@Value
public class TransferProof {
    String transferRef;
    String transferKey;
    String fromMember;
    String toMember;
    long amount;
    Instant confirmedAt;
}
