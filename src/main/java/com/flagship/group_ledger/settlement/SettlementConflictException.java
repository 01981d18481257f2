package com.flagship.group_ledger.settlement;

import lombok.Getter;

/**
 * Another transition won the compare-and-set on the settlement's state.
 */
@Getter
public class SettlementConflictException extends RuntimeException {

    private final long settlementId;

    public SettlementConflictException(long settlementId) {
        super("Settlement " + settlementId + " is no longer pending or has expired");
        this.settlementId = settlementId;
    }
}
