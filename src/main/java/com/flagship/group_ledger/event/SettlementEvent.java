package com.flagship.group_ledger.event;

/**
 * Marker for events whose aggregate is a settlement.
 */
public interface SettlementEvent extends LedgerEvent {

    long getSettlementId();

    @Override
    default String getAggregateType() {
        return "Settlement";
    }

    @Override
    default String getAggregateId() {
        return Long.toString(getSettlementId());
    }
}
