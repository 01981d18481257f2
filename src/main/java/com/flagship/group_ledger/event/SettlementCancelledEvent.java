package com.flagship.group_ledger.event;

import com.flagship.group_ledger.settlement.Settlement;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class SettlementCancelledEvent implements SettlementEvent {
    UUID eventId;
    long settlementId;
    String debtorId;
    String creditorId;
    long amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SettlementCancelled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SettlementCancelledEvent fromSettlement(Settlement settlement, Instant cancelledAt) {
        return new SettlementCancelledEvent(
            UUID.randomUUID(),
            settlement.getId(),
            settlement.getDebtorId(),
            settlement.getCreditorId(),
            settlement.getAmount(),
            cancelledAt
        );
    }
}
