package com.flagship.group_ledger.event;

import com.flagship.group_ledger.settlement.Settlement;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a settlement's transfer is confirmed and the record flips to COMPLETED.
 * Carries the transfer reference so consumers can correlate with wallet entries.
 */
@Value
public class SettlementCompletedEvent implements SettlementEvent {
    UUID eventId;
    long settlementId;
    String groupId;
    String debtorId;
    String creditorId;
    long amount;
    String transferRef;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SettlementCompleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SettlementCompletedEvent fromSettlement(Settlement settlement) {
        return new SettlementCompletedEvent(
            UUID.randomUUID(),
            settlement.getId(),
            settlement.getGroupId(),
            settlement.getDebtorId(),
            settlement.getCreditorId(),
            settlement.getAmount(),
            settlement.getTransferRef(),
            settlement.getCompletedAt()
        );
    }
}
