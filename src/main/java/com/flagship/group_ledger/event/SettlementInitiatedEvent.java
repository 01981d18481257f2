package com.flagship.group_ledger.event;

import com.flagship.group_ledger.settlement.Settlement;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class SettlementInitiatedEvent implements SettlementEvent {
    UUID eventId;
    long settlementId;
    String groupId;
    Long expenseRef;
    String debtorId;
    String creditorId;
    long amount;
    Instant expiresAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SettlementInitiated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SettlementInitiatedEvent fromSettlement(Settlement settlement) {
        return new SettlementInitiatedEvent(
            UUID.randomUUID(),
            settlement.getId(),
            settlement.getGroupId(),
            settlement.getExpenseRef(),
            settlement.getDebtorId(),
            settlement.getCreditorId(),
            settlement.getAmount(),
            settlement.getExpiresAt(),
            settlement.getCreatedAt()
        );
    }
}
