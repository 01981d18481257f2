package com.flagship.group_ledger.event;

import com.flagship.group_ledger.settlement.Settlement;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when an expired, never-executed settlement record is deleted.
 */
@Value
public class SettlementReclaimedEvent implements SettlementEvent {
    UUID eventId;
    long settlementId;
    String debtorId;
    String creditorId;
    long amount;
    Instant expiredAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SettlementReclaimed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SettlementReclaimedEvent fromSettlement(Settlement settlement, Instant reclaimedAt) {
        return new SettlementReclaimedEvent(
            UUID.randomUUID(),
            settlement.getId(),
            settlement.getDebtorId(),
            settlement.getCreditorId(),
            settlement.getAmount(),
            settlement.getExpiresAt(),
            reclaimedAt
        );
    }
}
