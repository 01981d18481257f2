package com.flagship.group_ledger.settlement;

import lombok.Value;

import java.time.Instant;

/**
 * A validated settlement that has not been assigned an id yet.
 */
@Value
public class SettlementDraft {
    String groupId;
    Long expenseRef;
    String debtorId;
    String creditorId;
    long amount;
    Instant createdAt;
    Instant expiresAt;
}
