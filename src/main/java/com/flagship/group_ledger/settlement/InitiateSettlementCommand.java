package com.flagship.group_ledger.settlement;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Input for {@link SettlementService#initiate(InitiateSettlementCommand)}.
 *
 * {@code ttl} falls back to {@code ledger.settlement.default-ttl} when null.
 * {@code groupId} and {@code expenseRef} are optional.
 */
@Value
@Builder
public class InitiateSettlementCommand {
    String caller;
    String debtorId;
    String creditorId;
    long amount;
    Duration ttl;
    String groupId;
    Long expenseRef;
}
