package com.flagship.group_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A posted expense with its splits.
 *
 * Expenses are never updated or deleted once posted; settling debts does not
 * touch them. Invariant: the splits sum to {@code totalAmount} exactly.
 */
@Value
public class Expense {
    long id;
    String groupId;
    String payerId;
    long totalAmount;
    String splitPolicy;
    List<ExpenseSplit> splits;
    Instant createdAt;

    /**
     * Participants in the order their shares were computed.
     */
    public List<String> getParticipants() {
        return splits.stream().map(ExpenseSplit::getMemberId).toList();
    }

    public long owedBy(String memberId) {
        return splits.stream()
            .filter(split -> split.getMemberId().equals(memberId))
            .mapToLong(ExpenseSplit::getOwedAmount)
            .findFirst()
            .orElse(0L);
    }
}
