package com.flagship.group_ledger.event;

import com.flagship.group_ledger.ledger.Expense;
import com.flagship.group_ledger.ledger.ExpenseSplit;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Published when an expense is posted and the group's balances are updated.
 */
@Value
public class ExpensePostedEvent implements LedgerEvent {
    UUID eventId;
    long expenseId;
    String groupId;
    String payerId;
    long totalAmount;
    String splitPolicy;
    Map<String, Long> shares;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ExpensePosted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return "Expense";
    }

    @Override
    public String getAggregateId() {
        return Long.toString(expenseId);
    }

    public static ExpensePostedEvent fromExpense(Expense expense) {
        Map<String, Long> shares = new LinkedHashMap<>();
        for (ExpenseSplit split : expense.getSplits()) {
            shares.put(split.getMemberId(), split.getOwedAmount());
        }
        return new ExpensePostedEvent(
            UUID.randomUUID(),
            expense.getId(),
            expense.getGroupId(),
            expense.getPayerId(),
            expense.getTotalAmount(),
            expense.getSplitPolicy(),
            shares,
            expense.getCreatedAt()
        );
    }
}
