package com.flagship.group_ledger.ledger;

import com.flagship.group_ledger.split.SplitPolicy;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Input for {@link ExpenseLedgerService#applyExpense(PostExpenseCommand)}.
 *
 * {@code splitPolicy} defaults to an equal split when null.
 * {@code idempotencyKey} is optional; when present, re-posting with the same
 * key returns the original expense.
 */
@Value
@Builder
public class PostExpenseCommand {
    String groupId;
    String payerId;
    long amount;
    List<String> participants;
    SplitPolicy splitPolicy;
    String idempotencyKey;
}
