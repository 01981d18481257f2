package com.flagship.group_ledger.ledger;

import lombok.Value;

/**
 * One participant's share of a posted expense. Immutable.
 */
@Value
public class ExpenseSplit {
    long expenseId;
    String memberId;
    long owedAmount;
}
