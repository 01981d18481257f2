package com.flagship.group_ledger.settlement;

import lombok.Value;

/**
 * One suggested payment in a settlement plan.
 */
@Value
public class PlannedTransfer {
    String debtorId;
    String creditorId;
    long amount;
}
