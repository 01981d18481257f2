package com.flagship.group_ledger.split;

import lombok.Value;

/**
 * One participant's exact integer share of an amount.
 */
@Value
public class SplitShare {
    String member;
    long amount;
}
