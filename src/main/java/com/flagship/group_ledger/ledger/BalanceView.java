package com.flagship.group_ledger.ledger;

import lombok.Value;

@Value
public class BalanceView {
    String groupId;
    String memberId;
    long balance;
    BalanceStatus status;

    public static BalanceView of(String groupId, String memberId, long balance) {
        return new BalanceView(groupId, memberId, balance, BalanceStatus.of(balance));
    }
}
