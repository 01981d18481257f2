package com.flagship.group_ledger.ledger;

/**
 * How a signed balance reads from the member's point of view.
 */
public enum BalanceStatus {
    /** Positive balance: the group owes this member. */
    OWED,
    /** Negative balance: this member owes the group. */
    OWES,
    SETTLED;

    public static BalanceStatus of(long balance) {
        if (balance > 0) {
            return OWED;
        }
        return balance < 0 ? OWES : SETTLED;
    }
}
