package com.flagship.group_ledger.transfer;

/**
 * Side of a wallet transfer entry. Every transfer writes one of each, for the same amount.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
