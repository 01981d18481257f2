package com.flagship.group_ledger.membership;

/**
 * Answers group-membership questions. Membership itself is managed outside
 * the ledger; this is a read-only view of it.
 */
public interface MembershipOracle {

    boolean isMember(String groupId, String memberId);
}
