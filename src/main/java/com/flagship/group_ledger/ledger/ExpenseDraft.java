package com.flagship.group_ledger.ledger;

import com.flagship.group_ledger.split.SplitShare;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A validated expense that has not been assigned an id yet.
 */
@Value
public class ExpenseDraft {
    String groupId;
    String payerId;
    long totalAmount;
    String splitPolicy;
    List<SplitShare> shares;
    Instant createdAt;
}
