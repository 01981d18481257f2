package com.flagship.group_ledger.ledger;

import java.util.List;
import java.util.Optional;

/**
 * Append-only storage for expenses and their splits.
 */
public interface ExpenseStore {

    /**
     * Persists the draft and its splits, assigning the next expense id.
     *
     * @param idempotencyKey optional, unique across all expenses when present
     */
    Expense insert(ExpenseDraft draft, String idempotencyKey);

    Optional<Expense> findById(long expenseId);

    Optional<Expense> findByIdempotencyKey(String idempotencyKey);

    /**
     * Newest first.
     */
    List<Expense> findByGroup(String groupId, int limit, int offset);

    /**
     * Full history of a group in posting order, for replay.
     */
    List<Expense> findAllByGroupInPostingOrder(String groupId);

    /**
     * Expenses in which the member owes a share, newest first.
     *
     * @param groupId optional group filter, may be null
     */
    List<Expense> findByParticipant(String memberId, String groupId, int limit);

    int countByGroup(String groupId);
}
