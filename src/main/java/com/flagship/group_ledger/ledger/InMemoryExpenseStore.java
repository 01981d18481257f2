package com.flagship.group_ledger.ledger;

import com.flagship.group_ledger.split.SplitShare;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local expense storage. Ids come from a per-store sequence.
 */
public class InMemoryExpenseStore implements ExpenseStore {

    private final AtomicLong sequence = new AtomicLong();
    private final ConcurrentSkipListMap<Long, Expense> expenses = new ConcurrentSkipListMap<>();
    private final Map<String, Long> idempotencyKeys = new ConcurrentHashMap<>();

    @Override
    public Expense insert(ExpenseDraft draft, String idempotencyKey) {
        long expenseId = sequence.incrementAndGet();
        if (idempotencyKey != null && idempotencyKeys.putIfAbsent(idempotencyKey, expenseId) != null) {
            throw new IllegalStateException("Duplicate idempotency key: " + idempotencyKey);
        }
        List<ExpenseSplit> splits = new ArrayList<>();
        for (SplitShare share : draft.getShares()) {
            splits.add(new ExpenseSplit(expenseId, share.getMember(), share.getAmount()));
        }
        Expense expense = new Expense(expenseId, draft.getGroupId(), draft.getPayerId(), draft.getTotalAmount(),
            draft.getSplitPolicy(), List.copyOf(splits), draft.getCreatedAt());
        expenses.put(expenseId, expense);
        return expense;
    }

    @Override
    public Optional<Expense> findById(long expenseId) {
        return Optional.ofNullable(expenses.get(expenseId));
    }

    @Override
    public Optional<Expense> findByIdempotencyKey(String idempotencyKey) {
        Long expenseId = idempotencyKeys.get(idempotencyKey);
        return expenseId == null ? Optional.empty() : findById(expenseId);
    }

    @Override
    public List<Expense> findByGroup(String groupId, int limit, int offset) {
        return expenses.descendingMap().values().stream()
            .filter(expense -> expense.getGroupId().equals(groupId))
            .skip(offset)
            .limit(limit)
            .toList();
    }

    @Override
    public List<Expense> findAllByGroupInPostingOrder(String groupId) {
        return expenses.values().stream()
            .filter(expense -> expense.getGroupId().equals(groupId))
            .sorted(Comparator.comparingLong(Expense::getId))
            .toList();
    }

    @Override
    public List<Expense> findByParticipant(String memberId, String groupId, int limit) {
        return expenses.descendingMap().values().stream()
            .filter(expense -> groupId == null || expense.getGroupId().equals(groupId))
            .filter(expense -> expense.getParticipants().contains(memberId))
            .limit(limit)
            .toList();
    }

    @Override
    public int countByGroup(String groupId) {
        return (int) expenses.values().stream()
            .filter(expense -> expense.getGroupId().equals(groupId))
            .count();
    }
}
