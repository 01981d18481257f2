package com.flagship.group_ledger.ledger;

import com.flagship.group_ledger.split.SplitShare;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Expense storage on plain JDBC.
 *
 * Rows in {@code expenses} and {@code expense_splits} are append-only; the
 * schema rejects updates and deletes with a trigger, and a deferred
 * constraint trigger checks at commit that the splits sum to the total.
 */
@Repository
public class JdbcExpenseStore implements ExpenseStore {

    private static final String SELECT_WITH_SPLITS =
        "SELECT e.id, e.group_id, e.payer_id, e.total_amount, e.split_policy, e.created_at, " +
        "       s.member_id, s.owed_amount " +
        "FROM expenses e JOIN expense_splits s ON s.expense_id = e.id ";

    private final JdbcTemplate jdbcTemplate;

    public JdbcExpenseStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Expense insert(ExpenseDraft draft, String idempotencyKey) {
        Long expenseId = jdbcTemplate.queryForObject(
            "INSERT INTO expenses (group_id, payer_id, total_amount, split_policy, idempotency_key, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?) RETURNING id",
            Long.class,
            draft.getGroupId(),
            draft.getPayerId(),
            draft.getTotalAmount(),
            draft.getSplitPolicy(),
            idempotencyKey,
            Timestamp.from(draft.getCreatedAt())
        );
        if (expenseId == null) {
            throw new IllegalStateException("Expense insert returned no id");
        }

        List<Object[]> rows = new ArrayList<>();
        List<ExpenseSplit> splits = new ArrayList<>();
        int position = 0;
        for (SplitShare share : draft.getShares()) {
            rows.add(new Object[] {expenseId, position++, share.getMember(), share.getAmount()});
            splits.add(new ExpenseSplit(expenseId, share.getMember(), share.getAmount()));
        }
        jdbcTemplate.batchUpdate(
            "INSERT INTO expense_splits (expense_id, position, member_id, owed_amount) VALUES (?, ?, ?, ?)",
            rows
        );

        return new Expense(expenseId, draft.getGroupId(), draft.getPayerId(), draft.getTotalAmount(),
            draft.getSplitPolicy(), List.copyOf(splits), draft.getCreatedAt());
    }

    @Override
    public Optional<Expense> findById(long expenseId) {
        List<Expense> found = jdbcTemplate.query(
            SELECT_WITH_SPLITS + "WHERE e.id = ? ORDER BY s.position",
            expenseExtractor(),
            expenseId
        );
        return found == null || found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public Optional<Expense> findByIdempotencyKey(String idempotencyKey) {
        List<Expense> found = jdbcTemplate.query(
            SELECT_WITH_SPLITS + "WHERE e.idempotency_key = ? ORDER BY s.position",
            expenseExtractor(),
            idempotencyKey
        );
        return found == null || found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public List<Expense> findByGroup(String groupId, int limit, int offset) {
        return jdbcTemplate.query(
            SELECT_WITH_SPLITS +
            "WHERE e.id IN (SELECT id FROM expenses WHERE group_id = ? ORDER BY id DESC LIMIT ? OFFSET ?) " +
            "ORDER BY e.id DESC, s.position",
            expenseExtractor(),
            groupId, limit, offset
        );
    }

    @Override
    public List<Expense> findAllByGroupInPostingOrder(String groupId) {
        return jdbcTemplate.query(
            SELECT_WITH_SPLITS + "WHERE e.group_id = ? ORDER BY e.id, s.position",
            expenseExtractor(),
            groupId
        );
    }

    @Override
    public List<Expense> findByParticipant(String memberId, String groupId, int limit) {
        String memberFilter =
            "SELECT x.id FROM expenses x JOIN expense_splits xs ON xs.expense_id = x.id " +
            "WHERE xs.member_id = ? AND (CAST(? AS VARCHAR) IS NULL OR x.group_id = ?) " +
            "ORDER BY x.id DESC LIMIT ?";
        return jdbcTemplate.query(
            SELECT_WITH_SPLITS + "WHERE e.id IN (" + memberFilter + ") ORDER BY e.id DESC, s.position",
            expenseExtractor(),
            memberId, groupId, groupId, limit
        );
    }

    @Override
    public int countByGroup(String groupId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM expenses WHERE group_id = ?",
            Integer.class,
            groupId
        );
        return count != null ? count : 0;
    }

    /**
     * Folds the joined rows back into expenses, keeping query order.
     */
    private ResultSetExtractor<List<Expense>> expenseExtractor() {
        return rs -> {
            Map<Long, ExpenseRow> byId = new LinkedHashMap<>();
            while (rs.next()) {
                long id = rs.getLong("id");
                ExpenseRow row = byId.get(id);
                if (row == null) {
                    row = new ExpenseRow(
                        id,
                        rs.getString("group_id"),
                        rs.getString("payer_id"),
                        rs.getLong("total_amount"),
                        rs.getString("split_policy"),
                        rs.getTimestamp("created_at").toInstant()
                    );
                    byId.put(id, row);
                }
                row.splits.add(new ExpenseSplit(id, rs.getString("member_id"), rs.getLong("owed_amount")));
            }
            return byId.values().stream().map(ExpenseRow::toExpense).toList();
        };
    }

    private static final class ExpenseRow {
        private final long id;
        private final String groupId;
        private final String payerId;
        private final long totalAmount;
        private final String splitPolicy;
        private final Instant createdAt;
        private final List<ExpenseSplit> splits = new ArrayList<>();

        private ExpenseRow(long id, String groupId, String payerId, long totalAmount,
                           String splitPolicy, Instant createdAt) {
            this.id = id;
            this.groupId = groupId;
            this.payerId = payerId;
            this.totalAmount = totalAmount;
            this.splitPolicy = splitPolicy;
            this.createdAt = createdAt;
        }

        private Expense toExpense() {
            return new Expense(id, groupId, payerId, totalAmount, splitPolicy, List.copyOf(splits), createdAt);
        }
    }
}
