package com.flagship.group_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Balance cache in {@code group_balances}.
 *
 * The group scope is a transaction-scoped PostgreSQL advisory lock, so it is
 * released on commit or rollback and must be taken inside a transaction.
 * Balances are stored signed; arithmetic goes through {@link EncodedBalance}
 * so the overflow ceiling matches the in-memory store.
 */
@Repository
@Slf4j
public class JdbcBalanceStore implements BalanceStore {

    private final JdbcTemplate jdbcTemplate;

    public JdbcBalanceStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public <T> T withGroupLock(String groupId, Supplier<T> work) {
        jdbcTemplate.query(
            "SELECT pg_advisory_xact_lock(hashtextextended(?, 0))",
            (RowCallbackHandler) rs -> { },
            groupId
        );
        log.debug("Acquired group lock: groupId={}", groupId);
        return work.get();
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void applyDeltas(String groupId, Map<String, Long> deltas) {
        Map<String, Long> current = getBalances(groupId);

        // Compute every new value before the first write so an overflow leaves nothing behind
        Map<String, Long> next = new TreeMap<>();
        deltas.forEach((member, delta) ->
            next.put(member, EncodedBalance.addSigned(current.getOrDefault(member, 0L), delta)));

        next.forEach((member, balance) -> jdbcTemplate.update(
            "INSERT INTO group_balances (group_id, member_id, balance, updated_at) " +
            "VALUES (?, ?, ?, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (group_id, member_id) DO UPDATE SET balance = EXCLUDED.balance, updated_at = EXCLUDED.updated_at",
            groupId, member, balance
        ));
    }

    @Override
    public long getBalance(String groupId, String memberId) {
        Long balance = jdbcTemplate.query(
            "SELECT balance FROM group_balances WHERE group_id = ? AND member_id = ?",
            (ResultSetExtractor<Long>) rs -> rs.next() ? rs.getLong("balance") : null,
            groupId, memberId
        );
        return balance != null ? balance : 0L;
    }

    @Override
    public Map<String, Long> getBalances(String groupId) {
        Map<String, Long> balances = new TreeMap<>();
        jdbcTemplate.query(
            "SELECT member_id, balance FROM group_balances WHERE group_id = ? ORDER BY member_id",
            (RowCallbackHandler) rs -> balances.put(rs.getString("member_id"), rs.getLong("balance")),
            groupId
        );
        return balances;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void replaceBalances(String groupId, Map<String, Long> balances) {
        Map<String, Long> rows = new HashMap<>(balances);
        jdbcTemplate.update("DELETE FROM group_balances WHERE group_id = ?", groupId);
        rows.forEach((member, balance) -> jdbcTemplate.update(
            "INSERT INTO group_balances (group_id, member_id, balance, updated_at) VALUES (?, ?, ?, CURRENT_TIMESTAMP)",
            groupId, member, EncodedBalance.addSigned(0L, balance)
        ));
        log.warn("Replaced cached balances: groupId={}, members={}", groupId, rows.size());
    }
}
