package com.flagship.group_ledger.transfer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Double-entry wallet transfers in PostgreSQL.
 *
 * The transfer rows, both wallet updates and the caller's commit share one
 * database transaction, so a failing commit rolls the transfer back.
 * Both wallet rows are locked in member order before anything is written.
 * Database triggers reject edits to written transfers and entries.
 */
@Component
@Slf4j
public class JdbcTransferPrimitive implements TransferPrimitive {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public JdbcTransferPrimitive(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager,
                                 Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    @Override
    public TransferProof transferAndCommit(TransferInstruction instruction, TransferCommit commit) {
        String transferKey = instruction.getTransferKey();
        if (!inFlight.add(transferKey)) {
            throw new DuplicateTransferException(transferKey);
        }
        try {
            return transactionTemplate.execute(status -> {
                TransferProof proof = apply(instruction);
                commit.commit(proof);
                return proof;
            });
        } catch (PessimisticLockingFailureException e) {
            log.warn("Wallet lock failed, transfer rolled back: key={}, reason={}",
                transferKey, e.getMostSpecificCause().getMessage());
            throw new TransferContentionException(transferKey, e);
        } finally {
            inFlight.remove(transferKey);
        }
    }

    @Override
    public TransferStatus lookup(String transferKey) {
        if (inFlight.contains(transferKey)) {
            return TransferStatus.IN_FLIGHT;
        }
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM transfers WHERE transfer_key = ?",
            Integer.class,
            transferKey
        );
        return count != null && count > 0 ? TransferStatus.CONFIRMED : TransferStatus.NONE;
    }

    private TransferProof apply(TransferInstruction instruction) {
        UUID transferId = UUID.randomUUID();
        Instant now = Instant.now(clock);

        Map<String, Long> wallets = lockWallets(instruction.getFromMember(), instruction.getToMember());
        for (String member : new String[] {instruction.getFromMember(), instruction.getToMember()}) {
            if (!wallets.containsKey(member)) {
                throw new TransferRejectedException("No wallet for " + member);
            }
        }
        long available = wallets.get(instruction.getFromMember());
        if (available < instruction.getAmount()) {
            throw new TransferRejectedException(String.format(
                "Wallet %s holds %d, transfer needs %d", instruction.getFromMember(), available, instruction.getAmount()));
        }

        try {
            jdbcTemplate.update(
                "INSERT INTO transfers (id, transfer_key, from_member, to_member, amount, memo, created_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?)",
                transferId,
                instruction.getTransferKey(),
                instruction.getFromMember(),
                instruction.getToMember(),
                instruction.getAmount(),
                instruction.getMemo(),
                Timestamp.from(now)
            );
        } catch (DuplicateKeyException e) {
            throw new DuplicateTransferException(instruction.getTransferKey());
        }

        jdbcTemplate.update(
            "UPDATE wallet_accounts SET balance = balance - ?, updated_at = ? WHERE member_id = ?",
            instruction.getAmount(), Timestamp.from(now), instruction.getFromMember()
        );
        jdbcTemplate.update(
            "UPDATE wallet_accounts SET balance = balance + ?, updated_at = ? WHERE member_id = ?",
            instruction.getAmount(), Timestamp.from(now), instruction.getToMember()
        );

        createEntry(transferId, instruction.getFromMember(), instruction.getAmount(), EntryType.DEBIT, now);
        createEntry(transferId, instruction.getToMember(), instruction.getAmount(), EntryType.CREDIT, now);

        log.debug("Transfer applied: transferId={}, key={}, from={}, to={}, amount={}",
            transferId, instruction.getTransferKey(), instruction.getFromMember(),
            instruction.getToMember(), instruction.getAmount());

        return new TransferProof(transferId.toString(), instruction.getTransferKey(),
            instruction.getFromMember(), instruction.getToMember(), instruction.getAmount(), now);
    }

    // Ascending member order: opposite transfers between one pair must not deadlock.
    private Map<String, Long> lockWallets(String fromMember, String toMember) {
        Map<String, Long> balances = new HashMap<>();
        jdbcTemplate.query(
            "SELECT member_id, balance FROM wallet_accounts WHERE member_id IN (?, ?) ORDER BY member_id FOR UPDATE",
            (RowCallbackHandler) rs -> balances.put(rs.getString("member_id"), rs.getLong("balance")),
            fromMember,
            toMember
        );
        return balances;
    }

    private void createEntry(UUID transferId, String memberId, long amount, EntryType entryType, Instant now) {
        jdbcTemplate.update(
            "INSERT INTO transfer_entries (id, transfer_id, member_id, amount, entry_type, created_at) " +
            "VALUES (gen_random_uuid(), ?, ?, ?, ?, ?)",
            transferId,
            memberId,
            amount,
            entryType.name(),
            Timestamp.from(now)
        );
    }
}
