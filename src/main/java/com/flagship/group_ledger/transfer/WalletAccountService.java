package com.flagship.group_ledger.transfer;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Service;

import java.util.OptionalLong;

/**
 * Opens and reads the member wallets that {@link JdbcTransferPrimitive} moves funds between.
 */
@Service
public class WalletAccountService {

    private final JdbcTemplate jdbcTemplate;

    public WalletAccountService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void openAccount(String memberId, long openingBalance) {
        if (openingBalance < 0) {
            throw new IllegalArgumentException("Opening balance must not be negative: " + openingBalance);
        }
        jdbcTemplate.update(
            "INSERT INTO wallet_accounts (member_id, balance, created_at, updated_at) " +
            "VALUES (?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)",
            memberId,
            openingBalance
        );
    }

    public OptionalLong getBalance(String memberId) {
        Long balance = jdbcTemplate.query(
            "SELECT balance FROM wallet_accounts WHERE member_id = ?",
            (ResultSetExtractor<Long>) rs -> rs.next() ? rs.getLong("balance") : null,
            memberId
        );
        return balance == null ? OptionalLong.empty() : OptionalLong.of(balance);
    }
}
