package com.flagship.group_ledger.membership;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Reads the {@code group_members} table, which the group management layer
 * maintains.
 */
@Component
public class JdbcMembershipOracle implements MembershipOracle {

    private final JdbcTemplate jdbcTemplate;

    public JdbcMembershipOracle(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean isMember(String groupId, String memberId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM group_members WHERE group_id = ? AND member_id = ?",
            Integer.class,
            groupId,
            memberId
        );
        return count != null && count > 0;
    }
}
