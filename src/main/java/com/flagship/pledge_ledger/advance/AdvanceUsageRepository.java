package com.flagship.pledge_ledger.advance;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * JDBC access to advance_usages and the derived per-user balance.
 *
 * The balance is never stored. A draw is an {@code INSERT ... SELECT} that
 * only produces a row when the balance, computed in the same statement,
 * still covers the amount.
 */
@Repository
public class AdvanceUsageRepository {

    private static final String BALANCE_EXPRESSION =
        "(SELECT COALESCE(SUM(d.amount), 0) FROM advance_deposits d WHERE d.user_id = ?) - " +
        "(SELECT COALESCE(SUM(u.amount), 0) FROM advance_usages u WHERE u.user_id = ?)";

    private final JdbcTemplate jdbcTemplate;

    public AdvanceUsageRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Deposits minus usages. Can only be negative if rows were written outside this service.
     */
    public long rawBalance(long userId) {
        Long balance = jdbcTemplate.queryForObject("SELECT " + BALANCE_EXPRESSION, Long.class, userId, userId);
        return balance != null ? balance : 0L;
    }

    /**
     * Takes the per-user transaction-scoped advisory lock. Held until the
     * surrounding transaction ends; serializes draws by the same user.
     */
    public void lockUser(long userId) {
        jdbcTemplate.query("SELECT pg_advisory_xact_lock(?)", (rs, rowNum) -> Boolean.TRUE, userId);
    }

    /**
     * Inserts a usage row only if the user's balance covers {@code amount}.
     *
     * @return true if the row was written
     */
    public boolean insertIfCovered(long userId, long entryId, long amount, LocalDate date, String createdBy) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO advance_usages (user_id, entry_id, amount, usage_date, created_by, created_at) " +
            "SELECT ?, ?, ?, ?, ?, CURRENT_TIMESTAMP " +
            "WHERE " + BALANCE_EXPRESSION + " >= ?",
            userId, entryId, amount, date, createdBy,
            userId, userId, amount
        );
        return inserted == 1;
    }

    public List<AdvanceUsage> findByUserId(long userId) {
        return jdbcTemplate.query(
            "SELECT id, user_id, entry_id, amount, usage_date, created_by, created_at " +
            "FROM advance_usages WHERE user_id = ? ORDER BY id DESC",
            (rs, rowNum) -> AdvanceUsage.builder()
                .id(rs.getLong("id"))
                .userId(rs.getLong("user_id"))
                .entryId(rs.getLong("entry_id"))
                .amount(rs.getLong("amount"))
                .date(rs.getObject("usage_date", LocalDate.class))
                .createdBy(rs.getString("created_by"))
                .createdAt(rs.getTimestamp("created_at").toInstant())
                .build(),
            userId);
    }
}
