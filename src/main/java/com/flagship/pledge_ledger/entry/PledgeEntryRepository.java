package com.flagship.pledge_ledger.entry;

import com.flagship.pledge_ledger.payment.LedgerKind;
import com.flagship.pledge_ledger.payment.PaymentBearingRecord;
import com.flagship.pledge_ledger.payment.PaymentBearingStore;
import com.flagship.pledge_ledger.payment.PaymentListCodec;
import com.flagship.pledge_ledger.payment.PaymentRecord;
import com.flagship.pledge_ledger.payment.PaymentStatus;
import com.flagship.pledge_ledger.payment.PaymentTotals;
import com.flagship.pledge_ledger.payment.RecordStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * JDBC store for pledge entries.
 *
 * The payment list lives in a jsonb column next to its derived totals. Every
 * write is a compare-and-set on {@code version}, so two writers that read the
 * same entry cannot both succeed.
 */
@Repository
public class PledgeEntryRepository implements PaymentBearingStore {

    private static final String SELECT_COLUMNS =
        "SELECT id, user_id, user_name, description, occasion, boli_date, amount, quantity, " +
        "total_amount, received_amount, pending_amount, status, entry_status, payments::text AS payments, " +
        "version, created_by, created_at, updated_at FROM pledge_entries ";

    private final JdbcTemplate jdbcTemplate;
    private final PaymentListCodec paymentListCodec;
    private final RowMapper<PledgeEntry> rowMapper = this::mapRow;

    public PledgeEntryRepository(JdbcTemplate jdbcTemplate, PaymentListCodec paymentListCodec) {
        this.jdbcTemplate = jdbcTemplate;
        this.paymentListCodec = paymentListCodec;
    }

    /**
     * Inserts a new entry and returns it with its generated id.
     */
    public PledgeEntry insert(PledgeEntry entry) {
        Long id = jdbcTemplate.queryForObject(
            "INSERT INTO pledge_entries (user_id, user_name, description, occasion, boli_date, amount, quantity, " +
            "total_amount, received_amount, pending_amount, status, entry_status, payments, version, " +
            "created_by, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, 0, ?, ?, ?) RETURNING id",
            Long.class,
            entry.getUserId(),
            entry.getUserName(),
            entry.getDescription(),
            entry.getOccasion(),
            entry.getBoliDate(),
            entry.getAmount(),
            entry.getQuantity(),
            entry.getTotalAmount(),
            entry.getReceivedAmount(),
            entry.getPendingAmount(),
            entry.getStatus().getCode(),
            entry.getEntryStatus().getCode(),
            paymentListCodec.write(entry.getPayments()),
            entry.getCreatedBy(),
            Timestamp.from(entry.getCreatedAt()),
            Timestamp.from(entry.getUpdatedAt())
        );
        if (id == null) {
            throw new IllegalStateException("Insert into pledge_entries returned no id");
        }
        return entry.toBuilder().id(id).version(0).build();
    }

    public Optional<PledgeEntry> findById(long id) {
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ?", rowMapper, id)
            .stream()
            .findFirst();
    }

    public List<PledgeEntry> findByUserId(long userId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE user_id = ? AND entry_status = 'active' ORDER BY id DESC", rowMapper, userId);
    }

    public List<PledgeEntry> findDeleted() {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE entry_status = 'deleted' ORDER BY updated_at DESC, id DESC", rowMapper);
    }

    /**
     * Writes every mutable column of {@code updated} if the stored version is still {@code expectedVersion}.
     *
     * @return false when another writer got there first
     */
    public boolean compareAndSet(PledgeEntry updated, long expectedVersion) {
        int rows = jdbcTemplate.update(
            "UPDATE pledge_entries SET description = ?, occasion = ?, boli_date = ?, amount = ?, quantity = ?, " +
            "total_amount = ?, received_amount = ?, pending_amount = ?, status = ?, entry_status = ?, " +
            "payments = ?::jsonb, version = version + 1, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND version = ?",
            updated.getDescription(),
            updated.getOccasion(),
            updated.getBoliDate(),
            updated.getAmount(),
            updated.getQuantity(),
            updated.getTotalAmount(),
            updated.getReceivedAmount(),
            updated.getPendingAmount(),
            updated.getStatus().getCode(),
            updated.getEntryStatus().getCode(),
            paymentListCodec.write(updated.getPayments()),
            updated.getId(),
            expectedVersion
        );
        return rows == 1;
    }

    @Override
    public LedgerKind kind() {
        return LedgerKind.PLEDGE;
    }

    @Override
    public Optional<PaymentBearingRecord> findRecord(long id) {
        return findById(id).map(entry -> entry);
    }

    @Override
    public boolean compareAndSetPayments(long id, long expectedVersion,
                                         List<PaymentRecord> payments, PaymentTotals totals) {
        int rows = jdbcTemplate.update(
            "UPDATE pledge_entries SET payments = ?::jsonb, received_amount = ?, pending_amount = ?, status = ?, " +
            "version = version + 1, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND version = ?",
            paymentListCodec.write(payments),
            totals.getReceivedAmount(),
            totals.getPendingAmount(),
            totals.getStatus().getCode(),
            id,
            expectedVersion
        );
        return rows == 1;
    }

    private PledgeEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
        return PledgeEntry.builder()
            .id(rs.getLong("id"))
            .userId(rs.getLong("user_id"))
            .userName(rs.getString("user_name"))
            .description(rs.getString("description"))
            .occasion(rs.getString("occasion"))
            .boliDate(rs.getObject("boli_date", LocalDate.class))
            .amount(rs.getLong("amount"))
            .quantity(rs.getInt("quantity"))
            .totalAmount(rs.getLong("total_amount"))
            .receivedAmount(rs.getLong("received_amount"))
            .pendingAmount(rs.getLong("pending_amount"))
            .status(PaymentStatus.fromCode(rs.getString("status")))
            .entryStatus(RecordStatus.fromCode(rs.getString("entry_status")))
            .payments(paymentListCodec.read(rs.getString("payments")))
            .version(rs.getLong("version"))
            .createdBy(rs.getString("created_by"))
            .createdAt(rs.getTimestamp("created_at").toInstant())
            .updatedAt(rs.getTimestamp("updated_at").toInstant())
            .build();
    }
}
