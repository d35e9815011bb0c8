package com.flagship.pledge_ledger.outstanding;

import com.flagship.pledge_ledger.payment.LedgerKind;
import com.flagship.pledge_ledger.payment.PaymentBearingRecord;
import com.flagship.pledge_ledger.payment.PaymentBearingStore;
import com.flagship.pledge_ledger.payment.PaymentListCodec;
import com.flagship.pledge_ledger.payment.PaymentRecord;
import com.flagship.pledge_ledger.payment.PaymentStatus;
import com.flagship.pledge_ledger.payment.PaymentTotals;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * JDBC store for previous-outstanding records. Same storage shape as pledge
 * entries: jsonb payment list, derived totals, compare-and-set on version.
 */
@Repository
public class OutstandingRecordRepository implements PaymentBearingStore {

    // two-key advisory locks live in a separate key space from the per-user advance lock
    private static final int NUMBERING_LOCK_CLASS = 7301;
    private static final int NUMBERING_LOCK_OBJECT = 1;

    private static final String SELECT_COLUMNS =
        "SELECT id, serial_number, record_number, user_id, user_name, description, outstanding_amount, " +
        "received_amount, pending_amount, status, payments::text AS payments, attachment_url, version, " +
        "created_by, created_at, updated_at FROM outstanding_records ";

    private final JdbcTemplate jdbcTemplate;
    private final PaymentListCodec paymentListCodec;
    private final RowMapper<OutstandingRecord> rowMapper = this::mapRow;

    public OutstandingRecordRepository(JdbcTemplate jdbcTemplate, PaymentListCodec paymentListCodec) {
        this.jdbcTemplate = jdbcTemplate;
        this.paymentListCodec = paymentListCodec;
    }

    /**
     * Serializes record numbering until the surrounding transaction ends.
     */
    public void lockNumbering() {
        jdbcTemplate.query("SELECT pg_advisory_xact_lock(?, ?)", (rs, rowNum) -> Boolean.TRUE,
            NUMBERING_LOCK_CLASS, NUMBERING_LOCK_OBJECT);
    }

    /**
     * Highest NNN among serials {@code PO-<year>-NNN}, or 0.
     */
    public int maxSerialSequence(int year) {
        String prefix = "PO-" + year + "-";
        Integer max = jdbcTemplate.queryForObject(
            "SELECT COALESCE(MAX(CAST(SUBSTRING(serial_number FROM CAST(? AS INTEGER)) AS INTEGER)), 0) " +
            "FROM outstanding_records WHERE serial_number LIKE ?",
            Integer.class,
            prefix.length() + 1,
            prefix + "%");
        return max != null ? max : 0;
    }

    public long maxRecordNumber() {
        Long max = jdbcTemplate.queryForObject(
            "SELECT COALESCE(MAX(record_number), 0) FROM outstanding_records", Long.class);
        return max != null ? max : 0L;
    }

    public OutstandingRecord insert(OutstandingRecord record) {
        Long id = jdbcTemplate.queryForObject(
            "INSERT INTO outstanding_records (serial_number, record_number, user_id, user_name, description, " +
            "outstanding_amount, received_amount, pending_amount, status, payments, attachment_url, version, " +
            "created_by, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, 0, ?, ?, ?) RETURNING id",
            Long.class,
            record.getSerialNumber(),
            record.getRecordNumber(),
            record.getUserId(),
            record.getUserName(),
            record.getDescription(),
            record.getOutstandingAmount(),
            record.getReceivedAmount(),
            record.getPendingAmount(),
            record.getStatus().getCode(),
            paymentListCodec.write(record.getPayments()),
            record.getAttachmentUrl(),
            record.getCreatedBy(),
            Timestamp.from(record.getCreatedAt()),
            Timestamp.from(record.getUpdatedAt())
        );
        if (id == null) {
            throw new IllegalStateException("Insert into outstanding_records returned no id");
        }
        return record.toBuilder().id(id).version(0).build();
    }

    public Optional<OutstandingRecord> findById(long id) {
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ?", rowMapper, id)
            .stream()
            .findFirst();
    }

    public List<OutstandingRecord> findByUserId(long userId) {
        return jdbcTemplate.query(SELECT_COLUMNS + "WHERE user_id = ? ORDER BY record_number DESC", rowMapper, userId);
    }

    @Override
    public LedgerKind kind() {
        return LedgerKind.OUTSTANDING;
    }

    @Override
    public Optional<PaymentBearingRecord> findRecord(long id) {
        return findById(id).map(record -> record);
    }

    @Override
    public boolean compareAndSetPayments(long id, long expectedVersion,
                                         List<PaymentRecord> payments, PaymentTotals totals) {
        int rows = jdbcTemplate.update(
            "UPDATE outstanding_records SET payments = ?::jsonb, received_amount = ?, pending_amount = ?, " +
            "status = ?, version = version + 1, updated_at = CURRENT_TIMESTAMP " +
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

    private OutstandingRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        return OutstandingRecord.builder()
            .id(rs.getLong("id"))
            .serialNumber(rs.getString("serial_number"))
            .recordNumber(rs.getLong("record_number"))
            .userId(rs.getLong("user_id"))
            .userName(rs.getString("user_name"))
            .description(rs.getString("description"))
            .outstandingAmount(rs.getLong("outstanding_amount"))
            .receivedAmount(rs.getLong("received_amount"))
            .pendingAmount(rs.getLong("pending_amount"))
            .status(PaymentStatus.fromCode(rs.getString("status")))
            .payments(paymentListCodec.read(rs.getString("payments")))
            .attachmentUrl(rs.getString("attachment_url"))
            .version(rs.getLong("version"))
            .createdBy(rs.getString("created_by"))
            .createdAt(rs.getTimestamp("created_at").toInstant())
            .updatedAt(rs.getTimestamp("updated_at").toInstant())
            .build();
    }
}
