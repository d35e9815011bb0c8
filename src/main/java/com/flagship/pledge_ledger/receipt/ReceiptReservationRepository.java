package com.flagship.pledge_ledger.receipt;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Claims receipt numbers ahead of the payment write.
 *
 * A claim commits on its own, whatever happens to the payment afterwards.
 * Rows are never deleted: a number whose payment failed or was later
 * removed is burned, never reissued.
 */
@Repository
public class ReceiptReservationRepository {

    private final JdbcTemplate jdbcTemplate;

    public ReceiptReservationRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @return true if this caller now owns {@code receiptNo}, false if someone claimed it first
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean tryReserve(String receiptNo, ReceiptStream stream) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO receipt_reservations (receipt_no, stream, reserved_at) " +
            "VALUES (?, ?, CURRENT_TIMESTAMP) ON CONFLICT (receipt_no) DO NOTHING",
            receiptNo,
            stream.getCode()
        );
        return inserted == 1;
    }
}
