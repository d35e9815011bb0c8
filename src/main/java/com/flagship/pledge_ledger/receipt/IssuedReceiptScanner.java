package com.flagship.pledge_ledger.receipt;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects every receipt sequence already issued for a prefix and year.
 *
 * Both streams share one number space, so the scan covers all four places a
 * receipt number can live: pledge payments, outstanding-record payments,
 * advance deposits and the reservation table. Soft-deleted entries are
 * included; their numbers stay burned.
 */
@Repository
public class IssuedReceiptScanner {

    private static final String ISSUED_RECEIPTS_SQL = """
        SELECT p ->> 'receiptNo'
          FROM pledge_entries e, jsonb_array_elements(e.payments) p
         WHERE p ->> 'receiptNo' LIKE ?
        UNION
        SELECT p ->> 'receiptNo'
          FROM outstanding_records o, jsonb_array_elements(o.payments) p
         WHERE p ->> 'receiptNo' LIKE ?
        UNION
        SELECT receipt_no FROM advance_deposits WHERE receipt_no LIKE ?
        UNION
        SELECT receipt_no FROM receipt_reservations WHERE receipt_no LIKE ?
        """;

    private final JdbcTemplate jdbcTemplate;

    public IssuedReceiptScanner(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Set<Integer> issuedSequences(String prefix, int year) {
        String pattern = prefix + "-" + year + "-%";
        List<String> receipts = jdbcTemplate.queryForList(
            ISSUED_RECEIPTS_SQL, String.class, pattern, pattern, pattern, pattern);

        Set<Integer> used = new HashSet<>();
        for (String receipt : receipts) {
            ReceiptNumber.parse(receipt)
                .filter(number -> number.belongsTo(prefix, year))
                .ifPresent(number -> used.add(number.getSequence()));
        }
        return used;
    }
}
