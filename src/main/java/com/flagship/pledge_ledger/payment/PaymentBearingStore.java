package com.flagship.pledge_ledger.payment;

import java.util.List;
import java.util.Optional;

/**
 * Storage seam for payment-bearing records.
 *
 * Reads always go to the database (no session cache), so a second read
 * inside the same request sees payments committed by other requests.
 */
public interface PaymentBearingStore {

    LedgerKind kind();

    Optional<PaymentBearingRecord> findRecord(long id);

    /**
     * Replaces the payment list and derived totals if, and only if, the stored
     * version still equals {@code expectedVersion}.
     *
     * @return false when another writer got there first
     */
    boolean compareAndSetPayments(long id, long expectedVersion,
                                  List<PaymentRecord> payments, PaymentTotals totals);
}
