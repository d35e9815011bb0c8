package com.flagship.pledge_ledger.payment;

import java.util.List;

/**
 * A record that owns an ordered list of payments plus the totals derived from it.
 * Implemented by pledge entries and previous-outstanding records.
 */
public interface PaymentBearingRecord {

    LedgerKind getKind();

    long getId();

    long getUserId();

    String getUserName();

    String getDescription();

    long getTotalAmount();

    long getReceivedAmount();

    long getPendingAmount();

    PaymentStatus getStatus();

    List<PaymentRecord> getPayments();

    /**
     * Optimistic concurrency counter, bumped on every write.
     */
    long getVersion();

    /**
     * False once the record has been soft-deleted.
     */
    boolean isActive();
}
