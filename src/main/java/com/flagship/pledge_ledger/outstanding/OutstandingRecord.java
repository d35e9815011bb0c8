package com.flagship.pledge_ledger.outstanding;

import com.flagship.pledge_ledger.payment.LedgerKind;
import com.flagship.pledge_ledger.payment.PaymentBearingRecord;
import com.flagship.pledge_ledger.payment.PaymentRecord;
import com.flagship.pledge_ledger.payment.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A balance a user owed before they were moved onto the ledger.
 *
 * Paid off like a pledge, but its receipts come from the outstanding stream
 * and electronic payments against it must carry proof.
 */
@Value
@Builder(toBuilder = true)
public class OutstandingRecord implements PaymentBearingRecord {

    public static final String DEFAULT_DESCRIPTION = "Previous Outstanding Amount";

    long id;
    String serialNumber;
    long recordNumber;
    long userId;
    String userName;
    String description;
    long outstandingAmount;
    long receivedAmount;
    long pendingAmount;
    PaymentStatus status;
    List<PaymentRecord> payments;
    String attachmentUrl;
    long version;
    String createdBy;
    Instant createdAt;
    Instant updatedAt;

    @Override
    public LedgerKind getKind() {
        return LedgerKind.OUTSTANDING;
    }

    /**
     * The outstanding amount plays the role of the total owed.
     */
    @Override
    public long getTotalAmount() {
        return outstandingAmount;
    }

    @Override
    public boolean isActive() {
        return true;
    }
}
