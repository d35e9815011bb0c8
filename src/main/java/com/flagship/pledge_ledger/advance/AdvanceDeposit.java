package com.flagship.pledge_ledger.advance;

import com.flagship.pledge_ledger.payment.PaymentMode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Money a user paid in ahead of any pledge. Drawn down later by
 * {@code advance_payment} payments against that user's pledges.
 */
@Value
@Builder
public class AdvanceDeposit {
    Long id;
    long userId;
    String userName;
    LocalDate date;
    long amount;
    PaymentMode mode;
    String attachmentUrl;
    String receiptNo;
    String createdBy;
    Instant createdAt;
}
