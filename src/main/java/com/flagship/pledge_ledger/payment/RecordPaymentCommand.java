package com.flagship.pledge_ledger.payment;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * A request to record one payment. {@code idempotencyKey} is optional.
 */
@Value
@Builder
public class RecordPaymentCommand {
    LedgerKind kind;
    long recordId;
    long amount;
    LocalDate date;
    PaymentMode mode;
    String fileUrl;
    String idempotencyKey;
}
