package com.flagship.pledge_ledger.payment;

import lombok.Value;

/**
 * The record as it stands after a payment operation, plus the payment involved.
 *
 * {@code replayed} is true when an idempotency key matched an earlier request
 * and nothing new was written.
 */
@Value
public class PaymentOutcome {
    PaymentBearingRecord record;
    PaymentRecord payment;
    int paymentIndex;
    boolean replayed;
}
