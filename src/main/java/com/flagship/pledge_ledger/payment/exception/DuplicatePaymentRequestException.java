package com.flagship.pledge_ledger.payment.exception;

/**
 * A second request with an idempotency key that is being applied concurrently.
 */
public class DuplicatePaymentRequestException extends RuntimeException {

    public DuplicatePaymentRequestException(String idempotencyKey, Throwable cause) {
        super("Payment request with idempotency key '" + idempotencyKey + "' is already being processed", cause);
    }
}
