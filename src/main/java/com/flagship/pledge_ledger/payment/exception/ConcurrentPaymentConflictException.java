package com.flagship.pledge_ledger.payment.exception;

/**
 * Another request changed the record between validation and write, and the
 * payment no longer fits. The caller should re-read the record and retry.
 */
public class ConcurrentPaymentConflictException extends RuntimeException {

    public ConcurrentPaymentConflictException(String message) {
        super(message);
    }
}
