package com.flagship.pledge_ledger.payment.exception;

/**
 * The pledge entry, outstanding record or payment index does not exist.
 */
public class LedgerRecordNotFoundException extends RuntimeException {

    public LedgerRecordNotFoundException(String message) {
        super(message);
    }

    public static LedgerRecordNotFoundException of(String label, long id) {
        return new LedgerRecordNotFoundException(label + " not found: " + id);
    }
}
