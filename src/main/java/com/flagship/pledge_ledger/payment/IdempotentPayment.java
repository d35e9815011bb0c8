package com.flagship.pledge_ledger.payment;

import lombok.Value;

/**
 * Where the payment made under an idempotency key ended up.
 */
@Value
public class IdempotentPayment {
    LedgerKind kind;
    long recordId;
    int paymentIndex;
    String receiptNo;

    String toCacheValue() {
        return kind.name() + ":" + recordId + ":" + paymentIndex + ":" + receiptNo;
    }

    static IdempotentPayment fromCacheValue(String value) {
        String[] parts = value.split(":", 4);
        if (parts.length != 4) {
            throw new IllegalArgumentException("Malformed idempotency cache value: " + value);
        }
        return new IdempotentPayment(
            LedgerKind.valueOf(parts[0]),
            Long.parseLong(parts[1]),
            Integer.parseInt(parts[2]),
            parts[3]);
    }
}
