package com.flagship.pledge_ledger.payment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How much of a payment-bearing record has been received.
 *
 * Status is never set directly. It is derived from the received amount
 * against the total every time the payment list changes.
 */
public enum PaymentStatus {
    /**
     * Nothing received yet.
     */
    PENDING("pending"),

    /**
     * Something received, but less than the total.
     */
    PARTIAL("partial"),

    /**
     * Received amount has reached the total. No further payments accepted.
     */
    FULL("full");

    private final String code;

    PaymentStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Three-way status rule: pending at zero, full at or above the total,
     * partial in between.
     */
    public static PaymentStatus derive(long receivedAmount, long totalAmount) {
        if (receivedAmount == 0) {
            return PENDING;
        }
        return receivedAmount >= totalAmount ? FULL : PARTIAL;
    }

    @JsonCreator
    public static PaymentStatus fromCode(String code) {
        for (PaymentStatus status : values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown payment status: " + code);
    }
}
