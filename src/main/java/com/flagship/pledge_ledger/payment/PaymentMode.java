package com.flagship.pledge_ledger.payment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a payment was made.
 *
 * ADVANCE_PAYMENT is special: it draws down the payer's advance deposit
 * balance instead of bringing in new money, and is only valid against pledges.
 */
public enum PaymentMode {
    CASH("cash"),
    UPI("upi"),
    CHEQUE("cheque"),
    NETBANKING("netbanking"),
    ADVANCE_PAYMENT("advance_payment");

    private final String code;

    PaymentMode(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isAdvanceDraw() {
        return this == ADVANCE_PAYMENT;
    }

    /**
     * Electronic transfers that carry a screenshot or scan as proof.
     */
    public boolean isElectronicTransfer() {
        return this == UPI || this == CHEQUE || this == NETBANKING;
    }

    @JsonCreator
    public static PaymentMode fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Payment mode is required");
        }
        for (PaymentMode mode : values()) {
            if (mode.code.equalsIgnoreCase(code) || mode.name().equalsIgnoreCase(code)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown payment mode: " + code);
    }
}
