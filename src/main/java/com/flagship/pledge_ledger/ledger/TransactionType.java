package com.flagship.pledge_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of transaction log row.
 *
 * CREDIT raises what is owed (entry created, payment removed, entry restored);
 * DEBIT lowers it (payment recorded, entry deleted).
 */
public enum TransactionType {
    CREDIT("credit"),
    DEBIT("debit"),
    UPDATE_ENTRY("update_entry"),
    UPDATE_PAYMENT("update_payment"),
    STATUS_CHANGE("status_change"),
    ADVANCE_DEPOSIT("advance_deposit");

    private final String code;

    TransactionType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static TransactionType fromCode(String code) {
        for (TransactionType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown transaction type: " + code);
    }
}
