package com.flagship.pledge_ledger.payment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Soft-delete marker, used both for a whole pledge entry and as the tag
 * placed on each of its embedded payments while the entry is deleted.
 */
public enum RecordStatus {
    ACTIVE("active"),
    DELETED("deleted");

    private final String code;

    RecordStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static RecordStatus fromCode(String code) {
        for (RecordStatus status : values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown record status: " + code);
    }
}
