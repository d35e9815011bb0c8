package com.flagship.pledge_ledger.payment;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Fields to change on an existing payment. Null means "leave as is".
 */
@Value
@Builder
public class PaymentChanges {
    LocalDate date;
    Long amount;
    PaymentMode mode;
    String fileUrl;

    /**
     * Names of the fields an operator is not allowed to touch that this change sets.
     */
    public Set<String> restrictedFieldsSet() {
        Set<String> fields = new LinkedHashSet<>();
        if (date != null) {
            fields.add("date");
        }
        if (amount != null) {
            fields.add("amount");
        }
        return fields;
    }

    public boolean hasNoChanges() {
        return date == null && amount == null && mode == null && fileUrl == null;
    }
}
