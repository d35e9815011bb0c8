package com.flagship.pledge_ledger.payment.exception;

import java.util.Set;

/**
 * The caller's role may not change the named fields.
 */
public class RestrictedFieldChangeException extends RuntimeException {

    private final Set<String> fields;

    public RestrictedFieldChangeException(String message, Set<String> fields) {
        super(message);
        this.fields = Set.copyOf(fields);
    }

    public Set<String> getFields() {
        return fields;
    }
}
