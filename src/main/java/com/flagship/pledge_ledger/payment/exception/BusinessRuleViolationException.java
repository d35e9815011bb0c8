package com.flagship.pledge_ledger.payment.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A well-formed request that the ledger's rules refuse, such as paying more
 * than is pending or editing a deleted entry.
 *
 * Carries a stable rule code and the figures the decision was based on, so
 * the caller can tell the user exactly what is wrong.
 */
public class BusinessRuleViolationException extends RuntimeException {

    private final String rule;
    private final Map<String, String> figures;

    public BusinessRuleViolationException(String rule, String message) {
        this(rule, message, Map.of());
    }

    public BusinessRuleViolationException(String rule, String message, Map<String, ?> figures) {
        super(message);
        this.rule = rule;
        Map<String, String> copy = new LinkedHashMap<>();
        figures.forEach((key, value) -> copy.put(key, String.valueOf(value)));
        this.figures = Collections.unmodifiableMap(copy);
    }

    public String getRule() {
        return rule;
    }

    public Map<String, String> getFigures() {
        return figures;
    }
}
