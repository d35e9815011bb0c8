package com.flagship.pledge_ledger.payment.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An advance-payment draw larger than the payer's remaining advance balance.
 */
public class InsufficientAdvanceBalanceException extends BusinessRuleViolationException {

    public static final String RULE = "INSUFFICIENT_ADVANCE_BALANCE";

    public InsufficientAdvanceBalanceException(long userId, long requested, long available) {
        super(RULE,
            String.format("Insufficient advance balance for user %d: requested %d, available %d",
                userId, requested, available),
            figures(userId, requested, available));
    }

    private static Map<String, Object> figures(long userId, long requested, long available) {
        Map<String, Object> figures = new LinkedHashMap<>();
        figures.put("userId", userId);
        figures.put("requested", requested);
        figures.put("available", available);
        return figures;
    }
}
