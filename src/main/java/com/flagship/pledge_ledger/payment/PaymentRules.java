package com.flagship.pledge_ledger.payment;

import com.flagship.pledge_ledger.payment.exception.BusinessRuleViolationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The checks a new payment has to pass, in the order they are applied.
 * Each one throws; none of them writes anything.
 */
public final class PaymentRules {

    public static final String RECORD_DELETED = "RECORD_DELETED";
    public static final String ALREADY_FULLY_PAID = "ALREADY_FULLY_PAID";
    public static final String NOTHING_PENDING = "NOTHING_PENDING";
    public static final String EXCEEDS_TOTAL = "EXCEEDS_TOTAL";
    public static final String EXCEEDS_PENDING = "EXCEEDS_PENDING";
    public static final String OVERPAYMENT = "OVERPAYMENT";
    public static final String ADVANCE_MODE_CHANGE = "ADVANCE_MODE_CHANGE";
    public static final String ADVANCE_AMOUNT_CHANGE = "ADVANCE_AMOUNT_CHANGE";

    private PaymentRules() {
    }

    /**
     * Active, not full, something pending, amount positive, within total, within pending.
     */
    public static void checkPreconditions(PaymentBearingRecord record, long amount) {
        requireActive(record);
        if (record.getStatus() == PaymentStatus.FULL) {
            throw violation(ALREADY_FULLY_PAID,
                record.getKind().getLabel() + " #" + record.getId() + " is already fully paid", record, amount);
        }
        if (record.getPendingAmount() <= 0) {
            throw violation(NOTHING_PENDING,
                "Nothing is pending on " + record.getKind().getLabel() + " #" + record.getId(), record, amount);
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("Payment amount must be greater than 0");
        }
        if (amount > record.getTotalAmount()) {
            throw violation(EXCEEDS_TOTAL, String.format(
                "Payment amount %d exceeds total amount %d", amount, record.getTotalAmount()), record, amount);
        }
        if (amount > record.getPendingAmount()) {
            throw violation(EXCEEDS_PENDING, String.format(
                "Payment amount %d exceeds pending amount %d", amount, record.getPendingAmount()), record, amount);
        }
    }

    /**
     * Would {@code amount} push the received total past what is owed?
     */
    public static boolean wouldOvershoot(PaymentBearingRecord record, long amount) {
        return record.getReceivedAmount() + amount > record.getTotalAmount();
    }

    public static void checkOvershoot(PaymentBearingRecord record, long amount) {
        if (wouldOvershoot(record, amount)) {
            throw violation(OVERPAYMENT, String.format(
                "Payment of %d would bring received amount to %d, above total %d",
                amount, record.getReceivedAmount() + amount, record.getTotalAmount()), record, amount);
        }
    }

    /**
     * Advance draws only against pledges; electronic payments on outstanding records need proof.
     */
    public static void checkMode(LedgerKind kind, PaymentMode mode, String fileUrl) {
        if (mode == null) {
            throw new IllegalArgumentException("Payment mode is required");
        }
        if (mode.isAdvanceDraw() && kind != LedgerKind.PLEDGE) {
            throw new IllegalArgumentException("Advance payments can only be applied to pledge entries");
        }
        if (kind == LedgerKind.OUTSTANDING && mode.isElectronicTransfer() && (fileUrl == null || fileUrl.isBlank())) {
            throw new IllegalArgumentException("Proof file is required for " + mode.getCode() + " payments");
        }
    }

    public static void requireActive(PaymentBearingRecord record) {
        if (!record.isActive()) {
            throw new BusinessRuleViolationException(RECORD_DELETED,
                record.getKind().getLabel() + " #" + record.getId() + " has been deleted",
                Map.of("recordId", record.getId()));
        }
    }

    public static BusinessRuleViolationException violation(String rule, String message,
                                                           PaymentBearingRecord record, long amount) {
        return new BusinessRuleViolationException(rule, message, figures(record, amount));
    }

    private static Map<String, Object> figures(PaymentBearingRecord record, long amount) {
        Map<String, Object> figures = new LinkedHashMap<>();
        figures.put("recordId", record.getId());
        figures.put("amount", amount);
        figures.put("totalAmount", record.getTotalAmount());
        figures.put("receivedAmount", record.getReceivedAmount());
        figures.put("pendingAmount", record.getPendingAmount());
        figures.put("status", record.getStatus().getCode());
        return figures;
    }
}
