package com.flagship.pledge_ledger.payment;

import lombok.Value;

import java.util.List;

/**
 * Received amount, pending amount and status derived from a payment list.
 *
 * These three fields are stored next to the payments as a materialized view,
 * but the payment list is the source of truth: every mutation recomputes
 * them here, inside the same write.
 */
@Value
public class PaymentTotals {
    long receivedAmount;
    long pendingAmount;
    PaymentStatus status;

    public static PaymentTotals compute(long totalAmount, List<PaymentRecord> payments) {
        long received = payments.stream()
            .filter(payment -> !payment.isDeleted())
            .mapToLong(PaymentRecord::getAmount)
            .sum();
        long pending = Math.max(0, totalAmount - received);
        return new PaymentTotals(received, pending, PaymentStatus.derive(received, totalAmount));
    }

    public static PaymentTotals empty(long totalAmount) {
        return new PaymentTotals(0, totalAmount, PaymentStatus.PENDING);
    }
}
