package com.flagship.pledge_ledger.entry;

import com.flagship.pledge_ledger.payment.LedgerKind;
import com.flagship.pledge_ledger.payment.PaymentBearingRecord;
import com.flagship.pledge_ledger.payment.PaymentRecord;
import com.flagship.pledge_ledger.payment.PaymentStatus;
import com.flagship.pledge_ledger.payment.PaymentTotals;
import com.flagship.pledge_ledger.payment.RecordStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * A pledge ("boli") made by a user, with the payments made against it so far.
 *
 * Immutable domain object. Received amount, pending amount and status are
 * always recomputed from the payment list whenever that list changes.
 */
@Value
@Builder(toBuilder = true)
public class PledgeEntry implements PaymentBearingRecord {
    long id;
    long userId;
    String userName;
    String description;
    String occasion;
    LocalDate boliDate;
    long amount;
    int quantity;
    long totalAmount;
    long receivedAmount;
    long pendingAmount;
    PaymentStatus status;
    RecordStatus entryStatus;
    List<PaymentRecord> payments;
    long version;
    String createdBy;
    Instant createdAt;
    Instant updatedAt;

    /**
     * A new, unsaved entry: nothing paid yet, whole total pending.
     *
     * @throws IllegalArgumentException if a field is missing or out of range
     */
    public static PledgeEntry open(long userId, String userName, String description, String occasion,
                                   LocalDate boliDate, long amount, int quantity, String createdBy) {
        requireText(userName, "User name");
        requireText(description, "Description");
        if (boliDate == null) {
            throw new IllegalArgumentException("Boli date is required");
        }
        long total = totalOf(amount, quantity);
        Instant now = Instant.now();
        return PledgeEntry.builder()
            .userId(userId)
            .userName(userName)
            .description(description)
            .occasion(occasion)
            .boliDate(boliDate)
            .amount(amount)
            .quantity(quantity)
            .totalAmount(total)
            .receivedAmount(0)
            .pendingAmount(total)
            .status(PaymentStatus.PENDING)
            .entryStatus(RecordStatus.ACTIVE)
            .payments(List.of())
            .version(0)
            .createdBy(createdBy)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    static long totalOf(long amount, int quantity) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Amount must be greater than 0");
        }
        if (quantity < 1) {
            throw new IllegalArgumentException("Quantity must be at least 1");
        }
        return Math.multiplyExact(amount, (long) quantity);
    }

    @Override
    public LedgerKind getKind() {
        return LedgerKind.PLEDGE;
    }

    @Override
    public boolean isActive() {
        return entryStatus == RecordStatus.ACTIVE;
    }

    public PledgeEntry withPayments(List<PaymentRecord> newPayments) {
        return withPaymentsAndTotal(newPayments, totalAmount);
    }

    /**
     * Changes unit amount and quantity, keeping the payments.
     */
    public PledgeEntry repriced(long newAmount, int newQuantity) {
        long newTotal = totalOf(newAmount, newQuantity);
        return toBuilder().amount(newAmount).quantity(newQuantity).build()
            .withPaymentsAndTotal(payments, newTotal);
    }

    /**
     * Soft delete: every payment tagged deleted, so nothing counts as received.
     */
    public PledgeEntry softDeleted() {
        List<PaymentRecord> tagged = payments.stream().map(PaymentRecord::tagDeleted).toList();
        return toBuilder().entryStatus(RecordStatus.DELETED).build().withPayments(tagged);
    }

    /**
     * Undoes {@link #softDeleted()}, reproducing the figures from before the delete.
     */
    public PledgeEntry restored() {
        List<PaymentRecord> untagged = payments.stream().map(PaymentRecord::untag).toList();
        return toBuilder().entryStatus(RecordStatus.ACTIVE).build().withPayments(untagged);
    }

    private PledgeEntry withPaymentsAndTotal(List<PaymentRecord> newPayments, long newTotal) {
        PaymentTotals totals = PaymentTotals.compute(newTotal, newPayments);
        return toBuilder()
            .payments(List.copyOf(newPayments))
            .totalAmount(newTotal)
            .receivedAmount(totals.getReceivedAmount())
            .pendingAmount(totals.getPendingAmount())
            .status(totals.getStatus())
            .build();
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
