package com.flagship.pledge_ledger.payment;

import com.flagship.pledge_ledger.ledger.Actor;
import com.flagship.pledge_ledger.ledger.RecordKind;
import com.flagship.pledge_ledger.ledger.TransactionLogService;
import com.flagship.pledge_ledger.ledger.TransactionType;
import com.flagship.pledge_ledger.notification.LedgerNotifier;
import com.flagship.pledge_ledger.payment.exception.BusinessRuleViolationException;
import com.flagship.pledge_ledger.payment.exception.ConcurrentPaymentConflictException;
import com.flagship.pledge_ledger.payment.exception.LedgerRecordNotFoundException;
import com.flagship.pledge_ledger.payment.exception.RestrictedFieldChangeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Edits a payment already on a record.
 *
 * Admins may change date, amount, mode and proof. Operators may only change
 * the mode and attach proof, and moving a payment off cash needs proof.
 * The receipt number never changes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentEditor {

    private final PaymentBearingStores stores;
    private final TransactionLogService transactionLogService;
    private final LedgerNotifier notifier;

    @Transactional
    public PaymentOutcome editPayment(LedgerKind kind, long recordId, int index,
                                      PaymentChanges changes, Actor actor) {
        if (changes == null || changes.hasNoChanges()) {
            throw new IllegalArgumentException("No changes supplied");
        }

        PaymentBearingRecord record = stores.load(kind, recordId);
        PaymentRules.requireActive(record);
        PaymentRecord before = paymentAt(record, index);

        checkRoleRestrictions(before, changes, actor);
        PaymentRecord after = apply(before, changes, actor);
        checkModeAndAdvanceLink(kind, before, after);

        List<PaymentRecord> payments = new ArrayList<>(record.getPayments());
        payments.set(index, after);
        PaymentTotals totals = PaymentTotals.compute(record.getTotalAmount(), payments);
        if (totals.getReceivedAmount() > record.getTotalAmount()) {
            throw PaymentRules.violation(PaymentRules.OVERPAYMENT, String.format(
                "Changing the amount to %d would bring received amount to %d, above total %d",
                after.getAmount(), totals.getReceivedAmount(), record.getTotalAmount()), record, after.getAmount());
        }

        if (!stores.forKind(kind).compareAndSetPayments(recordId, record.getVersion(), payments, totals)) {
            throw new ConcurrentPaymentConflictException(String.format(
                "%s #%d was modified while the payment was being edited. Please retry.", kind.getLabel(), recordId));
        }

        RecordKind recordKind = RecordKind.of(kind);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("paymentIndex", index);
        details.put("before", before);
        details.put("after", after);
        details.put("changes", changes);
        transactionLogService.append(recordKind, recordId, actor, TransactionType.UPDATE_PAYMENT, after.getAmount(),
            String.format("Payment #%d (%s) on %s #%d updated", index, before.getReceiptNo(), kind.getLabel(), recordId),
            details);
        transactionLogService.appendStatusChange(recordKind, recordId, actor, record.getStatus(), totals.getStatus());

        PaymentBearingRecord written = stores.load(kind, recordId);
        notifier.notifyPaymentStatusChanged(written, record.getStatus(), totals.getStatus());

        log.info("Payment edited: kind={}, recordId={}, index={}, by={}", kind, recordId, index, actor.getName());
        return new PaymentOutcome(written, after, index, false);
    }

    static PaymentRecord paymentAt(PaymentBearingRecord record, int index) {
        if (index < 0 || index >= record.getPayments().size()) {
            throw new LedgerRecordNotFoundException(String.format(
                "Payment #%d not found on %s #%d", index, record.getKind().getLabel(), record.getId()));
        }
        return record.getPayments().get(index);
    }

    private static void checkRoleRestrictions(PaymentRecord before, PaymentChanges changes, Actor actor) {
        if (actor.isAdmin()) {
            return;
        }
        Set<String> restricted = changes.restrictedFieldsSet();
        if (!restricted.isEmpty()) {
            throw new RestrictedFieldChangeException(
                "Operators may only change the payment mode; not allowed: " + String.join(", ", restricted),
                restricted);
        }
        boolean leavingCash = before.getMode() == PaymentMode.CASH
            && changes.getMode() != null && changes.getMode() != PaymentMode.CASH;
        if (leavingCash && (changes.getFileUrl() == null || changes.getFileUrl().isBlank())) {
            throw new IllegalArgumentException("Proof file is required when changing a cash payment to "
                + changes.getMode().getCode());
        }
    }

    private static PaymentRecord apply(PaymentRecord before, PaymentChanges changes, Actor actor) {
        PaymentRecord.PaymentRecordBuilder builder = before.toBuilder().updatedBy(actor.getName());
        if (changes.getDate() != null) {
            builder.date(changes.getDate());
        }
        if (changes.getAmount() != null) {
            if (changes.getAmount() <= 0) {
                throw new IllegalArgumentException("Payment amount must be greater than 0");
            }
            builder.amount(changes.getAmount());
        }
        if (changes.getMode() != null) {
            builder.mode(changes.getMode());
        }
        if (changes.getFileUrl() != null) {
            builder.fileUrl(changes.getFileUrl());
        }
        return builder.build();
    }

    private static void checkModeAndAdvanceLink(LedgerKind kind, PaymentRecord before, PaymentRecord after) {
        if (before.getMode() != after.getMode()
                && (before.getMode().isAdvanceDraw() || after.getMode().isAdvanceDraw())) {
            throw new BusinessRuleViolationException(PaymentRules.ADVANCE_MODE_CHANGE,
                "A payment cannot be moved to or from advance_payment; delete it and record a new one",
                Map.of("from", before.getMode().getCode(), "to", after.getMode().getCode()));
        }
        if (before.getMode().isAdvanceDraw() && before.getAmount() != after.getAmount()) {
            Map<String, Object> figures = new LinkedHashMap<>();
            figures.put("receiptNo", before.getReceiptNo());
            figures.put("currentAmount", before.getAmount());
            figures.put("requestedAmount", after.getAmount());
            throw new BusinessRuleViolationException(PaymentRules.ADVANCE_AMOUNT_CHANGE,
                "The amount of an advance_payment is fixed by its advance usage; delete it and record a new one",
                figures);
        }
        if (after.getMode() != before.getMode()) {
            PaymentRules.checkMode(kind, after.getMode(), after.getFileUrl());
        }
    }
}
