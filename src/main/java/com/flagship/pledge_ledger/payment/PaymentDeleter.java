package com.flagship.pledge_ledger.payment;

import com.flagship.pledge_ledger.ledger.Actor;
import com.flagship.pledge_ledger.ledger.RecordKind;
import com.flagship.pledge_ledger.ledger.TransactionLogService;
import com.flagship.pledge_ledger.ledger.TransactionType;
import com.flagship.pledge_ledger.notification.LedgerNotifier;
import com.flagship.pledge_ledger.payment.exception.ConcurrentPaymentConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Removes one payment from a record, as if it had never been made.
 *
 * The removed payment's receipt number stays burned. Removing an advance draw
 * does not give the money back to the advance balance: the usage row is kept
 * and the log row is flagged so it can be refunded by hand.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentDeleter {

    private final PaymentBearingStores stores;
    private final TransactionLogService transactionLogService;
    private final LedgerNotifier notifier;

    @Transactional
    public PaymentOutcome deletePayment(LedgerKind kind, long recordId, int index, Actor actor) {
        PaymentBearingRecord record = stores.load(kind, recordId);
        PaymentRules.requireActive(record);
        PaymentRecord removed = PaymentEditor.paymentAt(record, index);

        List<PaymentRecord> payments = new ArrayList<>(record.getPayments());
        payments.remove(index);
        PaymentTotals totals = PaymentTotals.compute(record.getTotalAmount(), payments);

        if (!stores.forKind(kind).compareAndSetPayments(recordId, record.getVersion(), payments, totals)) {
            throw new ConcurrentPaymentConflictException(String.format(
                "%s #%d was modified while the payment was being deleted. Please retry.", kind.getLabel(), recordId));
        }

        RecordKind recordKind = RecordKind.of(kind);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("paymentIndex", index);
        details.put("payment", removed);
        if (removed.getMode().isAdvanceDraw()) {
            details.put("advanceUsageRetained", true);
            log.warn("Deleted advance payment of {} on {} #{}; advance usage was not reversed",
                removed.getAmount(), kind, recordId);
        }
        transactionLogService.append(recordKind, recordId, actor, TransactionType.CREDIT, removed.getAmount(),
            String.format("Deleted payment record of %d from %s #%d", removed.getAmount(), kind.getLabel(), recordId),
            details);
        transactionLogService.appendStatusChange(recordKind, recordId, actor, record.getStatus(), totals.getStatus());

        PaymentBearingRecord written = stores.load(kind, recordId);
        notifier.notifyPaymentStatusChanged(written, record.getStatus(), totals.getStatus());

        log.info("Payment deleted: kind={}, recordId={}, index={}, amount={}, by={}",
            kind, recordId, index, removed.getAmount(), actor.getName());
        return new PaymentOutcome(written, removed, index, false);
    }
}
