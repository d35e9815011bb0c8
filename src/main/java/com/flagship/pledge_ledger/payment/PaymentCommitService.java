package com.flagship.pledge_ledger.payment;

import com.flagship.pledge_ledger.advance.AdvanceLedgerService;
import com.flagship.pledge_ledger.ledger.Actor;
import com.flagship.pledge_ledger.ledger.RecordKind;
import com.flagship.pledge_ledger.ledger.TransactionLogService;
import com.flagship.pledge_ledger.ledger.TransactionType;
import com.flagship.pledge_ledger.notification.LedgerNotifier;
import com.flagship.pledge_ledger.payment.exception.ConcurrentPaymentConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One attempt at writing a validated payment.
 *
 * Everything here happens in a single transaction: the fresh re-read, the
 * advance draw, the payment list write, the log rows and the idempotency key.
 * If any step fails, none of them is kept.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentCommitService {

    private final PaymentBearingStores stores;
    private final AdvanceLedgerService advanceLedgerService;
    private final TransactionLogService transactionLogService;
    private final IdempotencyService idempotencyService;
    private final LedgerNotifier notifier;

    /**
     * @throws ConcurrentPaymentConflictException if the payment no longer fits after the re-read
     * @throws OptimisticLockingFailureException if another write landed between re-read and write;
     *         the caller may retry with a fresh read
     */
    @Transactional
    public PaymentOutcome commit(LedgerKind kind, long recordId, PaymentRecord payment,
                                 Actor actor, String idempotencyKey) {
        PaymentBearingRecord fresh = stores.load(kind, recordId);
        PaymentRules.requireActive(fresh);

        if (PaymentRules.wouldOvershoot(fresh, payment.getAmount())) {
            throw new ConcurrentPaymentConflictException(String.format(
                "%s #%d changed while the payment was being recorded: received is now %d of %d, "
                    + "a payment of %d no longer fits. Please retry.",
                kind.getLabel(), recordId, fresh.getReceivedAmount(), fresh.getTotalAmount(), payment.getAmount()));
        }

        if (payment.getMode().isAdvanceDraw()) {
            advanceLedgerService.drawForPayment(fresh.getUserId(), recordId, payment.getAmount(),
                payment.getDate(), actor);
        }

        List<PaymentRecord> payments = new ArrayList<>(fresh.getPayments());
        payments.add(payment);
        int index = payments.size() - 1;
        PaymentTotals totals = PaymentTotals.compute(fresh.getTotalAmount(), payments);

        if (!stores.forKind(kind).compareAndSetPayments(recordId, fresh.getVersion(), payments, totals)) {
            throw new OptimisticLockingFailureException(String.format(
                "%s #%d was modified concurrently (version %d)", kind.getLabel(), recordId, fresh.getVersion()));
        }

        RecordKind recordKind = RecordKind.of(kind);
        transactionLogService.append(recordKind, recordId, actor, TransactionType.DEBIT, payment.getAmount(),
            String.format("Payment of %d recorded against %s #%d", payment.getAmount(), kind.getLabel(), recordId),
            paymentDetails(payment, index, totals));
        transactionLogService.appendStatusChange(recordKind, recordId, actor, fresh.getStatus(), totals.getStatus());

        if (idempotencyKey != null) {
            idempotencyService.register(idempotencyKey,
                new IdempotentPayment(kind, recordId, index, payment.getReceiptNo()));
        }

        PaymentBearingRecord written = stores.load(kind, recordId);
        notifier.notifyPaymentRecorded(written, payment);
        notifier.notifyPaymentStatusChanged(written, fresh.getStatus(), totals.getStatus());

        log.info("Payment recorded: kind={}, recordId={}, amount={}, mode={}, receiptNo={}, status {} -> {}",
            kind, recordId, payment.getAmount(), payment.getMode().getCode(), payment.getReceiptNo(),
            fresh.getStatus().getCode(), totals.getStatus().getCode());

        return new PaymentOutcome(written, payment, index, false);
    }

    private static Map<String, Object> paymentDetails(PaymentRecord payment, int index, PaymentTotals totals) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("paymentIndex", index);
        details.put("payment", payment);
        details.put("receivedAmount", totals.getReceivedAmount());
        details.put("pendingAmount", totals.getPendingAmount());
        details.put("status", totals.getStatus().getCode());
        return details;
    }
}
