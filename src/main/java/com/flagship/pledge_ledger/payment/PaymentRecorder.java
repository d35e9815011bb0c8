package com.flagship.pledge_ledger.payment;

import com.flagship.pledge_ledger.advance.AdvanceLedgerService;
import com.flagship.pledge_ledger.config.LedgerProperties;
import com.flagship.pledge_ledger.ledger.Actor;
import com.flagship.pledge_ledger.observability.LedgerMetrics;
import com.flagship.pledge_ledger.observability.LogContext;
import com.flagship.pledge_ledger.payment.exception.BusinessRuleViolationException;
import com.flagship.pledge_ledger.payment.exception.ConcurrentPaymentConflictException;
import com.flagship.pledge_ledger.payment.exception.InsufficientAdvanceBalanceException;
import com.flagship.pledge_ledger.payment.exception.LedgerRecordNotFoundException;
import com.flagship.pledge_ledger.receipt.ReceiptNumberAllocator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Records payments against pledge entries and outstanding records.
 *
 * Flow:
 * 1. Replay if the idempotency key was already used
 * 2. Preconditions and overshoot check on a first read (no writes)
 * 3. Mode rules; for advance draws, a first balance check
 * 4. Allocate the receipt number from the record kind's stream
 * 5. Commit in one transaction with a fresh re-read ({@link PaymentCommitService}),
 *    retrying from a new read if another write won the version race
 *
 * Not transactional itself: each commit attempt gets its own transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentRecorder {

    private final PaymentBearingStores stores;
    private final PaymentCommitService commitService;
    private final AdvanceLedgerService advanceLedgerService;
    private final ReceiptNumberAllocator receiptNumberAllocator;
    private final IdempotencyService idempotencyService;
    private final LedgerProperties properties;
    private final LedgerMetrics metrics;

    public PaymentOutcome recordPayment(RecordPaymentCommand command, Actor actor) {
        long startTime = System.currentTimeMillis();
        LedgerKind kind = command.getKind();
        LogContext.RecordScope logScope = LogContext.forRecord(kind, command.getRecordId());

        try {
            if (command.getIdempotencyKey() != null) {
                Optional<PaymentOutcome> replay = replay(command.getIdempotencyKey());
                if (replay.isPresent()) {
                    metrics.recordIdempotencyHit();
                    log.info("Idempotency key {} already applied, returning earlier payment", command.getIdempotencyKey());
                    return replay.get();
                }
                metrics.recordIdempotencyMiss();
            }

            PaymentBearingRecord snapshot = stores.load(kind, command.getRecordId());
            PaymentRules.checkPreconditions(snapshot, command.getAmount());
            PaymentRules.checkOvershoot(snapshot, command.getAmount());
            PaymentRules.checkMode(kind, command.getMode(), command.getFileUrl());

            if (command.getMode().isAdvanceDraw()) {
                long available = advanceLedgerService.remainingBalance(snapshot.getUserId());
                if (available < command.getAmount()) {
                    throw new InsufficientAdvanceBalanceException(snapshot.getUserId(), command.getAmount(), available);
                }
            }

            LocalDate date = command.getDate() != null ? command.getDate() : LocalDate.now();
            PaymentRecord payment = PaymentRecord.builder()
                .date(date)
                .amount(command.getAmount())
                .mode(command.getMode())
                .fileUrl(command.getFileUrl())
                .receiptNo(receiptNumberAllocator.allocate(kind.getReceiptStream(), date))
                .updatedBy(actor.getName())
                .build();

            PaymentOutcome outcome = commitWithRetry(kind, command.getRecordId(), payment, actor,
                command.getIdempotencyKey());

            metrics.recordPaymentRecorded(kind.name(), payment.getMode().getCode());
            return outcome;

        } catch (BusinessRuleViolationException e) {
            metrics.recordPaymentRejected(kind.name(), e.getRule());
            throw e;
        } catch (ConcurrentPaymentConflictException e) {
            metrics.recordPaymentRejected(kind.name(), "concurrent_update");
            throw e;
        } catch (IllegalArgumentException e) {
            metrics.recordPaymentRejected(kind.name(), "validation");
            throw e;
        } finally {
            metrics.recordPaymentLatency("record", System.currentTimeMillis() - startTime);
            logScope.close();
        }
    }

    private PaymentOutcome commitWithRetry(LedgerKind kind, long recordId, PaymentRecord payment,
                                           Actor actor, String idempotencyKey) {
        int maxAttempts = properties.getPayment().getMaxCommitAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return commitService.commit(kind, recordId, payment, actor, idempotencyKey);
            } catch (OptimisticLockingFailureException e) {
                metrics.recordCommitRetry(kind.name());
                log.debug("Commit attempt {} for {} #{} lost a version race, retrying", attempt, kind, recordId);
            }
        }
        throw new ConcurrentPaymentConflictException(String.format(
            "%s #%d is being updated by too many concurrent requests. Please retry.", kind.getLabel(), recordId));
    }

    private Optional<PaymentOutcome> replay(String idempotencyKey) {
        return idempotencyService.find(idempotencyKey).map(previous -> {
            PaymentBearingRecord record = stores.load(previous.getKind(), previous.getRecordId());
            List<PaymentRecord> payments = record.getPayments();
            int index = previous.getPaymentIndex();
            if (index >= payments.size() || !previous.getReceiptNo().equals(payments.get(index).getReceiptNo())) {
                // the list shifted since; find the payment by its receipt number
                index = indexOfReceipt(payments, previous.getReceiptNo());
            }
            if (index < 0) {
                throw new LedgerRecordNotFoundException(
                    "Payment " + previous.getReceiptNo() + " made under this idempotency key no longer exists");
            }
            return new PaymentOutcome(record, payments.get(index), index, true);
        });
    }

    private static int indexOfReceipt(List<PaymentRecord> payments, String receiptNo) {
        for (int i = 0; i < payments.size(); i++) {
            if (receiptNo.equals(payments.get(i).getReceiptNo())) {
                return i;
            }
        }
        return -1;
    }
}
