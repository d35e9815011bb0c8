package com.flagship.pledge_ledger.entry;

import com.flagship.pledge_ledger.ledger.Actor;
import com.flagship.pledge_ledger.ledger.ActorRole;
import com.flagship.pledge_ledger.ledger.RecordKind;
import com.flagship.pledge_ledger.ledger.TransactionLog;
import com.flagship.pledge_ledger.ledger.TransactionLogService;
import com.flagship.pledge_ledger.ledger.TransactionType;
import com.flagship.pledge_ledger.outbox.NotificationOutbox;
import com.flagship.pledge_ledger.outbox.OutboxMessage;
import com.flagship.pledge_ledger.payment.LedgerKind;
import com.flagship.pledge_ledger.payment.PaymentDeleter;
import com.flagship.pledge_ledger.payment.PaymentMode;
import com.flagship.pledge_ledger.payment.PaymentOutcome;
import com.flagship.pledge_ledger.payment.PaymentRecord;
import com.flagship.pledge_ledger.payment.PaymentRecorder;
import com.flagship.pledge_ledger.payment.PaymentRules;
import com.flagship.pledge_ledger.payment.PaymentStatus;
import com.flagship.pledge_ledger.payment.RecordPaymentCommand;
import com.flagship.pledge_ledger.payment.exception.BusinessRuleViolationException;
import com.flagship.pledge_ledger.support.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PledgePaymentIntegrationTest extends IntegrationTestSupport {

    private static final Actor ADMIN = Actor.of(1, "treasurer", ActorRole.ADMIN);
    private static final LocalDate PAID_ON = LocalDate.of(2024, 7, 1);

    @Autowired
    private EntryService entryService;

    @Autowired
    private PaymentRecorder paymentRecorder;

    @Autowired
    private PaymentDeleter paymentDeleter;

    @Autowired
    private TransactionLogService transactionLogService;

    @Autowired
    private NotificationOutbox notificationOutbox;

    private PledgeEntry createEntry(long amount) {
        return entryService.createEntry(21, "Kamla Devi", "Shanti dhara", "Mahavir Jayanti",
            LocalDate.of(2024, 4, 21), amount, 1, ADMIN);
    }

    private PaymentOutcome pay(long entryId, long amount) {
        return paymentRecorder.recordPayment(RecordPaymentCommand.builder()
            .kind(LedgerKind.PLEDGE)
            .recordId(entryId)
            .amount(amount)
            .date(PAID_ON)
            .mode(PaymentMode.CASH)
            .build(), ADMIN);
    }

    @Test
    @DisplayName("400 then 600 against 1000: partial, then full, then every payment refused")
    void partialThenFull() {
        PledgeEntry entry = createEntry(1000);

        PaymentOutcome first = pay(entry.getId(), 400);
        assertEquals(PaymentStatus.PARTIAL, first.getRecord().getStatus());
        assertEquals(600, first.getRecord().getPendingAmount());
        assertEquals("SPDJMSJ-2024-00001", first.getPayment().getReceiptNo());

        PaymentOutcome second = pay(entry.getId(), 600);
        assertEquals(PaymentStatus.FULL, second.getRecord().getStatus());
        assertEquals(0, second.getRecord().getPendingAmount());
        assertEquals("SPDJMSJ-2024-00002", second.getPayment().getReceiptNo());
        assertEquals(1, second.getPaymentIndex());

        BusinessRuleViolationException e = assertThrows(BusinessRuleViolationException.class,
            () -> pay(entry.getId(), 1));
        assertEquals(PaymentRules.ALREADY_FULLY_PAID, e.getRule());

        PledgeEntry stored = entryService.getEntry(entry.getId());
        assertEquals(1000, stored.getReceivedAmount());
        assertEquals(2, stored.getPayments().size());
    }

    @Test
    @DisplayName("Every payment writes a debit row and each status move a status_change row")
    void paymentsAreLogged() {
        PledgeEntry entry = createEntry(1000);
        pay(entry.getId(), 400);
        pay(entry.getId(), 600);

        List<TransactionLog> logs = transactionLogService.findForRecord(RecordKind.PLEDGE, entry.getId());
        assertEquals(1, count(logs, TransactionType.CREDIT));
        assertEquals(2, count(logs, TransactionType.DEBIT));
        assertEquals(2, count(logs, TransactionType.STATUS_CHANGE));
        assertTrue(logs.stream().allMatch(log -> log.getUsername().equals("treasurer")));
    }

    @Test
    @DisplayName("Notifications land in the outbox after commit")
    void notificationsQueued() {
        PledgeEntry entry = createEntry(1000);
        pay(entry.getId(), 1000);

        // created, payment recorded, status pending -> full
        List<OutboxMessage> messages = notificationOutbox.messagesFor(LedgerKind.PLEDGE, entry.getId());
        assertEquals(List.of("EntryCreated", "PaymentRecorded", "PaymentStatusChanged"),
            messages.stream().map(OutboxMessage::getEventType).toList());
        assertTrue(messages.stream().allMatch(m -> m.getUserId() == 21 && !m.isDelivered()));
        assertEquals("PLEDGE:" + entry.getId(), messages.get(0).partitionKey());
    }

    @Test
    @DisplayName("Soft delete zeroes the figures, restore brings back the exact same ones")
    void softDeleteAndRestore() {
        PledgeEntry entry = createEntry(1000);
        pay(entry.getId(), 400);
        PledgeEntry before = entryService.getEntry(entry.getId());

        PledgeEntry deleted = entryService.softDeleteEntry(entry.getId(), ADMIN);
        assertEquals(0, deleted.getReceivedAmount());
        assertEquals(PaymentStatus.PENDING, deleted.getStatus());
        assertTrue(deleted.getPayments().stream().allMatch(PaymentRecord::isDeleted));
        assertTrue(entryService.findByUser(21).isEmpty());
        assertEquals(1, entryService.findDeleted().size());

        BusinessRuleViolationException refused = assertThrows(BusinessRuleViolationException.class,
            () -> pay(entry.getId(), 100));
        assertEquals(PaymentRules.RECORD_DELETED, refused.getRule());

        PledgeEntry restored = entryService.restoreEntry(entry.getId(), ADMIN);
        assertEquals(before.getPayments(), restored.getPayments());
        assertEquals(before.getReceivedAmount(), restored.getReceivedAmount());
        assertEquals(before.getPendingAmount(), restored.getPendingAmount());
        assertEquals(before.getStatus(), restored.getStatus());
    }

    @Test
    @DisplayName("Deleting a payment recomputes totals and its receipt number stays burned")
    void deletePaymentBurnsReceipt() {
        PledgeEntry entry = createEntry(1000);
        pay(entry.getId(), 400);
        pay(entry.getId(), 100);

        PaymentOutcome removed = paymentDeleter.deletePayment(LedgerKind.PLEDGE, entry.getId(), 1, ADMIN);
        assertEquals("SPDJMSJ-2024-00002", removed.getPayment().getReceiptNo());
        assertEquals(400, removed.getRecord().getReceivedAmount());
        assertEquals(600, removed.getRecord().getPendingAmount());

        List<TransactionLog> reversals = transactionLogService.findForRecord(RecordKind.PLEDGE, entry.getId()).stream()
            .filter(log -> log.getTransactionType() == TransactionType.CREDIT)
            .filter(log -> log.getDetails() != null && log.getDetails().containsKey("paymentIndex"))
            .toList();
        assertEquals(1, reversals.size());
        assertEquals(100, reversals.get(0).getAmount());
        assertEquals(1, ((Number) reversals.get(0).getDetails().get("paymentIndex")).intValue());

        PaymentOutcome next = pay(entry.getId(), 50);
        assertEquals("SPDJMSJ-2024-00003", next.getPayment().getReceiptNo());
    }

    @Test
    @DisplayName("Repricing below the received amount is refused")
    void repriceBelowReceived() {
        PledgeEntry entry = createEntry(1000);
        pay(entry.getId(), 600);

        BusinessRuleViolationException e = assertThrows(BusinessRuleViolationException.class,
            () -> entryService.updateEntry(entry.getId(), EntryChanges.builder().amount(500L).build(), ADMIN));
        assertEquals(EntryService.TOTAL_BELOW_RECEIVED, e.getRule());
    }

    @Test
    @DisplayName("Same idempotency key twice records one payment")
    void idempotentRetry() {
        PledgeEntry entry = createEntry(1000);
        RecordPaymentCommand command = RecordPaymentCommand.builder()
            .kind(LedgerKind.PLEDGE)
            .recordId(entry.getId())
            .amount(300)
            .date(PAID_ON)
            .mode(PaymentMode.CASH)
            .idempotencyKey("retry-" + entry.getId())
            .build();

        PaymentOutcome first = paymentRecorder.recordPayment(command, ADMIN);
        PaymentOutcome second = paymentRecorder.recordPayment(command, ADMIN);

        assertFalse(first.isReplayed());
        assertTrue(second.isReplayed());
        assertEquals(first.getPayment().getReceiptNo(), second.getPayment().getReceiptNo());
        assertEquals(1, entryService.getEntry(entry.getId()).getPayments().size());
    }

    private static long count(List<TransactionLog> logs, TransactionType type) {
        return logs.stream().filter(log -> log.getTransactionType() == type).count();
    }
}
