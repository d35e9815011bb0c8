package com.flagship.pledge_ledger.payment;

import com.flagship.pledge_ledger.entry.PledgeEntry;
import com.flagship.pledge_ledger.ledger.Actor;
import com.flagship.pledge_ledger.ledger.ActorRole;
import com.flagship.pledge_ledger.ledger.TransactionLogService;
import com.flagship.pledge_ledger.notification.LedgerNotifier;
import com.flagship.pledge_ledger.payment.exception.BusinessRuleViolationException;
import com.flagship.pledge_ledger.payment.exception.ConcurrentPaymentConflictException;
import com.flagship.pledge_ledger.payment.exception.LedgerRecordNotFoundException;
import com.flagship.pledge_ledger.payment.exception.RestrictedFieldChangeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaymentEditorTest {

    private static final long ENTRY_ID = 17L;
    private static final Actor ADMIN = Actor.of(1, "treasurer", ActorRole.ADMIN);
    private static final Actor OPERATOR = Actor.of(2, "clerk", ActorRole.OPERATOR);

    @Mock
    private PaymentBearingStores stores;

    @Mock
    private PaymentBearingStore store;

    @Mock
    private TransactionLogService transactionLogService;

    @Mock
    private LedgerNotifier notifier;

    @InjectMocks
    private PaymentEditor editor;

    private PledgeEntry entry;

    @BeforeEach
    void setUp() {
        entry = PledgeEntry.open(4, "Anita", "Abhishek", null, LocalDate.of(2024, 5, 1), 1000, 1, "admin")
            .toBuilder().id(ENTRY_ID).version(3).build()
            .withPayments(List.of(PaymentRecord.builder()
                .date(LocalDate.of(2024, 5, 2))
                .amount(400)
                .mode(PaymentMode.CASH)
                .receiptNo("SPDJMSJ-2024-00001")
                .updatedBy("clerk")
                .build()));
    }

    private void storeAccepts() {
        when(stores.load(LedgerKind.PLEDGE, ENTRY_ID)).thenReturn(entry);
        when(stores.forKind(LedgerKind.PLEDGE)).thenReturn(store);
        when(store.compareAndSetPayments(eq(ENTRY_ID), eq(3L), anyList(), any())).thenReturn(true);
    }

    @Nested
    @DisplayName("Operator restrictions")
    class OperatorRestrictions {

        @Test
        void operatorCannotChangeAmountOrDate() {
            when(stores.load(LedgerKind.PLEDGE, ENTRY_ID)).thenReturn(entry);
            PaymentChanges changes = PaymentChanges.builder().amount(500L).date(LocalDate.of(2024, 5, 3)).build();

            RestrictedFieldChangeException e = assertThrows(RestrictedFieldChangeException.class,
                () -> editor.editPayment(LedgerKind.PLEDGE, ENTRY_ID, 0, changes, OPERATOR));

            assertEquals(Set.of("amount", "date"), e.getFields());
            verify(stores, never()).forKind(any());
        }

        @Test
        @DisplayName("Moving a cash payment to UPI needs a proof file in the same request")
        void leavingCashNeedsProof() {
            when(stores.load(LedgerKind.PLEDGE, ENTRY_ID)).thenReturn(entry);
            PaymentChanges changes = PaymentChanges.builder().mode(PaymentMode.UPI).build();

            assertThrows(IllegalArgumentException.class,
                () -> editor.editPayment(LedgerKind.PLEDGE, ENTRY_ID, 0, changes, OPERATOR));
        }

        @Test
        void operatorMayChangeModeWithProof() {
            storeAccepts();
            PaymentChanges changes = PaymentChanges.builder()
                .mode(PaymentMode.UPI)
                .fileUrl("https://files/upi-ref.png")
                .build();

            PaymentOutcome outcome = editor.editPayment(LedgerKind.PLEDGE, ENTRY_ID, 0, changes, OPERATOR);

            assertEquals(PaymentMode.UPI, outcome.getPayment().getMode());
            assertEquals("clerk", outcome.getPayment().getUpdatedBy());
            assertEquals("SPDJMSJ-2024-00001", outcome.getPayment().getReceiptNo());
        }
    }

    @Test
    @DisplayName("Admin may change the amount; totals are recomputed")
    void adminChangesAmount() {
        storeAccepts();

        editor.editPayment(LedgerKind.PLEDGE, ENTRY_ID, 0, PaymentChanges.builder().amount(1000L).build(), ADMIN);

        verify(store).compareAndSetPayments(eq(ENTRY_ID), eq(3L), anyList(),
            eq(new PaymentTotals(1000, 0, PaymentStatus.FULL)));
        verify(transactionLogService).appendStatusChange(any(), eq(ENTRY_ID), eq(ADMIN),
            eq(PaymentStatus.PARTIAL), eq(PaymentStatus.FULL));
    }

    @Test
    void amountAboveTotalRejected() {
        when(stores.load(LedgerKind.PLEDGE, ENTRY_ID)).thenReturn(entry);

        BusinessRuleViolationException e = assertThrows(BusinessRuleViolationException.class,
            () -> editor.editPayment(LedgerKind.PLEDGE, ENTRY_ID, 0, PaymentChanges.builder().amount(1001L).build(), ADMIN));

        assertEquals(PaymentRules.OVERPAYMENT, e.getRule());
    }

    @Test
    @DisplayName("Switching a payment to advance_payment is refused")
    void advanceModeChangeRefused() {
        when(stores.load(LedgerKind.PLEDGE, ENTRY_ID)).thenReturn(entry);
        PaymentChanges changes = PaymentChanges.builder().mode(PaymentMode.ADVANCE_PAYMENT).fileUrl("x").build();

        BusinessRuleViolationException e = assertThrows(BusinessRuleViolationException.class,
            () -> editor.editPayment(LedgerKind.PLEDGE, ENTRY_ID, 0, changes, ADMIN));

        assertEquals(PaymentRules.ADVANCE_MODE_CHANGE, e.getRule());
    }

    @Nested
    @DisplayName("Payments drawn from the advance balance")
    class AdvanceDraws {

        private PledgeEntry advancePaid;

        @BeforeEach
        void drawnEntry() {
            advancePaid = entry.withPayments(List.of(PaymentRecord.builder()
                .date(LocalDate.of(2024, 5, 2))
                .amount(500)
                .mode(PaymentMode.ADVANCE_PAYMENT)
                .receiptNo("SPDJMSJ-2024-00004")
                .updatedBy("treasurer")
                .build()));
        }

        @Test
        @DisplayName("Admin cannot change the amount of an advance_payment")
        void amountChangeRefused() {
            when(stores.load(LedgerKind.PLEDGE, ENTRY_ID)).thenReturn(advancePaid);

            BusinessRuleViolationException e = assertThrows(BusinessRuleViolationException.class,
                () -> editor.editPayment(LedgerKind.PLEDGE, ENTRY_ID, 0,
                    PaymentChanges.builder().amount(900L).build(), ADMIN));

            assertEquals(PaymentRules.ADVANCE_AMOUNT_CHANGE, e.getRule());
            assertEquals("500", e.getFigures().get("currentAmount"));
            assertEquals("900", e.getFigures().get("requestedAmount"));
            verify(stores, never()).forKind(any());
        }

        @Test
        void lowerAmountAlsoRefused() {
            when(stores.load(LedgerKind.PLEDGE, ENTRY_ID)).thenReturn(advancePaid);

            assertThrows(BusinessRuleViolationException.class, () -> editor.editPayment(LedgerKind.PLEDGE, ENTRY_ID, 0,
                PaymentChanges.builder().amount(100L).build(), ADMIN));
            verify(stores, never()).forKind(any());
        }

        @Test
        @DisplayName("Restating the same amount alongside a date fix is allowed")
        void sameAmountWithDateAllowed() {
            when(stores.load(LedgerKind.PLEDGE, ENTRY_ID)).thenReturn(advancePaid);
            when(stores.forKind(LedgerKind.PLEDGE)).thenReturn(store);
            when(store.compareAndSetPayments(eq(ENTRY_ID), eq(3L), anyList(), any())).thenReturn(true);

            PaymentOutcome outcome = editor.editPayment(LedgerKind.PLEDGE, ENTRY_ID, 0, PaymentChanges.builder()
                .amount(500L)
                .date(LocalDate.of(2024, 5, 3))
                .build(), ADMIN);

            assertEquals(LocalDate.of(2024, 5, 3), outcome.getPayment().getDate());
            assertEquals(500, outcome.getPayment().getAmount());
        }
    }

    @Test
    void unknownIndexIsNotFound() {
        when(stores.load(LedgerKind.PLEDGE, ENTRY_ID)).thenReturn(entry);

        assertThrows(LedgerRecordNotFoundException.class, () -> editor.editPayment(
            LedgerKind.PLEDGE, ENTRY_ID, 1, PaymentChanges.builder().mode(PaymentMode.CHEQUE).build(), ADMIN));
    }

    @Test
    void emptyChangeRejected() {
        assertThrows(IllegalArgumentException.class, () -> editor.editPayment(
            LedgerKind.PLEDGE, ENTRY_ID, 0, PaymentChanges.builder().build(), ADMIN));
    }

    @Test
    @DisplayName("A concurrent write between read and write surfaces as a conflict")
    void lostRaceIsConflict() {
        when(stores.load(LedgerKind.PLEDGE, ENTRY_ID)).thenReturn(entry);
        when(stores.forKind(LedgerKind.PLEDGE)).thenReturn(store);
        when(store.compareAndSetPayments(anyLong(), anyLong(), anyList(), any())).thenReturn(false);

        assertThrows(ConcurrentPaymentConflictException.class, () -> editor.editPayment(
            LedgerKind.PLEDGE, ENTRY_ID, 0, PaymentChanges.builder().mode(PaymentMode.CHEQUE).build(), ADMIN));
        verify(transactionLogService, never()).append(any(), anyLong(), any(), any(), anyLong(), any(), any());
    }
}
