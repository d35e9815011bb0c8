package com.flagship.pledge_ledger.entry;

import com.flagship.pledge_ledger.ledger.Actor;
import com.flagship.pledge_ledger.ledger.ActorRole;
import com.flagship.pledge_ledger.ledger.RecordKind;
import com.flagship.pledge_ledger.ledger.TransactionLogService;
import com.flagship.pledge_ledger.ledger.TransactionType;
import com.flagship.pledge_ledger.notification.LedgerNotifier;
import com.flagship.pledge_ledger.payment.PaymentMode;
import com.flagship.pledge_ledger.payment.PaymentRecord;
import com.flagship.pledge_ledger.payment.PaymentStatus;
import com.flagship.pledge_ledger.payment.RecordStatus;
import com.flagship.pledge_ledger.payment.exception.BusinessRuleViolationException;
import com.flagship.pledge_ledger.payment.exception.ConcurrentPaymentConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EntryServiceTest {

    private static final long ENTRY_ID = 12L;
    private static final Actor ADMIN = Actor.of(1, "treasurer", ActorRole.ADMIN);

    @Mock
    private PledgeEntryRepository repository;

    @Mock
    private TransactionLogService transactionLogService;

    @Mock
    private LedgerNotifier notifier;

    @InjectMocks
    private EntryService entryService;

    private PledgeEntry active;

    @BeforeEach
    void setUp() {
        active = PledgeEntry.open(21, "Kamla Devi", "Shanti dhara", "Mahavir Jayanti",
                LocalDate.of(2024, 4, 21), 500, 2, "admin")
            .toBuilder().id(ENTRY_ID).version(2).build()
            .withPayments(List.of(
                PaymentRecord.builder().date(LocalDate.of(2024, 4, 22)).amount(400)
                    .mode(PaymentMode.CASH).receiptNo("SPDJMSJ-2024-00001").updatedBy("clerk").build(),
                PaymentRecord.builder().date(LocalDate.of(2024, 4, 23)).amount(150)
                    .mode(PaymentMode.CHEQUE).fileUrl("https://files/chq-88.png")
                    .receiptNo("SPDJMSJ-2024-00002").updatedBy("clerk").build()));
    }

    @Test
    @DisplayName("Soft delete tags every payment and zeroes the received amount")
    void softDeleteWritesZeroedFigures() {
        when(repository.findById(ENTRY_ID)).thenReturn(Optional.of(active));
        when(repository.compareAndSet(any(), eq(2L))).thenReturn(true);

        entryService.softDeleteEntry(ENTRY_ID, ADMIN);

        ArgumentCaptor<PledgeEntry> written = ArgumentCaptor.forClass(PledgeEntry.class);
        verify(repository).compareAndSet(written.capture(), eq(2L));
        PledgeEntry deleted = written.getValue();
        assertEquals(RecordStatus.DELETED, deleted.getEntryStatus());
        assertEquals(0, deleted.getReceivedAmount());
        assertEquals(1000, deleted.getPendingAmount());
        assertEquals(PaymentStatus.PENDING, deleted.getStatus());
        assertTrue(deleted.getPayments().stream().allMatch(PaymentRecord::isDeleted));
    }

    @Test
    @DisplayName("Soft delete logs a reversing debit for the total and the status change")
    void softDeleteLogsDebit() {
        when(repository.findById(ENTRY_ID)).thenReturn(Optional.of(active));
        when(repository.compareAndSet(any(), eq(2L))).thenReturn(true);

        entryService.softDeleteEntry(ENTRY_ID, ADMIN);

        verify(transactionLogService).append(eq(RecordKind.PLEDGE), eq(ENTRY_ID), eq(ADMIN),
            eq(TransactionType.DEBIT), eq(1000L), anyString(), any());
        verify(transactionLogService).appendStatusChange(RecordKind.PLEDGE, ENTRY_ID, ADMIN,
            PaymentStatus.PARTIAL, PaymentStatus.PENDING);
    }

    @Test
    @DisplayName("Restore reproduces the figures and payments from before the delete")
    void restoreRoundTrip() {
        PledgeEntry deleted = active.softDeleted().toBuilder().version(3).build();
        when(repository.findById(ENTRY_ID)).thenReturn(Optional.of(deleted));
        when(repository.compareAndSet(any(), eq(3L))).thenReturn(true);

        entryService.restoreEntry(ENTRY_ID, ADMIN);

        ArgumentCaptor<PledgeEntry> written = ArgumentCaptor.forClass(PledgeEntry.class);
        verify(repository).compareAndSet(written.capture(), eq(3L));
        PledgeEntry restored = written.getValue();
        assertEquals(RecordStatus.ACTIVE, restored.getEntryStatus());
        assertEquals(active.getPayments(), restored.getPayments());
        assertEquals(active.getReceivedAmount(), restored.getReceivedAmount());
        assertEquals(active.getPendingAmount(), restored.getPendingAmount());
        assertEquals(active.getStatus(), restored.getStatus());

        verify(transactionLogService).append(eq(RecordKind.PLEDGE), eq(ENTRY_ID), eq(ADMIN),
            eq(TransactionType.CREDIT), eq(1000L), anyString(), any());
        verify(transactionLogService).appendStatusChange(RecordKind.PLEDGE, ENTRY_ID, ADMIN,
            PaymentStatus.PENDING, PaymentStatus.PARTIAL);
    }

    @Test
    void deletingTwiceRefused() {
        when(repository.findById(ENTRY_ID)).thenReturn(Optional.of(active.softDeleted()));

        BusinessRuleViolationException e = assertThrows(BusinessRuleViolationException.class,
            () -> entryService.softDeleteEntry(ENTRY_ID, ADMIN));

        assertEquals(EntryService.ALREADY_DELETED, e.getRule());
        verify(repository, never()).compareAndSet(any(), anyLong());
    }

    @Test
    void restoringActiveEntryRefused() {
        when(repository.findById(ENTRY_ID)).thenReturn(Optional.of(active));

        BusinessRuleViolationException e = assertThrows(BusinessRuleViolationException.class,
            () -> entryService.restoreEntry(ENTRY_ID, ADMIN));

        assertEquals(EntryService.NOT_DELETED, e.getRule());
    }

    @Test
    @DisplayName("A concurrent write during soft delete is a conflict and logs nothing")
    void softDeleteLostRace() {
        when(repository.findById(ENTRY_ID)).thenReturn(Optional.of(active));
        when(repository.compareAndSet(any(), eq(2L))).thenReturn(false);

        assertThrows(ConcurrentPaymentConflictException.class, () -> entryService.softDeleteEntry(ENTRY_ID, ADMIN));
        verify(transactionLogService, never()).append(any(), anyLong(), any(), any(), anyLong(), any(), any());
    }
}
