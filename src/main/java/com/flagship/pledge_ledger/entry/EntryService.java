package com.flagship.pledge_ledger.entry;

import com.flagship.pledge_ledger.ledger.Actor;
import com.flagship.pledge_ledger.ledger.RecordKind;
import com.flagship.pledge_ledger.ledger.TransactionLogService;
import com.flagship.pledge_ledger.ledger.TransactionType;
import com.flagship.pledge_ledger.notification.LedgerNotifier;
import com.flagship.pledge_ledger.payment.LedgerKind;
import com.flagship.pledge_ledger.payment.PaymentRules;
import com.flagship.pledge_ledger.payment.exception.BusinessRuleViolationException;
import com.flagship.pledge_ledger.payment.exception.ConcurrentPaymentConflictException;
import com.flagship.pledge_ledger.payment.exception.LedgerRecordNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Lifecycle of pledge entries: create, update, soft delete and restore.
 *
 * Payments are handled by the payment package; this service owns everything
 * else about an entry. Each operation writes the entry and its log rows in
 * one transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntryService {

    public static final String ALREADY_DELETED = "ALREADY_DELETED";
    public static final String NOT_DELETED = "NOT_DELETED";
    public static final String TOTAL_BELOW_RECEIVED = "TOTAL_BELOW_RECEIVED";

    private final PledgeEntryRepository repository;
    private final TransactionLogService transactionLogService;
    private final LedgerNotifier notifier;

    @Transactional
    public PledgeEntry createEntry(long userId, String userName, String description, String occasion,
                                   LocalDate boliDate, long amount, int quantity, Actor actor) {
        requireNotFuture(boliDate);
        PledgeEntry saved = repository.insert(
            PledgeEntry.open(userId, userName, description, occasion, boliDate, amount, quantity, actor.getName()));

        transactionLogService.append(RecordKind.PLEDGE, saved.getId(), actor, TransactionType.CREDIT,
            saved.getTotalAmount(),
            String.format("Created pledge entry #%d for %s: %s", saved.getId(), userName, description),
            snapshot(saved));

        notifier.notifyEntryCreated(saved);
        log.info("Pledge entry created: id={}, userId={}, totalAmount={}", saved.getId(), userId, saved.getTotalAmount());
        return saved;
    }

    @Transactional
    public PledgeEntry updateEntry(long id, EntryChanges changes, Actor actor) {
        PledgeEntry entry = getEntry(id);
        PaymentRules.requireActive(entry);
        if (changes.getBoliDate() != null) {
            requireNotFuture(changes.getBoliDate());
        }

        PledgeEntry updated = entry.toBuilder()
            .description(changes.getDescription() != null ? changes.getDescription() : entry.getDescription())
            .occasion(changes.getOccasion() != null ? changes.getOccasion() : entry.getOccasion())
            .boliDate(changes.getBoliDate() != null ? changes.getBoliDate() : entry.getBoliDate())
            .build()
            .repriced(
                changes.getAmount() != null ? changes.getAmount() : entry.getAmount(),
                changes.getQuantity() != null ? changes.getQuantity() : entry.getQuantity());

        if (updated.getDescription().isBlank()) {
            throw new IllegalArgumentException("Description is required");
        }
        if (updated.getTotalAmount() < entry.getReceivedAmount()) {
            Map<String, Object> figures = new LinkedHashMap<>();
            figures.put("newTotalAmount", updated.getTotalAmount());
            figures.put("receivedAmount", entry.getReceivedAmount());
            throw new BusinessRuleViolationException(TOTAL_BELOW_RECEIVED, String.format(
                "New total %d is below the %d already received", updated.getTotalAmount(), entry.getReceivedAmount()),
                figures);
        }

        write(updated, entry.getVersion());

        Map<String, Object> diff = diff(entry, updated);
        transactionLogService.append(RecordKind.PLEDGE, id, actor, TransactionType.UPDATE_ENTRY,
            updated.getTotalAmount(), "Updated pledge entry #" + id, Map.of("changes", diff));
        transactionLogService.appendStatusChange(RecordKind.PLEDGE, id, actor, entry.getStatus(), updated.getStatus());
        notifier.notifyPaymentStatusChanged(updated, entry.getStatus(), updated.getStatus());

        log.info("Pledge entry updated: id={}, fields={}", id, diff.keySet());
        return getEntry(id);
    }

    /**
     * Marks the entry deleted and tags all its payments, so nothing counts as
     * received. Reversible with {@link #restoreEntry}.
     */
    @Transactional
    public PledgeEntry softDeleteEntry(long id, Actor actor) {
        PledgeEntry entry = getEntry(id);
        if (!entry.isActive()) {
            throw new BusinessRuleViolationException(ALREADY_DELETED, "Pledge entry #" + id + " is already deleted",
                Map.of("recordId", id));
        }

        PledgeEntry deleted = entry.softDeleted();
        write(deleted, entry.getVersion());

        transactionLogService.append(RecordKind.PLEDGE, id, actor, TransactionType.DEBIT, entry.getTotalAmount(),
            "Deleted pledge entry #" + id, snapshot(entry));
        transactionLogService.appendStatusChange(RecordKind.PLEDGE, id, actor, entry.getStatus(), deleted.getStatus());

        log.info("Pledge entry soft-deleted: id={}, by={}", id, actor.getName());
        return getEntry(id);
    }

    @Transactional
    public PledgeEntry restoreEntry(long id, Actor actor) {
        PledgeEntry entry = getEntry(id);
        if (entry.isActive()) {
            throw new BusinessRuleViolationException(NOT_DELETED, "Pledge entry #" + id + " is not deleted",
                Map.of("recordId", id));
        }

        PledgeEntry restored = entry.restored();
        write(restored, entry.getVersion());

        transactionLogService.append(RecordKind.PLEDGE, id, actor, TransactionType.CREDIT, restored.getTotalAmount(),
            "Restored pledge entry #" + id, snapshot(restored));
        transactionLogService.appendStatusChange(RecordKind.PLEDGE, id, actor, entry.getStatus(), restored.getStatus());

        log.info("Pledge entry restored: id={}, by={}", id, actor.getName());
        return getEntry(id);
    }

    @Transactional(readOnly = true)
    public PledgeEntry getEntry(long id) {
        return repository.findById(id)
            .orElseThrow(() -> LedgerRecordNotFoundException.of(LedgerKind.PLEDGE.getLabel(), id));
    }

    @Transactional(readOnly = true)
    public List<PledgeEntry> findByUser(long userId) {
        return repository.findByUserId(userId);
    }

    @Transactional(readOnly = true)
    public List<PledgeEntry> findDeleted() {
        return repository.findDeleted();
    }

    private void write(PledgeEntry updated, long expectedVersion) {
        if (!repository.compareAndSet(updated, expectedVersion)) {
            throw new ConcurrentPaymentConflictException(
                "Pledge entry #" + updated.getId() + " was modified concurrently. Please retry.");
        }
    }

    private static void requireNotFuture(LocalDate boliDate) {
        if (boliDate != null && boliDate.isAfter(LocalDate.now())) {
            throw new IllegalArgumentException("Boli date cannot be in the future");
        }
    }

    private static Map<String, Object> snapshot(PledgeEntry entry) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("userId", entry.getUserId());
        snapshot.put("userName", entry.getUserName());
        snapshot.put("description", entry.getDescription());
        snapshot.put("occasion", entry.getOccasion());
        snapshot.put("boliDate", entry.getBoliDate());
        snapshot.put("amount", entry.getAmount());
        snapshot.put("quantity", entry.getQuantity());
        snapshot.put("totalAmount", entry.getTotalAmount());
        snapshot.put("receivedAmount", entry.getReceivedAmount());
        snapshot.put("pendingAmount", entry.getPendingAmount());
        snapshot.put("status", entry.getStatus().getCode());
        snapshot.put("paymentCount", entry.getPayments().size());
        return snapshot;
    }

    private static Map<String, Object> diff(PledgeEntry before, PledgeEntry after) {
        Map<String, Object> diff = new LinkedHashMap<>();
        putIfChanged(diff, "description", before.getDescription(), after.getDescription());
        putIfChanged(diff, "occasion", before.getOccasion(), after.getOccasion());
        putIfChanged(diff, "boliDate", before.getBoliDate(), after.getBoliDate());
        putIfChanged(diff, "amount", before.getAmount(), after.getAmount());
        putIfChanged(diff, "quantity", before.getQuantity(), after.getQuantity());
        putIfChanged(diff, "totalAmount", before.getTotalAmount(), after.getTotalAmount());
        return diff;
    }

    private static void putIfChanged(Map<String, Object> diff, String field, Object from, Object to) {
        if (!Objects.equals(from, to)) {
            Map<String, Object> change = new LinkedHashMap<>();
            change.put("from", from);
            change.put("to", to);
            diff.put(field, change);
        }
    }
}
