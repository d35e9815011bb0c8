package com.flagship.pledge_ledger.outstanding;

import com.flagship.pledge_ledger.ledger.Actor;
import com.flagship.pledge_ledger.ledger.RecordKind;
import com.flagship.pledge_ledger.ledger.TransactionLogService;
import com.flagship.pledge_ledger.ledger.TransactionType;
import com.flagship.pledge_ledger.notification.LedgerNotifier;
import com.flagship.pledge_ledger.payment.LedgerKind;
import com.flagship.pledge_ledger.payment.PaymentStatus;
import com.flagship.pledge_ledger.payment.exception.LedgerRecordNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creation and lookup of previous-outstanding records.
 *
 * Each record gets a yearly serial {@code PO-YYYY-NNN} and a global record
 * number, both max + 1 under an advisory lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutstandingService {

    private final OutstandingRecordRepository repository;
    private final TransactionLogService transactionLogService;
    private final LedgerNotifier notifier;

    @Transactional
    public OutstandingRecord createRecord(long userId, String userName, String description, long outstandingAmount,
                                          String attachmentUrl, Actor actor) {
        if (userName == null || userName.isBlank()) {
            throw new IllegalArgumentException("User name is required");
        }
        if (outstandingAmount <= 0) {
            throw new IllegalArgumentException("Outstanding amount must be greater than 0");
        }

        repository.lockNumbering();
        Instant now = Instant.now();
        int year = LocalDate.ofInstant(now, ZoneId.systemDefault()).getYear();
        String serialNumber = formatSerial(year, repository.maxSerialSequence(year) + 1);

        OutstandingRecord saved = repository.insert(OutstandingRecord.builder()
            .serialNumber(serialNumber)
            .recordNumber(repository.maxRecordNumber() + 1)
            .userId(userId)
            .userName(userName)
            .description(description == null || description.isBlank()
                ? OutstandingRecord.DEFAULT_DESCRIPTION : description)
            .outstandingAmount(outstandingAmount)
            .receivedAmount(0)
            .pendingAmount(outstandingAmount)
            .status(PaymentStatus.PENDING)
            .payments(List.of())
            .attachmentUrl(attachmentUrl)
            .createdBy(actor.getName())
            .createdAt(now)
            .updatedAt(now)
            .build());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("serialNumber", saved.getSerialNumber());
        details.put("recordNumber", saved.getRecordNumber());
        details.put("userId", userId);
        details.put("userName", userName);
        details.put("outstandingAmount", outstandingAmount);
        transactionLogService.append(RecordKind.OUTSTANDING, saved.getId(), actor, TransactionType.CREDIT,
            outstandingAmount,
            String.format("Created previous outstanding record %s for %s", serialNumber, userName),
            details);

        notifier.notifyEntryCreated(saved);
        log.info("Outstanding record created: id={}, serial={}, userId={}, amount={}",
            saved.getId(), serialNumber, userId, outstandingAmount);
        return saved;
    }

    @Transactional(readOnly = true)
    public OutstandingRecord getRecord(long id) {
        return repository.findById(id)
            .orElseThrow(() -> LedgerRecordNotFoundException.of(LedgerKind.OUTSTANDING.getLabel(), id));
    }

    @Transactional(readOnly = true)
    public List<OutstandingRecord> findByUser(long userId) {
        return repository.findByUserId(userId);
    }

    static String formatSerial(int year, int sequence) {
        return String.format("PO-%d-%03d", year, sequence);
    }
}
