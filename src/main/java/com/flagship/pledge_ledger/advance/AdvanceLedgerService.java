package com.flagship.pledge_ledger.advance;

import com.flagship.pledge_ledger.ledger.Actor;
import com.flagship.pledge_ledger.ledger.RecordKind;
import com.flagship.pledge_ledger.ledger.TransactionLogService;
import com.flagship.pledge_ledger.ledger.TransactionType;
import com.flagship.pledge_ledger.payment.PaymentMode;
import com.flagship.pledge_ledger.payment.exception.InsufficientAdvanceBalanceException;
import com.flagship.pledge_ledger.receipt.ReceiptNumberAllocator;
import com.flagship.pledge_ledger.receipt.ReceiptStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The advance-payment balance ledger.
 *
 * A user's balance is the sum of their deposits minus the sum of their
 * usages, derived on every read and never stored. Draws happen inside the
 * payment's own transaction, under a per-user advisory lock, with a
 * conditional insert as the final guard, so the balance can never go negative.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdvanceLedgerService {

    private final AdvanceDepositRepository depositRepository;
    private final AdvanceUsageRepository usageRepository;
    private final ReceiptNumberAllocator receiptNumberAllocator;
    private final TransactionLogService transactionLogService;

    @Transactional(readOnly = true)
    public long remainingBalance(long userId) {
        return Math.max(0, usageRepository.rawBalance(userId));
    }

    /**
     * Records money paid in ahead of any pledge. The receipt number comes from
     * the boli stream.
     */
    @Transactional
    public AdvanceDeposit recordDeposit(long userId, String userName, LocalDate date, long amount,
                                        PaymentMode mode, String attachmentUrl, Actor actor) {
        if (userName == null || userName.isBlank()) {
            throw new IllegalArgumentException("User name is required");
        }
        if (date == null) {
            throw new IllegalArgumentException("Deposit date is required");
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("Amount must be greater than 0");
        }
        if (mode == null) {
            throw new IllegalArgumentException("Payment mode is required");
        }
        if (mode.isAdvanceDraw()) {
            throw new IllegalArgumentException("An advance deposit cannot itself be paid from the advance balance");
        }

        String receiptNo = receiptNumberAllocator.allocate(ReceiptStream.BOLI, date);

        AdvanceDeposit deposit = AdvanceDeposit.builder()
            .userId(userId)
            .userName(userName)
            .date(date)
            .amount(amount)
            .mode(mode)
            .attachmentUrl(attachmentUrl)
            .receiptNo(receiptNo)
            .createdBy(actor.getName())
            .createdAt(Instant.now())
            .build();
        AdvanceDeposit saved = depositRepository.save(AdvanceDepositEntity.fromDomain(deposit)).toDomain();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("payerId", userId);
        details.put("payerName", userName);
        details.put("mode", mode.getCode());
        details.put("receiptNo", receiptNo);
        transactionLogService.append(RecordKind.ADVANCE_DEPOSIT, saved.getId(), actor,
            TransactionType.ADVANCE_DEPOSIT, amount,
            "Advance payment of " + amount + " received from " + userName, details);

        log.info("Advance deposit recorded: userId={}, amount={}, receiptNo={}", userId, amount, receiptNo);
        return saved;
    }

    /**
     * Draws {@code amount} from the user's balance for a pledge payment.
     * Must run inside the transaction that writes the payment, so both commit
     * or neither does.
     *
     * @throws InsufficientAdvanceBalanceException if the balance no longer covers the amount
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void drawForPayment(long userId, long entryId, long amount, LocalDate date, Actor actor) {
        usageRepository.lockUser(userId);
        if (!usageRepository.insertIfCovered(userId, entryId, amount, date, actor.getName())) {
            long available = Math.max(0, usageRepository.rawBalance(userId));
            throw new InsufficientAdvanceBalanceException(userId, amount, available);
        }
        log.debug("Advance draw of {} applied to entry {} for user {}", amount, entryId, userId);
    }

    @Transactional(readOnly = true)
    public List<AdvanceDeposit> findDeposits(long userId, LocalDate from, LocalDate to) {
        List<AdvanceDepositEntity> entities = (from != null && to != null)
            ? depositRepository.findByUserIdAndDateBetweenOrderByDateDescIdDesc(userId, from, to)
            : depositRepository.findByUserIdOrderByDateDescIdDesc(userId);
        return entities.stream().map(AdvanceDepositEntity::toDomain).toList();
    }

    @Transactional(readOnly = true)
    public List<AdvanceUsage> findUsages(long userId) {
        return usageRepository.findByUserId(userId);
    }
}
