package com.flagship.pledge_ledger.receipt;

import com.flagship.pledge_ledger.config.LedgerProperties;
import com.flagship.pledge_ledger.observability.LedgerMetrics;
import com.flagship.pledge_ledger.payment.exception.ConcurrentPaymentConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;

/**
 * Hands out the next free receipt number of a stream for a payment date's year.
 *
 * 1. Scan every issued number for {@code PREFIX-YEAR-*}
 * 2. Walk the stream's blocks to the first number not in that set
 * 3. Claim it in the reservation table; if a concurrent caller owns it,
 *    add it to the set and walk on
 * 4. After {@code max-claim-attempts} lost claims, re-scan and start another
 *    round, up to {@code max-scan-rounds}
 *
 * Losing every round is contention, reported as a retryable conflict. Only a
 * store that cannot be read or written leads to the fallback number (the last
 * five digits of the current epoch millis), which may collide and is counted
 * by the {@code receipt.allocation.fallback} metric.
 */
@Service
@Slf4j
public class ReceiptNumberAllocator {

    private final IssuedReceiptScanner scanner;
    private final ReceiptReservationRepository reservations;
    private final LedgerProperties properties;
    private final LedgerMetrics metrics;

    public ReceiptNumberAllocator(IssuedReceiptScanner scanner,
                                  ReceiptReservationRepository reservations,
                                  LedgerProperties properties,
                                  LedgerMetrics metrics) {
        this.scanner = scanner;
        this.reservations = reservations;
        this.properties = properties;
        this.metrics = metrics;
    }

    public String allocate(ReceiptStream stream, LocalDate paymentDate) {
        if (stream == null || paymentDate == null) {
            throw new IllegalArgumentException("Receipt stream and payment date are required");
        }
        String prefix = properties.getReceipt().getPrefix();
        int year = paymentDate.getYear();

        int maxAttempts = properties.getReceipt().getMaxClaimAttempts();
        int maxRounds = properties.getReceipt().getMaxScanRounds();
        Set<Integer> lost = new HashSet<>();

        try {
            for (int round = 1; round <= maxRounds; round++) {
                Set<Integer> used = new HashSet<>(scanner.issuedSequences(prefix, year));
                used.addAll(lost);
                String receiptNo = claimWithin(prefix, year, stream, used, lost, maxAttempts);
                if (receiptNo != null) {
                    log.debug("Allocated receipt {} for stream {} in scan round {}", receiptNo, stream, round);
                    return receiptNo;
                }
                log.warn("Lost {} receipt claims for stream {} in {}, re-scanning (round {} of {})",
                        maxAttempts, stream, year, round, maxRounds);
            }
        } catch (DataAccessException e) {
            log.error("Receipt allocation failed for stream {} in {}: {}", stream, year, e.getMessage(), e);
            return fallback(prefix, year, stream);
        }

        throw new ConcurrentPaymentConflictException(String.format(
                "Too many concurrent receipt claims for stream %s in %d. Please retry.", stream.getCode(), year));
    }

    private String claimWithin(String prefix, int year, ReceiptStream stream,
                               Set<Integer> used, Set<Integer> lost, int maxAttempts) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            int candidate = ReceiptBlockSequence.nextNumber(stream, used);
            String receiptNo = ReceiptNumber.of(prefix, year, candidate).format();
            if (reservations.tryReserve(receiptNo, stream)) {
                return receiptNo;
            }
            metrics.recordReceiptClaimConflict(stream.getCode());
            log.debug("Receipt {} already claimed, trying next candidate", receiptNo);
            used.add(candidate);
            lost.add(candidate);
        }
        return null;
    }

    private String fallback(String prefix, int year, ReceiptStream stream) {
        long suffix = System.currentTimeMillis() % 100_000L;
        String receiptNo = String.format("%s-%04d-%05d", prefix, year, suffix);
        metrics.recordReceiptFallback(stream.getCode());
        log.error("Issued fallback receipt number {} for stream {}; check for duplicates", receiptNo, stream);
        return receiptNo;
    }
}
