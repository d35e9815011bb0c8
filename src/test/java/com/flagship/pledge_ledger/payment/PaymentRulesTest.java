package com.flagship.pledge_ledger.payment;

import com.flagship.pledge_ledger.entry.PledgeEntry;
import com.flagship.pledge_ledger.payment.exception.BusinessRuleViolationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PaymentRulesTest {

    private static PledgeEntry entry(long total, long... paid) {
        PledgeEntry open = PledgeEntry.open(7, "Ramesh", "Shanti dhara", null,
            LocalDate.of(2024, 2, 1), total, 1, "admin").toBuilder().id(11).build();
        List<PaymentRecord> payments = Arrays.stream(paid)
            .mapToObj(amount -> PaymentRecord.builder()
                .date(LocalDate.of(2024, 2, 2))
                .amount(amount)
                .mode(PaymentMode.CASH)
                .receiptNo("SPDJMSJ-2024-00001")
                .build())
            .toList();
        return open.withPayments(payments);
    }

    private static String ruleOf(Runnable check) {
        return assertThrows(BusinessRuleViolationException.class, check::run).getRule();
    }

    @Test
    void acceptsPaymentWithinPending() {
        assertDoesNotThrow(() -> PaymentRules.checkPreconditions(entry(1000, 400), 600));
    }

    @Test
    void fullyPaidRejected() {
        assertEquals(PaymentRules.ALREADY_FULLY_PAID,
            ruleOf(() -> PaymentRules.checkPreconditions(entry(1000, 400, 600), 1)));
    }

    @Test
    void deletedEntryRejectedFirst() {
        PledgeEntry deleted = entry(1000, 1000).softDeleted();
        assertEquals(PaymentRules.RECORD_DELETED, ruleOf(() -> PaymentRules.checkPreconditions(deleted, -5)));
    }

    @Test
    @DisplayName("Non-positive amount is a validation error, not a business rule")
    void nonPositiveAmount() {
        assertThrows(IllegalArgumentException.class, () -> PaymentRules.checkPreconditions(entry(1000), 0));
        assertThrows(IllegalArgumentException.class, () -> PaymentRules.checkPreconditions(entry(1000), -1));
    }

    @Test
    void exceedsTotal() {
        assertEquals(PaymentRules.EXCEEDS_TOTAL, ruleOf(() -> PaymentRules.checkPreconditions(entry(1000), 1001)));
    }

    @Test
    void exceedsPending() {
        BusinessRuleViolationException e = assertThrows(BusinessRuleViolationException.class,
            () -> PaymentRules.checkPreconditions(entry(1000, 400), 700));

        assertEquals(PaymentRules.EXCEEDS_PENDING, e.getRule());
        assertEquals("600", e.getFigures().get("pendingAmount"));
        assertEquals("700", e.getFigures().get("amount"));
    }

    @Test
    void overshoot() {
        assertTrue(PaymentRules.wouldOvershoot(entry(1000, 900), 101));
        assertFalse(PaymentRules.wouldOvershoot(entry(1000, 900), 100));
        assertEquals(PaymentRules.OVERPAYMENT, ruleOf(() -> PaymentRules.checkOvershoot(entry(1000, 900), 101)));
    }

    @Test
    @DisplayName("Advance draws are only allowed on pledges")
    void advanceOnlyOnPledges() {
        assertDoesNotThrow(() -> PaymentRules.checkMode(LedgerKind.PLEDGE, PaymentMode.ADVANCE_PAYMENT, null));
        assertThrows(IllegalArgumentException.class,
            () -> PaymentRules.checkMode(LedgerKind.OUTSTANDING, PaymentMode.ADVANCE_PAYMENT, null));
    }

    @Test
    @DisplayName("Electronic payments on outstanding records need a proof file")
    void outstandingProofRequired() {
        assertThrows(IllegalArgumentException.class,
            () -> PaymentRules.checkMode(LedgerKind.OUTSTANDING, PaymentMode.UPI, " "));
        assertDoesNotThrow(
            () -> PaymentRules.checkMode(LedgerKind.OUTSTANDING, PaymentMode.UPI, "https://files/upi.png"));
        assertDoesNotThrow(() -> PaymentRules.checkMode(LedgerKind.OUTSTANDING, PaymentMode.CASH, null));
        assertDoesNotThrow(() -> PaymentRules.checkMode(LedgerKind.PLEDGE, PaymentMode.UPI, null));
    }
}
