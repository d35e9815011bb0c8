package com.flagship.pledge_ledger.payment.dto;

import com.flagship.pledge_ledger.payment.LedgerKind;
import com.flagship.pledge_ledger.payment.PaymentBearingRecord;
import com.flagship.pledge_ledger.payment.PaymentOutcome;
import com.flagship.pledge_ledger.payment.PaymentRecord;
import com.flagship.pledge_ledger.payment.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PaymentOutcomeResponse {
    LedgerKind recordKind;
    long recordId;
    long userId;
    long totalAmount;
    long receivedAmount;
    long pendingAmount;
    PaymentStatus status;
    PaymentRecord payment;
    int paymentIndex;
    boolean replayed;
    List<PaymentRecord> payments;

    public static PaymentOutcomeResponse from(PaymentOutcome outcome) {
        PaymentBearingRecord record = outcome.getRecord();
        return PaymentOutcomeResponse.builder()
            .recordKind(record.getKind())
            .recordId(record.getId())
            .userId(record.getUserId())
            .totalAmount(record.getTotalAmount())
            .receivedAmount(record.getReceivedAmount())
            .pendingAmount(record.getPendingAmount())
            .status(record.getStatus())
            .payment(outcome.getPayment())
            .paymentIndex(outcome.getPaymentIndex())
            .replayed(outcome.isReplayed())
            .payments(record.getPayments())
            .build();
    }
}
