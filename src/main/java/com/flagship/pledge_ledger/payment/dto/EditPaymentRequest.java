package com.flagship.pledge_ledger.payment.dto;

import com.flagship.pledge_ledger.payment.PaymentChanges;
import com.flagship.pledge_ledger.payment.PaymentMode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class EditPaymentRequest {

    LocalDate date;

    Long amount;

    PaymentMode mode;

    String fileUrl;

    public PaymentChanges toChanges() {
        return PaymentChanges.builder()
            .date(date)
            .amount(amount)
            .mode(mode)
            .fileUrl(fileUrl)
            .build();
    }
}
