package com.flagship.pledge_ledger.payment.dto;

import com.flagship.pledge_ledger.payment.LedgerKind;
import com.flagship.pledge_ledger.payment.PaymentMode;
import com.flagship.pledge_ledger.payment.RecordPaymentCommand;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * Amount sign and size are checked by the payment rules, after the record
 * lookup, so an unknown record still answers 404.
 */
@Value
@Builder
@Jacksonized
public class RecordPaymentRequest {

    @NotNull(message = "Amount is required")
    Long amount;

    LocalDate date;

    @NotNull(message = "Payment mode is required")
    PaymentMode mode;

    String fileUrl;

    public RecordPaymentCommand toCommand(LedgerKind kind, long recordId, String idempotencyKey) {
        return RecordPaymentCommand.builder()
            .kind(kind)
            .recordId(recordId)
            .amount(amount)
            .date(date)
            .mode(mode)
            .fileUrl(fileUrl)
            .idempotencyKey(idempotencyKey)
            .build();
    }
}
