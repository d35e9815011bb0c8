package com.flagship.pledge_ledger.advance.dto;

import com.flagship.pledge_ledger.payment.PaymentMode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class AdvanceDepositRequest {

    @NotNull(message = "User ID is required")
    Long userId;

    @NotBlank(message = "User name is required")
    String userName;

    @NotNull(message = "Date is required")
    LocalDate date;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    Long amount;

    @NotNull(message = "Payment mode is required")
    PaymentMode mode;

    String attachmentUrl;
}
