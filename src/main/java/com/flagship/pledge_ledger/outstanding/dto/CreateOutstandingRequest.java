package com.flagship.pledge_ledger.outstanding.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CreateOutstandingRequest {

    @NotNull(message = "User ID is required")
    Long userId;

    @NotBlank(message = "User name is required")
    String userName;

    String description;

    @NotNull(message = "Outstanding amount is required")
    @Positive(message = "Outstanding amount must be greater than 0")
    Long outstandingAmount;

    String attachmentUrl;
}
