package com.flagship.pledge_ledger.entry.dto;

import jakarta.validation.constraints.Min;
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
public class CreateEntryRequest {

    @NotNull(message = "User ID is required")
    Long userId;

    @NotBlank(message = "User name is required")
    String userName;

    @NotBlank(message = "Description is required")
    String description;

    String occasion;

    @NotNull(message = "Boli date is required")
    LocalDate boliDate;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    Long amount;

    @Min(value = 1, message = "Quantity must be at least 1")
    Integer quantity;
}
