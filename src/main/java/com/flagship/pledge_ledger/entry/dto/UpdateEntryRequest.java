package com.flagship.pledge_ledger.entry.dto;

import com.flagship.pledge_ledger.entry.EntryChanges;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * Partial update; absent fields are left unchanged.
 */
@Value
@Builder
@Jacksonized
public class UpdateEntryRequest {

    String description;

    String occasion;

    LocalDate boliDate;

    @Positive(message = "Amount must be greater than 0")
    Long amount;

    @Min(value = 1, message = "Quantity must be at least 1")
    Integer quantity;

    public EntryChanges toChanges() {
        return EntryChanges.builder()
            .description(description)
            .occasion(occasion)
            .boliDate(boliDate)
            .amount(amount)
            .quantity(quantity)
            .build();
    }
}
