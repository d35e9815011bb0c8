package com.flagship.pledge_ledger.entry.dto;

import com.flagship.pledge_ledger.entry.PledgeEntry;
import com.flagship.pledge_ledger.payment.PaymentRecord;
import com.flagship.pledge_ledger.payment.PaymentStatus;
import com.flagship.pledge_ledger.payment.RecordStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class EntryResponse {
    long id;
    long userId;
    String userName;
    String description;
    String occasion;
    LocalDate boliDate;
    long amount;
    int quantity;
    long totalAmount;
    long receivedAmount;
    long pendingAmount;
    PaymentStatus status;
    RecordStatus entryStatus;
    List<PaymentRecord> payments;
    String createdBy;
    Instant createdAt;
    Instant updatedAt;

    public static EntryResponse from(PledgeEntry entry) {
        return EntryResponse.builder()
            .id(entry.getId())
            .userId(entry.getUserId())
            .userName(entry.getUserName())
            .description(entry.getDescription())
            .occasion(entry.getOccasion())
            .boliDate(entry.getBoliDate())
            .amount(entry.getAmount())
            .quantity(entry.getQuantity())
            .totalAmount(entry.getTotalAmount())
            .receivedAmount(entry.getReceivedAmount())
            .pendingAmount(entry.getPendingAmount())
            .status(entry.getStatus())
            .entryStatus(entry.getEntryStatus())
            .payments(entry.getPayments())
            .createdBy(entry.getCreatedBy())
            .createdAt(entry.getCreatedAt())
            .updatedAt(entry.getUpdatedAt())
            .build();
    }
}
