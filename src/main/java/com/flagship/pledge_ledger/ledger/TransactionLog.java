package com.flagship.pledge_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * One row of the audit trail. Never updated or deleted once written.
 *
 * {@code userId}/{@code username} identify who performed the action, not the payer.
 */
@Value
@Builder
public class TransactionLog {
    Long id;
    RecordKind recordKind;
    long entryId;
    long userId;
    String username;
    TransactionType transactionType;
    long amount;
    String description;
    Map<String, Object> details;
    LocalDate date;
    Instant timestamp;
}
