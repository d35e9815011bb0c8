package com.flagship.pledge_ledger.advance;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One draw on a user's advance balance, applied to a pledge entry.
 */
@Value
@Builder
public class AdvanceUsage {
    long id;
    long userId;
    long entryId;
    long amount;
    LocalDate date;
    String createdBy;
    Instant createdAt;
}
