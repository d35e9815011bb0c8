package com.flagship.pledge_ledger.entry;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Fields to change on a pledge entry. Null means "leave as is".
 */
@Value
@Builder
public class EntryChanges {
    String description;
    String occasion;
    LocalDate boliDate;
    Long amount;
    Integer quantity;
}
