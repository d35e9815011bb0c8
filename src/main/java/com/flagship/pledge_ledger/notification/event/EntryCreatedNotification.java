package com.flagship.pledge_ledger.notification.event;

import com.flagship.pledge_ledger.payment.LedgerKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class EntryCreatedNotification implements LedgerNotification {

    public static final String EVENT_TYPE = "EntryCreated";

    LedgerKind kind;
    long recordId;
    long userId;
    String userName;
    String description;
    long totalAmount;
    String correlationId;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
