package com.flagship.pledge_ledger.notification.event;

import com.flagship.pledge_ledger.payment.LedgerKind;
import com.flagship.pledge_ledger.payment.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class PaymentStatusChangedNotification implements LedgerNotification {

    public static final String EVENT_TYPE = "PaymentStatusChanged";

    LedgerKind kind;
    long recordId;
    long userId;
    String userName;
    PaymentStatus oldStatus;
    PaymentStatus newStatus;
    String correlationId;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
