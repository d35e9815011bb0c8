package com.flagship.pledge_ledger.notification.event;

import com.flagship.pledge_ledger.payment.LedgerKind;
import com.flagship.pledge_ledger.payment.PaymentRecord;
import com.flagship.pledge_ledger.payment.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class PaymentRecordedNotification implements LedgerNotification {

    public static final String EVENT_TYPE = "PaymentRecorded";

    LedgerKind kind;
    long recordId;
    long userId;
    String userName;
    PaymentRecord payment;
    long receivedAmount;
    long pendingAmount;
    PaymentStatus status;
    String correlationId;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
