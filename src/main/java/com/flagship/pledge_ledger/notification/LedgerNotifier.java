package com.flagship.pledge_ledger.notification;

import com.flagship.pledge_ledger.notification.event.EntryCreatedNotification;
import com.flagship.pledge_ledger.notification.event.PaymentRecordedNotification;
import com.flagship.pledge_ledger.notification.event.PaymentStatusChangedNotification;
import com.flagship.pledge_ledger.observability.LogContext;
import com.flagship.pledge_ledger.payment.PaymentBearingRecord;
import com.flagship.pledge_ledger.payment.PaymentRecord;
import com.flagship.pledge_ledger.payment.PaymentStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Tells the payer about changes to their ledger records.
 *
 * Call from inside the transaction that makes the change. Nothing leaves the
 * service unless that transaction commits; see {@link OutboxNotificationWriter}.
 * The payer is taken from the record itself.
 */
@Component
@RequiredArgsConstructor
public class LedgerNotifier {

    private final ApplicationEventPublisher eventPublisher;

    public void notifyEntryCreated(PaymentBearingRecord record) {
        eventPublisher.publishEvent(EntryCreatedNotification.builder()
            .kind(record.getKind())
            .recordId(record.getId())
            .userId(record.getUserId())
            .userName(record.getUserName())
            .description(record.getDescription())
            .totalAmount(record.getTotalAmount())
            .correlationId(LogContext.correlationId())
            .occurredAt(Instant.now())
            .build());
    }

    public void notifyPaymentRecorded(PaymentBearingRecord record, PaymentRecord payment) {
        eventPublisher.publishEvent(PaymentRecordedNotification.builder()
            .kind(record.getKind())
            .recordId(record.getId())
            .userId(record.getUserId())
            .userName(record.getUserName())
            .payment(payment)
            .receivedAmount(record.getReceivedAmount())
            .pendingAmount(record.getPendingAmount())
            .status(record.getStatus())
            .correlationId(LogContext.correlationId())
            .occurredAt(Instant.now())
            .build());
    }

    public void notifyPaymentStatusChanged(PaymentBearingRecord record,
                                           PaymentStatus oldStatus, PaymentStatus newStatus) {
        if (oldStatus == newStatus) {
            return;
        }
        eventPublisher.publishEvent(PaymentStatusChangedNotification.builder()
            .kind(record.getKind())
            .recordId(record.getId())
            .userId(record.getUserId())
            .userName(record.getUserName())
            .oldStatus(oldStatus)
            .newStatus(newStatus)
            .correlationId(LogContext.correlationId())
            .occurredAt(Instant.now())
            .build());
    }
}
