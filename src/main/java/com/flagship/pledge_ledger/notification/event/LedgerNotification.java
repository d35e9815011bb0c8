package com.flagship.pledge_ledger.notification.event;

import com.flagship.pledge_ledger.payment.LedgerKind;

import java.time.Instant;

/**
 * Base contract for notifications about a payer's ledger records.
 * Serialized as-is into the outbox payload.
 */
public interface LedgerNotification {

    String getEventType();

    LedgerKind getKind();

    long getRecordId();

    long getUserId();

    String getUserName();

    String getCorrelationId();

    Instant getOccurredAt();
}
