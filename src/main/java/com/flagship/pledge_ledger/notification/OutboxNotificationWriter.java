package com.flagship.pledge_ledger.notification;

import com.flagship.pledge_ledger.notification.event.LedgerNotification;
import com.flagship.pledge_ledger.outbox.NotificationOutbox;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Moves committed ledger notifications into the outbox.
 *
 * Runs after the business transaction has committed, in a transaction of its
 * own. A failure here is logged and dropped: the payment has already been
 * recorded and must not be reported as failed because a notification was lost.
 */
@Component
@Slf4j
public class OutboxNotificationWriter {

    private final NotificationOutbox outbox;
    private final TransactionTemplate requiresNew;

    public OutboxNotificationWriter(NotificationOutbox outbox, PlatformTransactionManager transactionManager) {
        this.outbox = outbox;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onLedgerNotification(LedgerNotification notification) {
        try {
            requiresNew.executeWithoutResult(status -> outbox.enqueue(notification));
        } catch (RuntimeException e) {
            log.warn("Dropped {} notification for {} #{}: {}",
                notification.getEventType(), notification.getKind(), notification.getRecordId(), e.getMessage());
        }
    }
}
