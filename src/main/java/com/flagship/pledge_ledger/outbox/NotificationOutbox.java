package com.flagship.pledge_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pledge_ledger.notification.event.LedgerNotification;
import com.flagship.pledge_ledger.payment.LedgerKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Durable queue of payer notifications between the ledger and Kafka.
 *
 * {@link #enqueue} joins the caller's transaction, so a notification exists
 * only if the write that produced it exists. {@link #deliverBatch} hands
 * messages to a {@link Sender} while holding their row locks and records the
 * outcome in the same transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationOutbox {

    /**
     * Pushes one message downstream. Returning normally means it was acknowledged.
     */
    @FunctionalInterface
    public interface Sender {
        void send(OutboxMessage message) throws Exception;
    }

    public interface DeliveryListener {
        void delivered(OutboxMessage message);

        void failed(OutboxMessage message, Exception cause, boolean abandoned);
    }

    private final OutboxMessageRepository repository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxMessage enqueue(LedgerNotification notification) {
        OutboxMessage message = repository.save(OutboxMessage.pending(
            notification.getKind(),
            notification.getRecordId(),
            notification.getUserId(),
            notification.getEventType(),
            notification.getCorrelationId(),
            toJson(notification)));

        log.debug("Queued {} for {} #{}", message.getEventType(), message.getRecordKind(), message.getRecordId());
        return message;
    }

    /**
     * Sends up to {@code limit} undelivered messages in sequence order.
     * Stops at the first failure so later messages for the same record are
     * not delivered ahead of an earlier one.
     *
     * @return number of messages delivered
     */
    @Transactional
    public int deliverBatch(int limit, int maxAttempts, Sender sender, DeliveryListener listener) {
        List<OutboxMessage> batch = repository.lockDeliverable(maxAttempts, limit);
        int delivered = 0;
        for (OutboxMessage message : batch) {
            try {
                sender.send(message);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                message.failed("Interrupted while sending");
                listener.failed(message, e, message.getAttempts() >= maxAttempts);
                break;
            } catch (Exception e) {
                message.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                listener.failed(message, e, message.getAttempts() >= maxAttempts);
                break;
            }
            message.delivered(Instant.now());
            listener.delivered(message);
            delivered++;
        }
        return delivered;
    }

    @Transactional(readOnly = true)
    public List<OutboxMessage> messagesFor(LedgerKind kind, long recordId) {
        return repository.findByRecordKindAndRecordIdOrderBySequenceNumberAsc(kind, recordId);
    }

    @Transactional(readOnly = true)
    public OutboxBacklog backlog(int maxAttempts) {
        Duration oldestAge = repository.oldestUndeliveredCreatedAt()
            .map(created -> Duration.between(created, Instant.now()))
            .filter(age -> !age.isNegative())
            .orElse(Duration.ZERO);
        return new OutboxBacklog(
            repository.countByDeliveredAtIsNull(),
            repository.countByDeliveredAtIsNullAndAttemptsGreaterThanEqual(maxAttempts),
            oldestAge);
    }

    private String toJson(LedgerNotification notification) {
        try {
            return objectMapper.writeValueAsString(notification);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                "Cannot serialize " + notification.getEventType() + " notification", e);
        }
    }
}
