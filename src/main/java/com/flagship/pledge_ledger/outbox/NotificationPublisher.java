package com.flagship.pledge_ledger.outbox;

import com.flagship.pledge_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Drains the notification outbox to Kafka on a fixed schedule.
 *
 * Each message is sent synchronously with its event type, record kind and
 * correlation id as headers. Several instances may run side by side; row
 * locks keep them off each other's messages.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class NotificationPublisher implements NotificationOutbox.DeliveryListener {

    static final String HEADER_EVENT_TYPE = "eventType";
    static final String HEADER_RECORD_KIND = "recordKind";
    static final String HEADER_CORRELATION_ID = "correlationId";

    private final NotificationOutbox outbox;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxPublisherProperties properties;
    private final LedgerMetrics metrics;
    private final String topic;

    public NotificationPublisher(NotificationOutbox outbox,
                                 KafkaTemplate<String, String> kafkaTemplate,
                                 OutboxPublisherProperties properties,
                                 LedgerMetrics metrics,
                                 @Value("${kafka.topic.notifications:ledger.notifications}") String topic) {
        this.outbox = outbox;
        this.kafkaTemplate = kafkaTemplate;
        this.properties = properties;
        this.metrics = metrics;
        this.topic = topic;
    }

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void drain() {
        try {
            int delivered = outbox.deliverBatch(properties.getBatchSize(), properties.getMaxAttempts(),
                this::send, this);
            if (delivered > 0) {
                log.debug("Delivered {} notifications to {}", delivered, topic);
            }
        } catch (RuntimeException e) {
            log.error("Notification outbox drain failed", e);
        }
    }

    void send(OutboxMessage message) throws Exception {
        ProducerRecord<String, String> record =
            new ProducerRecord<>(topic, message.partitionKey(), message.getPayload());
        header(record, HEADER_EVENT_TYPE, message.getEventType());
        header(record, HEADER_RECORD_KIND, message.getRecordKind().name());
        header(record, HEADER_CORRELATION_ID, message.getCorrelationId());

        SendResult<String, String> result = kafkaTemplate.send(record)
            .get(properties.getSendTimeout().toMillis(), TimeUnit.MILLISECONDS);

        log.debug("Sent {} for {}: partition={}, offset={}", message.getEventType(), message.partitionKey(),
            result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
    }

    @Override
    public void delivered(OutboxMessage message) {
        metrics.recordNotificationDelivered(message.getEventType());
    }

    @Override
    public void failed(OutboxMessage message, Exception cause, boolean abandoned) {
        metrics.recordNotificationFailed(message.getEventType());
        if (abandoned) {
            metrics.recordNotificationAbandoned(message.getEventType());
            log.error("Giving up on {} for {} after {} attempts: {}", message.getEventType(),
                message.partitionKey(), message.getAttempts(), message.getLastError());
        } else {
            log.warn("Could not send {} for {} (attempt {}): {}", message.getEventType(),
                message.partitionKey(), message.getAttempts(), message.getLastError());
        }
    }

    private static void header(ProducerRecord<String, String> record, String name, String value) {
        if (value != null) {
            record.headers().add(name, value.getBytes(StandardCharsets.UTF_8));
        }
    }
}
