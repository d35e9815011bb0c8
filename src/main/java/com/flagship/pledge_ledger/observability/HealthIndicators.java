package com.flagship.pledge_ledger.observability;

import com.flagship.pledge_ledger.outbox.OutboxBacklog;
import com.flagship.pledge_ledger.outbox.OutboxPublisherProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicators for the pledge ledger.
 *
 * Only a deep outbox backlog takes the service DOWN; Redis and Kafka trouble
 * delays notifications or replays but never loses a payment.
 */
public class HealthIndicators {

    /**
     * Judged on the cached backlog snapshot. Abandoned notifications never
     * clear by themselves, so any of them is a warning.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxBacklogGauges backlogGauges;

        public OutboxHealthIndicator(OutboxBacklogGauges backlogGauges) {
            this.backlogGauges = backlogGauges;
        }

        @Override
        public Health health() {
            OutboxBacklog backlog = backlogGauges.current();
            Health.Builder builder;
            if (backlog.getPending() >= BACKLOG_CRITICAL_THRESHOLD) {
                builder = Health.down();
            } else if (backlog.getPending() >= BACKLOG_WARNING_THRESHOLD || backlog.getAbandoned() > 0) {
                builder = Health.status("WARNING");
            } else {
                builder = Health.up();
            }
            return builder
                    .withDetail("pending", backlog.getPending())
                    .withDetail("abandoned", backlog.getAbandoned())
                    .withDetail("oldestPendingSeconds", backlog.getOldestPendingAge().getSeconds())
                    .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                    .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                    .build();
        }
    }

    /**
     * Idempotency keys are always written to the database, so a Redis outage
     * only costs replay latency.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            String reply;
            try {
                reply = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
            } catch (RuntimeException e) {
                return degraded(describe(e));
            }
            return "PONG".equals(reply)
                    ? Health.up().withDetail("role", "idempotency cache").build()
                    : degraded("Unexpected PING reply: " + reply);
        }

        private static Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("fallback", "idempotency keys are read from the database")
                    .build();
        }
    }

    /**
     * Reports the producer behind the notification publisher. With the
     * publisher switched off there is nothing to check.
     */
    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;
        private final OutboxPublisherProperties publisherProperties;
        private final String topic;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate,
                                    OutboxPublisherProperties publisherProperties,
                                    @Value("${kafka.topic.notifications:ledger.notifications}") String topic) {
            this.kafkaTemplate = kafkaTemplate;
            this.publisherProperties = publisherProperties;
            this.topic = topic;
        }

        @Override
        public Health health() {
            if (!publisherProperties.isEnabled()) {
                return Health.unknown().withDetail("publisher", "disabled").build();
            }
            try {
                int partitions = kafkaTemplate.partitionsFor(topic).size();
                return Health.up()
                        .withDetail("topic", topic)
                        .withDetail("partitions", partitions)
                        .build();
            } catch (RuntimeException e) {
                return Health.status("DEGRADED")
                        .withDetail("topic", topic)
                        .withDetail("error", describe(e))
                        .build();
            }
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
