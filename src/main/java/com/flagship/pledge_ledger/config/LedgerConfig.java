package com.flagship.pledge_ledger.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Shared infrastructure beans: the JSON mapper used for payment lists, log
 * details and notification payloads, and the notifications topic.
 */
@Configuration
public class LedgerConfig {

    /**
     * ISO-8601 dates, so a payment list read back from a jsonb column
     * serializes to the same JSON it was stored as. Unknown keys are ignored
     * because older clients wrote extra fields into payment lists.
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Messages are keyed by record, so the partition count bounds how many
     * records are delivered in parallel, not ordering.
     */
    @Bean
    @ConditionalOnProperty(name = "kafka.topic.auto-create", havingValue = "true", matchIfMissing = true)
    public NewTopic notificationsTopic(@Value("${kafka.topic.notifications:ledger.notifications}") String name,
                                       @Value("${kafka.topic.partitions:3}") int partitions) {
        return TopicBuilder.name(name)
            .partitions(partitions)
            .replicas(1)
            .build();
    }
}
