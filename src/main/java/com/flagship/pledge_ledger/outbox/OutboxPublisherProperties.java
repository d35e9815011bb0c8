package com.flagship.pledge_ledger.outbox;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under {@code outbox.publisher.*}.
 */
@ConfigurationProperties(prefix = "outbox.publisher")
@Getter
@Setter
public class OutboxPublisherProperties {

    private boolean enabled = true;

    private int batchSize = 100;

    /**
     * Failed sends after which a message is abandoned and left for manual follow-up.
     */
    private int maxAttempts = 5;

    private long pollIntervalMs = 1000;

    private Duration sendTimeout = Duration.ofSeconds(10);
}
