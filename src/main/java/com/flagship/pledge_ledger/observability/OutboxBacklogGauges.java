package com.flagship.pledge_ledger.observability;

import com.flagship.pledge_ledger.outbox.NotificationOutbox;
import com.flagship.pledge_ledger.outbox.OutboxBacklog;
import com.flagship.pledge_ledger.outbox.OutboxPublisherProperties;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Gauges over the notification outbox backlog.
 *
 * The backlog is queried on a schedule and cached; scrapes and health checks
 * read the cached {@link #current()} snapshot and never touch the database.
 */
@Component
@Slf4j
public class OutboxBacklogGauges {

    private final NotificationOutbox outbox;
    private final OutboxPublisherProperties publisherProperties;
    private final AtomicReference<OutboxBacklog> snapshot = new AtomicReference<>(OutboxBacklog.EMPTY);

    public OutboxBacklogGauges(NotificationOutbox outbox, OutboxPublisherProperties publisherProperties,
                               MeterRegistry registry) {
        this.outbox = outbox;
        this.publisherProperties = publisherProperties;

        Gauge.builder("ledger.notifications.backlog", snapshot, ref -> ref.get().getPending())
                .description("Notifications not yet delivered to Kafka")
                .register(registry);
        Gauge.builder("ledger.notifications.backlog.abandoned", snapshot, ref -> ref.get().getAbandoned())
                .description("Undelivered notifications past the retry limit")
                .register(registry);
        Gauge.builder("ledger.notifications.backlog.age.seconds", snapshot,
                        ref -> ref.get().getOldestPendingAge().getSeconds())
                .description("Age of the oldest undelivered notification")
                .register(registry);
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refresh() {
        try {
            OutboxBacklog backlog = outbox.backlog(publisherProperties.getMaxAttempts());
            snapshot.set(backlog);
            log.debug("Outbox backlog: pending={}, abandoned={}, oldest={}s",
                    backlog.getPending(), backlog.getAbandoned(), backlog.getOldestPendingAge().getSeconds());
        } catch (RuntimeException e) {
            log.warn("Could not refresh outbox backlog: {}", e.getMessage());
        }
    }

    public OutboxBacklog current() {
        return snapshot.get();
    }
}
