package com.flagship.pledge_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.payments.recorded: payments committed, by record kind and mode
 * - ledger.payments.rejected: payments refused, by record kind and reason
 * - ledger.payments.commit_retries: commits repeated after losing a version race
 * - ledger.payments.latency: time per payment operation
 * - receipt.allocation.fallback: receipts issued on the degraded timestamp path
 * - receipt.allocation.claim_conflict: candidates already claimed by a concurrent caller
 * - idempotency.cache: idempotency key hits and misses
 * - ledger.notifications.sent: outbox deliveries to Kafka, by event type and outcome
 * - ledger.notifications.abandoned: messages the publisher stopped retrying
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter receiptFallbacks;
    private final Timer paymentTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.receiptFallbacks = Counter.builder("receipt.allocation.fallback")
                .description("Receipt numbers issued from the timestamp fallback")
                .register(registry);

        this.paymentTimer = Timer.builder("ledger.payments.latency")
                .description("Time taken to record a payment")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    // ==================== Payment Methods ====================

    public void recordPaymentRecorded(String kind, String mode) {
        registry.counter("ledger.payments.recorded",
                "kind", sanitizeTag(kind),
                "mode", sanitizeTag(mode)
        ).increment();
    }

    public void recordPaymentRejected(String kind, String reason) {
        registry.counter("ledger.payments.rejected",
                "kind", sanitizeTag(kind),
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public void recordCommitRetry(String kind) {
        registry.counter("ledger.payments.commit_retries",
                "kind", sanitizeTag(kind)
        ).increment();
    }

    public void recordPaymentLatency(String operation, long durationMs) {
        registry.timer("ledger.payments.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordPaymentDuration(Duration duration) {
        paymentTimer.record(duration);
    }

    // ==================== Receipt Methods ====================

    /**
     * Records a receipt issued on the degraded path. Alert on any increase.
     */
    public void recordReceiptFallback(String stream) {
        receiptFallbacks.increment();
        registry.counter("receipt.allocation.fallback.by_stream",
                "stream", sanitizeTag(stream)
        ).increment();
    }

    public void recordReceiptClaimConflict(String stream) {
        registry.counter("receipt.allocation.claim_conflict",
                "stream", sanitizeTag(stream)
        ).increment();
    }

    public double receiptFallbackCount() {
        return receiptFallbacks.count();
    }

    // ==================== Idempotency Methods ====================

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    // ==================== Notification Methods ====================

    public void recordNotificationDelivered(String eventType) {
        registry.counter("ledger.notifications.sent",
                "event_type", sanitizeTag(eventType),
                "outcome", "delivered"
        ).increment();
    }

    public void recordNotificationFailed(String eventType) {
        registry.counter("ledger.notifications.sent",
                "event_type", sanitizeTag(eventType),
                "outcome", "failed"
        ).increment();
    }

    public void recordNotificationAbandoned(String eventType) {
        registry.counter("ledger.notifications.abandoned",
                "event_type", sanitizeTag(eventType)
        ).increment();
    }

    // ==================== Helper Methods ====================

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
