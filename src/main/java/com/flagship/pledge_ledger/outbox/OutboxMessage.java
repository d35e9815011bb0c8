package com.flagship.pledge_ledger.outbox;

import com.flagship.pledge_ledger.payment.LedgerKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * One payer notification waiting in (or already delivered from) the outbox.
 *
 * Rows are keyed by the ledger record they describe, so every notification
 * about one entry lands on the same Kafka partition in commit order.
 */
@Entity
@Table(name = "notification_outbox")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxMessage {

    private static final int MAX_ERROR_LENGTH = 1000;

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "record_kind", nullable = false, updatable = false, length = 20)
    private LedgerKind recordKind;

    @Column(name = "record_id", nullable = false, updatable = false)
    private long recordId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private long userId;

    @Column(name = "event_type", nullable = false, updatable = false, length = 100)
    private String eventType;

    @Column(name = "correlation_id", updatable = false, length = 64)
    private String correlationId;

    @Column(name = "payload", nullable = false, updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String payload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    static OutboxMessage pending(LedgerKind recordKind, long recordId, long userId, String eventType,
                                 String correlationId, String payload) {
        OutboxMessage message = new OutboxMessage();
        message.id = UUID.randomUUID();
        message.recordKind = recordKind;
        message.recordId = recordId;
        message.userId = userId;
        message.eventType = eventType;
        message.correlationId = correlationId;
        message.payload = payload;
        message.createdAt = Instant.now();
        return message;
    }

    /**
     * Kafka key: all messages for one record share it.
     */
    public String partitionKey() {
        return recordKind.name() + ":" + recordId;
    }

    public boolean isDelivered() {
        return deliveredAt != null;
    }

    void delivered(Instant at) {
        this.attempts++;
        this.deliveredAt = at;
        this.lastError = null;
    }

    void failed(String error) {
        this.attempts++;
        this.lastError = error != null && error.length() > MAX_ERROR_LENGTH
            ? error.substring(0, MAX_ERROR_LENGTH)
            : error;
    }
}
