package com.flagship.pledge_ledger.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.time.LocalDate;

/**
 * JPA entity for the transaction_logs table.
 *
 * Every column is {@code updatable = false} and there are no setters:
 * {@link #create} is the only way in.
 */
@Entity
@Table(
    name = "transaction_logs",
    indexes = {
        @Index(name = "idx_transaction_logs_record", columnList = "record_kind, entry_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "record_kind", nullable = false, updatable = false, length = 20)
    private RecordKind recordKind;

    @Column(name = "entry_id", nullable = false, updatable = false)
    private long entryId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private long userId;

    @Column(nullable = false, updatable = false)
    private String username;

    @Column(name = "transaction_type", nullable = false, updatable = false, length = 30)
    private String transactionType;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private String description;

    @Column(nullable = false, updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String details;

    @Column(name = "log_date", nullable = false, updatable = false)
    private LocalDate date;

    @Column(name = "logged_at", nullable = false, updatable = false)
    private Instant timestamp;

    public static TransactionLogEntity create(RecordKind recordKind, long entryId, Actor actor,
                                              TransactionType type, long amount,
                                              String description, String detailsJson) {
        Instant now = Instant.now();
        return new TransactionLogEntity(
            null,
            recordKind,
            entryId,
            actor.getId(),
            actor.getName(),
            type.getCode(),
            amount,
            description,
            detailsJson,
            LocalDate.now(),
            now
        );
    }
}
