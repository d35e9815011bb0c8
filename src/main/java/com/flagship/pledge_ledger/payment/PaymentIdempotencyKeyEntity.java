package com.flagship.pledge_ledger.payment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for payment_idempotency_keys.
 *
 * Idempotency is a persistence concern, not part of the payment record, so
 * keys live in their own table. The unique constraint on the key is what
 * stops two concurrent requests with the same key from both applying.
 */
@Entity
@Table(name = "payment_idempotency_keys")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentIdempotencyKeyEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "idempotency_key", nullable = false, unique = true, updatable = false)
    private String idempotencyKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "record_kind", nullable = false, updatable = false, length = 20)
    private LedgerKind recordKind;

    @Column(name = "record_id", nullable = false, updatable = false)
    private long recordId;

    @Column(name = "payment_index", nullable = false, updatable = false)
    private int paymentIndex;

    @Column(name = "receipt_no", nullable = false, updatable = false, length = 40)
    private String receiptNo;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static PaymentIdempotencyKeyEntity create(String idempotencyKey, IdempotentPayment payment) {
        return new PaymentIdempotencyKeyEntity(
            null,
            idempotencyKey,
            payment.getKind(),
            payment.getRecordId(),
            payment.getPaymentIndex(),
            payment.getReceiptNo(),
            Instant.now()
        );
    }

    public IdempotentPayment toDomain() {
        return new IdempotentPayment(recordKind, recordId, paymentIndex, receiptNo);
    }
}
