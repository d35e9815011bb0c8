package com.flagship.pledge_ledger.advance;

import com.flagship.pledge_ledger.payment.PaymentMode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * JPA entity for advance_deposits.
 *
 * Deposits are append-only: no setters, every column {@code updatable = false},
 * and {@link #fromDomain} is the only way to build one.
 */
@Entity
@Table(
    name = "advance_deposits",
    indexes = {
        @Index(name = "idx_advance_deposits_user", columnList = "user_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AdvanceDepositEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private long userId;

    @Column(name = "user_name", nullable = false, updatable = false)
    private String userName;

    @Column(name = "deposit_date", nullable = false, updatable = false)
    private LocalDate date;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Column(nullable = false, updatable = false, length = 20)
    private String mode;

    @Column(name = "attachment_url", updatable = false)
    private String attachmentUrl;

    @Column(name = "receipt_no", nullable = false, updatable = false, length = 40)
    private String receiptNo;

    @Column(name = "created_by", nullable = false, updatable = false)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static AdvanceDepositEntity fromDomain(AdvanceDeposit deposit) {
        return new AdvanceDepositEntity(
            deposit.getId(),
            deposit.getUserId(),
            deposit.getUserName(),
            deposit.getDate(),
            deposit.getAmount(),
            deposit.getMode().getCode(),
            deposit.getAttachmentUrl(),
            deposit.getReceiptNo(),
            deposit.getCreatedBy(),
            deposit.getCreatedAt()
        );
    }

    public AdvanceDeposit toDomain() {
        return AdvanceDeposit.builder()
            .id(id)
            .userId(userId)
            .userName(userName)
            .date(date)
            .amount(amount)
            .mode(PaymentMode.fromCode(mode))
            .attachmentUrl(attachmentUrl)
            .receiptNo(receiptNo)
            .createdBy(createdBy)
            .createdAt(createdAt)
            .build();
    }
}
