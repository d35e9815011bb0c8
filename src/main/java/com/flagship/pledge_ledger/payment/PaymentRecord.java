package com.flagship.pledge_ledger.payment;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * One payment made against a pledge entry or outstanding record.
 *
 * Payment records have no identity of their own: they live inside the
 * owning record's ordered payment list and are addressed by their index.
 * Immutable; edits produce a new instance via {@code toBuilder()}.
 *
 * The optional {@code status} tag is only ever {@code deleted}, and only while
 * the owning entry is soft-deleted. Untagged payments count towards the
 * received amount.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentRecord {
    LocalDate date;
    long amount;
    PaymentMode mode;
    String fileUrl;
    String receiptNo;
    String updatedBy;
    RecordStatus status;

    @JsonIgnore
    public boolean isDeleted() {
        return status == RecordStatus.DELETED;
    }

    @JsonIgnore
    public boolean hasProof() {
        return fileUrl != null && !fileUrl.isBlank();
    }

    /**
     * Returns this payment tagged as deleted. Used when the owning entry is soft-deleted.
     */
    public PaymentRecord tagDeleted() {
        return toBuilder().status(RecordStatus.DELETED).build();
    }

    /**
     * Returns this payment with the delete tag stripped. Used on restore.
     */
    public PaymentRecord untag() {
        return toBuilder().status(null).build();
    }
}
