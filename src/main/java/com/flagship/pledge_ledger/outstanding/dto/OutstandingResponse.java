package com.flagship.pledge_ledger.outstanding.dto;

import com.flagship.pledge_ledger.outstanding.OutstandingRecord;
import com.flagship.pledge_ledger.payment.PaymentRecord;
import com.flagship.pledge_ledger.payment.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class OutstandingResponse {
    long id;
    String serialNumber;
    long recordNumber;
    long userId;
    String userName;
    String description;
    long outstandingAmount;
    long receivedAmount;
    long pendingAmount;
    PaymentStatus status;
    List<PaymentRecord> payments;
    String attachmentUrl;
    String createdBy;
    Instant createdAt;
    Instant updatedAt;

    public static OutstandingResponse from(OutstandingRecord record) {
        return OutstandingResponse.builder()
            .id(record.getId())
            .serialNumber(record.getSerialNumber())
            .recordNumber(record.getRecordNumber())
            .userId(record.getUserId())
            .userName(record.getUserName())
            .description(record.getDescription())
            .outstandingAmount(record.getOutstandingAmount())
            .receivedAmount(record.getReceivedAmount())
            .pendingAmount(record.getPendingAmount())
            .status(record.getStatus())
            .payments(record.getPayments())
            .attachmentUrl(record.getAttachmentUrl())
            .createdBy(record.getCreatedBy())
            .createdAt(record.getCreatedAt())
            .updatedAt(record.getUpdatedAt())
            .build();
    }
}
