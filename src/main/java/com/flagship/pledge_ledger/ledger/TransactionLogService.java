package com.flagship.pledge_ledger.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pledge_ledger.payment.PaymentStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only audit trail of every ledger mutation.
 *
 * Writes use MANDATORY propagation: a log row commits with the change it
 * describes, or not at all.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionLogService {

    private static final TypeReference<Map<String, Object>> DETAILS_TYPE = new TypeReference<>() {};

    private final TransactionLogRepository repository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public TransactionLog append(RecordKind recordKind, long entryId, Actor actor,
                                 TransactionType type, long amount,
                                 String description, Object details) {
        TransactionLogEntity saved = repository.save(TransactionLogEntity.create(
            recordKind, entryId, actor, type, amount, description, serialize(details)));

        log.debug("Logged {} of {} for {} #{} by {}", type.getCode(), amount, recordKind, entryId, actor.getName());
        return toDomain(saved);
    }

    /**
     * Writes the extra row that accompanies every status transition. No-op if the status did not move.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void appendStatusChange(RecordKind recordKind, long entryId, Actor actor,
                                   PaymentStatus oldStatus, PaymentStatus newStatus) {
        if (oldStatus == newStatus) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("oldStatus", oldStatus.getCode());
        details.put("newStatus", newStatus.getCode());
        append(recordKind, entryId, actor, TransactionType.STATUS_CHANGE, 0,
            "Payment status changed from " + oldStatus.getCode() + " to " + newStatus.getCode(),
            details);
    }

    /**
     * All rows, newest first.
     */
    @Transactional(readOnly = true)
    public List<TransactionLog> findAll() {
        return repository.findAllByOrderByIdDesc().stream()
            .map(this::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<TransactionLog> findForRecord(RecordKind recordKind, long entryId) {
        return repository.findByRecordKindAndEntryIdOrderByIdDesc(recordKind, entryId).stream()
            .map(this::toDomain)
            .toList();
    }

    private TransactionLog toDomain(TransactionLogEntity entity) {
        return TransactionLog.builder()
            .id(entity.getId())
            .recordKind(entity.getRecordKind())
            .entryId(entity.getEntryId())
            .userId(entity.getUserId())
            .username(entity.getUsername())
            .transactionType(TransactionType.fromCode(entity.getTransactionType()))
            .amount(entity.getAmount())
            .description(entity.getDescription())
            .details(deserialize(entity.getDetails()))
            .date(entity.getDate())
            .timestamp(entity.getTimestamp())
            .build();
    }

    private String serialize(Object details) {
        try {
            return objectMapper.writeValueAsString(details == null ? Map.of() : details);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize transaction log details", e);
        }
    }

    private Map<String, Object> deserialize(String json) {
        try {
            return objectMapper.readValue(json, DETAILS_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt transaction log details", e);
        }
    }
}
