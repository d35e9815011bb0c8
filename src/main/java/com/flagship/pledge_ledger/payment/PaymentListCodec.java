package com.flagship.pledge_ledger.payment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Converts payment lists to and from the jsonb column they are stored in.
 */
@Component
public class PaymentListCodec {

    private static final TypeReference<List<PaymentRecord>> PAYMENT_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public PaymentListCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(List<PaymentRecord> payments) {
        try {
            return objectMapper.writeValueAsString(payments);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize payment list", e);
        }
    }

    public List<PaymentRecord> read(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return List.copyOf(objectMapper.readValue(json, PAYMENT_LIST));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt payment list: " + e.getOriginalMessage(), e);
        }
    }
}
