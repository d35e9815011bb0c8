package com.flagship.pledge_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pledge_ledger.config.LedgerConfig;
import com.flagship.pledge_ledger.notification.event.EntryCreatedNotification;
import com.flagship.pledge_ledger.payment.LedgerKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NotificationOutboxTest {

    private static final int MAX_ATTEMPTS = 3;

    @Mock
    private OutboxMessageRepository repository;

    private final ObjectMapper objectMapper = new LedgerConfig().objectMapper();
    private NotificationOutbox outbox;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        outbox = new NotificationOutbox(repository, objectMapper);
        listener = new RecordingListener();
    }

    private static OutboxMessage message(long recordId) {
        return OutboxMessage.pending(LedgerKind.PLEDGE, recordId, 7, "PaymentRecorded", "abc12345", "{}");
    }

    @Test
    @DisplayName("Enqueue keys the message by record and serializes the notification")
    void enqueueStoresRecordKeyAndPayload() throws IOException {
        when(repository.save(any(OutboxMessage.class))).thenAnswer(invocation -> invocation.getArgument(0));

        outbox.enqueue(EntryCreatedNotification.builder()
            .kind(LedgerKind.OUTSTANDING)
            .recordId(12)
            .userId(7)
            .userName("Kamla Devi")
            .description("Carried forward")
            .totalAmount(1500)
            .correlationId("req-1")
            .occurredAt(Instant.parse("2024-07-01T10:15:30Z"))
            .build());

        ArgumentCaptor<OutboxMessage> saved = ArgumentCaptor.forClass(OutboxMessage.class);
        verify(repository).save(saved.capture());
        OutboxMessage message = saved.getValue();
        assertEquals("OUTSTANDING:12", message.partitionKey());
        assertEquals(7, message.getUserId());
        assertEquals("EntryCreated", message.getEventType());
        assertEquals("req-1", message.getCorrelationId());
        assertFalse(message.isDelivered());

        JsonNode payload = objectMapper.readTree(message.getPayload());
        assertEquals(1500, payload.get("totalAmount").asLong());
        assertEquals("2024-07-01T10:15:30Z", payload.get("occurredAt").asText());
    }

    @Test
    @DisplayName("A successful batch marks every message delivered")
    void deliversWholeBatch() throws Exception {
        OutboxMessage first = message(1);
        OutboxMessage second = message(2);
        when(repository.lockDeliverable(MAX_ATTEMPTS, 10)).thenReturn(List.of(first, second));
        List<OutboxMessage> sent = new ArrayList<>();

        int delivered = outbox.deliverBatch(10, MAX_ATTEMPTS, sent::add, listener);

        assertEquals(2, delivered);
        assertEquals(List.of(first, second), sent);
        assertTrue(first.isDelivered());
        assertTrue(second.isDelivered());
        assertEquals(1, first.getAttempts());
        assertEquals(2, listener.delivered.size());
    }

    @Test
    @DisplayName("A failed send stops the batch so later messages are not sent out of order")
    void stopsAtFirstFailure() {
        OutboxMessage first = message(1);
        OutboxMessage second = message(1);
        when(repository.lockDeliverable(MAX_ATTEMPTS, 10)).thenReturn(List.of(first, second));

        int delivered = outbox.deliverBatch(10, MAX_ATTEMPTS, m -> {
            throw new IllegalStateException("broker unavailable");
        }, listener);

        assertEquals(0, delivered);
        assertFalse(first.isDelivered());
        assertEquals(1, first.getAttempts());
        assertEquals("broker unavailable", first.getLastError());
        assertEquals(0, second.getAttempts());
        assertEquals(List.of(false), listener.abandoned);
    }

    @Test
    @DisplayName("The last allowed failure reports the message as abandoned")
    void reportsAbandonment() {
        OutboxMessage message = message(1);
        message.failed("timeout");
        message.failed("timeout");
        when(repository.lockDeliverable(MAX_ATTEMPTS, 10)).thenReturn(List.of(message));

        outbox.deliverBatch(10, MAX_ATTEMPTS, m -> {
            throw new IllegalStateException("timeout");
        }, listener);

        assertEquals(MAX_ATTEMPTS, message.getAttempts());
        assertEquals(List.of(true), listener.abandoned);
    }

    @Test
    void backlogCountsPendingAndAbandoned() {
        when(repository.countByDeliveredAtIsNull()).thenReturn(12L);
        when(repository.countByDeliveredAtIsNullAndAttemptsGreaterThanEqual(MAX_ATTEMPTS)).thenReturn(2L);
        when(repository.oldestUndeliveredCreatedAt()).thenReturn(Optional.of(Instant.now().minusSeconds(90)));

        OutboxBacklog backlog = outbox.backlog(MAX_ATTEMPTS);

        assertEquals(12, backlog.getPending());
        assertEquals(2, backlog.getAbandoned());
        assertTrue(backlog.getOldestPendingAge().getSeconds() >= 90);
    }

    private static class RecordingListener implements NotificationOutbox.DeliveryListener {
        final List<OutboxMessage> delivered = new ArrayList<>();
        final List<Boolean> abandoned = new ArrayList<>();

        @Override
        public void delivered(OutboxMessage message) {
            delivered.add(message);
        }

        @Override
        public void failed(OutboxMessage message, Exception cause, boolean abandoned) {
            this.abandoned.add(abandoned);
        }
    }
}
