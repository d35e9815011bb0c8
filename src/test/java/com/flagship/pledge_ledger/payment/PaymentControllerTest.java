package com.flagship.pledge_ledger.payment;

import com.flagship.pledge_ledger.entry.PledgeEntry;
import com.flagship.pledge_ledger.ledger.Actor;
import com.flagship.pledge_ledger.payment.exception.BusinessRuleViolationException;
import com.flagship.pledge_ledger.payment.exception.ConcurrentPaymentConflictException;
import com.flagship.pledge_ledger.payment.exception.LedgerRecordNotFoundException;
import com.flagship.pledge_ledger.payment.exception.RestrictedFieldChangeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP status and error body for each failure category.
 */
@WebMvcTest(PaymentController.class)
class PaymentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PaymentRecorder paymentRecorder;

    @MockBean
    private PaymentEditor paymentEditor;

    @MockBean
    private PaymentDeleter paymentDeleter;

    private static MockHttpServletRequestBuilder asAdmin(MockHttpServletRequestBuilder request) {
        return request
            .header(Actor.ID_HEADER, "1")
            .header(Actor.NAME_HEADER, "treasurer")
            .header(Actor.ROLE_HEADER, "admin")
            .contentType(MediaType.APPLICATION_JSON);
    }

    private static PaymentOutcome outcome(boolean replayed) {
        PaymentRecord payment = PaymentRecord.builder()
            .date(LocalDate.of(2024, 6, 1))
            .amount(400)
            .mode(PaymentMode.CASH)
            .receiptNo("SPDJMSJ-2024-00001")
            .updatedBy("treasurer")
            .build();
        PledgeEntry entry = PledgeEntry.open(3, "Vimla", "Shanti dhara", null, LocalDate.of(2024, 6, 1), 1000, 1, "a")
            .toBuilder().id(10).build()
            .withPayments(List.of(payment));
        return new PaymentOutcome(entry, payment, 0, replayed);
    }

    @Test
    void recordedPaymentIsCreated() throws Exception {
        when(paymentRecorder.recordPayment(any(), any())).thenReturn(outcome(false));

        mockMvc.perform(asAdmin(post("/api/entries/10/payments"))
                .content("{\"amount\":400,\"mode\":\"cash\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("partial"))
            .andExpect(jsonPath("$.pendingAmount").value(600))
            .andExpect(jsonPath("$.payment.receiptNo").value("SPDJMSJ-2024-00001"))
            .andExpect(jsonPath("$.replayed").value(false));
    }

    @Test
    @DisplayName("A replayed idempotency key answers 200")
    void replayIsOk() throws Exception {
        when(paymentRecorder.recordPayment(any(), any())).thenReturn(outcome(true));

        mockMvc.perform(asAdmin(post("/api/entries/10/payments"))
                .header("Idempotency-Key", "abc")
                .content("{\"amount\":400,\"mode\":\"cash\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.replayed").value(true));
    }

    @Test
    void missingRecordIs404() throws Exception {
        when(paymentRecorder.recordPayment(any(), any()))
            .thenThrow(LedgerRecordNotFoundException.of("Pledge entry", 99));

        mockMvc.perform(asAdmin(post("/api/entries/99/payments"))
                .content("{\"amount\":400,\"mode\":\"cash\"}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Not Found"));
    }

    @Test
    void businessRuleIs422WithFigures() throws Exception {
        when(paymentRecorder.recordPayment(any(), any())).thenThrow(new BusinessRuleViolationException(
            PaymentRules.EXCEEDS_PENDING, "Payment amount 700 exceeds pending amount 600",
            Map.of("pendingAmount", 600)));

        mockMvc.perform(asAdmin(post("/api/entries/10/payments"))
                .content("{\"amount\":700,\"mode\":\"cash\"}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.details.rule").value("EXCEEDS_PENDING"))
            .andExpect(jsonPath("$.details.pendingAmount").value("600"));
    }

    @Test
    void concurrentConflictIs409() throws Exception {
        when(paymentRecorder.recordPayment(any(), any()))
            .thenThrow(new ConcurrentPaymentConflictException("changed underneath"));

        mockMvc.perform(asAdmin(post("/api/outstanding/5/payments"))
                .content("{\"amount\":100,\"mode\":\"cash\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.details.retry").value("true"));
    }

    @Test
    void restrictedFieldIs403() throws Exception {
        when(paymentEditor.editPayment(any(), anyLong(), anyInt(), any(), any()))
            .thenThrow(new RestrictedFieldChangeException("not allowed: amount", Set.of("amount")));

        mockMvc.perform(asAdmin(patch("/api/entries/10/payments/0"))
                .content("{\"amount\":500}"))
            .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("Unknown payment mode is a 400 before any service call")
    void unknownModeIs400() throws Exception {
        mockMvc.perform(asAdmin(post("/api/entries/10/payments"))
                .content("{\"amount\":100,\"mode\":\"barter\"}"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(paymentRecorder);
    }

    @Test
    void missingActorHeadersIs400() throws Exception {
        mockMvc.perform(post("/api/entries/10/payments")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":100,\"mode\":\"cash\"}"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(paymentRecorder);
    }

    @Test
    void commandCarriesKindAndKey() throws Exception {
        when(paymentRecorder.recordPayment(any(), any())).thenReturn(outcome(false));

        mockMvc.perform(asAdmin(post("/api/outstanding/5/payments"))
                .header("Idempotency-Key", "k-77")
                .content("{\"amount\":400,\"mode\":\"upi\",\"fileUrl\":\"https://files/p.png\"}"))
            .andExpect(status().isCreated());

        verify(paymentRecorder).recordPayment(
            eq(RecordPaymentCommand.builder()
                .kind(LedgerKind.OUTSTANDING)
                .recordId(5)
                .amount(400)
                .mode(PaymentMode.UPI)
                .fileUrl("https://files/p.png")
                .idempotencyKey("k-77")
                .build()),
            any());
    }
}
