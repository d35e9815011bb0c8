package com.flagship.pledge_ledger.payment;

import com.flagship.pledge_ledger.ledger.Actor;
import com.flagship.pledge_ledger.payment.dto.EditPaymentRequest;
import com.flagship.pledge_ledger.payment.dto.PaymentOutcomeResponse;
import com.flagship.pledge_ledger.payment.dto.RecordPaymentRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * Payment endpoints for both pledge entries and outstanding records.
 *
 * Recording accepts an optional Idempotency-Key header. A repeated key returns
 * the earlier payment with 200 instead of 201 and writes nothing.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final PaymentRecorder paymentRecorder;
    private final PaymentEditor paymentEditor;
    private final PaymentDeleter paymentDeleter;

    @PostMapping("/api/entries/{id}/payments")
    public ResponseEntity<PaymentOutcomeResponse> recordEntryPayment(
            @PathVariable("id") long id,
            @Valid @RequestBody RecordPaymentRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestHeader(Actor.ID_HEADER) long actorId,
            @RequestHeader(Actor.NAME_HEADER) String actorName,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        return record(LedgerKind.PLEDGE, id, request, idempotencyKey,
            Actor.fromHeaders(actorId, actorName, actorRole));
    }

    @PatchMapping("/api/entries/{id}/payments/{index}")
    public ResponseEntity<PaymentOutcomeResponse> editEntryPayment(
            @PathVariable("id") long id,
            @PathVariable("index") int index,
            @RequestBody EditPaymentRequest request,
            @RequestHeader(Actor.ID_HEADER) long actorId,
            @RequestHeader(Actor.NAME_HEADER) String actorName,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        Actor actor = Actor.fromHeaders(actorId, actorName, actorRole);
        PaymentOutcome outcome = paymentEditor.editPayment(LedgerKind.PLEDGE, id, index, request.toChanges(), actor);
        return ResponseEntity.ok(PaymentOutcomeResponse.from(outcome));
    }

    @DeleteMapping("/api/entries/{id}/payments/{index}")
    public ResponseEntity<PaymentOutcomeResponse> deleteEntryPayment(
            @PathVariable("id") long id,
            @PathVariable("index") int index,
            @RequestHeader(Actor.ID_HEADER) long actorId,
            @RequestHeader(Actor.NAME_HEADER) String actorName,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        Actor actor = Actor.fromHeaders(actorId, actorName, actorRole);
        return ResponseEntity.ok(PaymentOutcomeResponse.from(
            paymentDeleter.deletePayment(LedgerKind.PLEDGE, id, index, actor)));
    }

    @PostMapping("/api/outstanding/{id}/payments")
    public ResponseEntity<PaymentOutcomeResponse> recordOutstandingPayment(
            @PathVariable("id") long id,
            @Valid @RequestBody RecordPaymentRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestHeader(Actor.ID_HEADER) long actorId,
            @RequestHeader(Actor.NAME_HEADER) String actorName,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        return record(LedgerKind.OUTSTANDING, id, request, idempotencyKey,
            Actor.fromHeaders(actorId, actorName, actorRole));
    }

    @PatchMapping("/api/outstanding/{id}/payments/{index}")
    public ResponseEntity<PaymentOutcomeResponse> editOutstandingPayment(
            @PathVariable("id") long id,
            @PathVariable("index") int index,
            @RequestBody EditPaymentRequest request,
            @RequestHeader(Actor.ID_HEADER) long actorId,
            @RequestHeader(Actor.NAME_HEADER) String actorName,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        Actor actor = Actor.fromHeaders(actorId, actorName, actorRole);
        PaymentOutcome outcome = paymentEditor.editPayment(
            LedgerKind.OUTSTANDING, id, index, request.toChanges(), actor);
        return ResponseEntity.ok(PaymentOutcomeResponse.from(outcome));
    }

    @DeleteMapping("/api/outstanding/{id}/payments/{index}")
    public ResponseEntity<PaymentOutcomeResponse> deleteOutstandingPayment(
            @PathVariable("id") long id,
            @PathVariable("index") int index,
            @RequestHeader(Actor.ID_HEADER) long actorId,
            @RequestHeader(Actor.NAME_HEADER) String actorName,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {
        Actor actor = Actor.fromHeaders(actorId, actorName, actorRole);
        return ResponseEntity.ok(PaymentOutcomeResponse.from(
            paymentDeleter.deletePayment(LedgerKind.OUTSTANDING, id, index, actor)));
    }

    private ResponseEntity<PaymentOutcomeResponse> record(LedgerKind kind, long id, RecordPaymentRequest request,
                                                          String idempotencyKey, Actor actor) {
        log.info("Received payment request: kind={}, recordId={}, amount={}, mode={}, idempotencyKey={}",
            kind, id, request.getAmount(), request.getMode(), idempotencyKey);

        PaymentOutcome outcome = paymentRecorder.recordPayment(request.toCommand(kind, id, idempotencyKey), actor);
        HttpStatus status = outcome.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(PaymentOutcomeResponse.from(outcome));
    }
}
