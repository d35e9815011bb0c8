package com.flagship.pledge_ledger.advance;

import com.flagship.pledge_ledger.advance.dto.AdvanceDepositRequest;
import com.flagship.pledge_ledger.advance.dto.AdvanceHistoryResponse;
import com.flagship.pledge_ledger.ledger.Actor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class AdvanceController {

    private final AdvanceLedgerService advanceLedgerService;

    @PostMapping("/api/advance-payments")
    public ResponseEntity<AdvanceDeposit> recordDeposit(
            @Valid @RequestBody AdvanceDepositRequest request,
            @RequestHeader(Actor.ID_HEADER) long actorId,
            @RequestHeader(Actor.NAME_HEADER) String actorName,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {

        Actor actor = Actor.fromHeaders(actorId, actorName, actorRole);
        AdvanceDeposit deposit = advanceLedgerService.recordDeposit(
            request.getUserId(),
            request.getUserName(),
            request.getDate(),
            request.getAmount(),
            request.getMode(),
            request.getAttachmentUrl(),
            actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(deposit);
    }

    @GetMapping("/api/users/{userId}/advance-payments")
    public AdvanceHistoryResponse history(
            @PathVariable("userId") long userId,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("'from' must not be after 'to'");
        }
        return new AdvanceHistoryResponse(
            userId,
            advanceLedgerService.remainingBalance(userId),
            advanceLedgerService.findDeposits(userId, from, to),
            advanceLedgerService.findUsages(userId));
    }

    @GetMapping("/api/users/{userId}/advance-balance")
    public Map<String, Long> balance(@PathVariable("userId") long userId) {
        return Map.of("userId", userId, "remainingBalance", advanceLedgerService.remainingBalance(userId));
    }
}
