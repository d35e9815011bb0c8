package com.flagship.pledge_ledger.outstanding;

import com.flagship.pledge_ledger.ledger.Actor;
import com.flagship.pledge_ledger.outstanding.dto.CreateOutstandingRequest;
import com.flagship.pledge_ledger.outstanding.dto.OutstandingResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class OutstandingController {

    private final OutstandingService outstandingService;

    @PostMapping("/api/outstanding")
    public ResponseEntity<OutstandingResponse> createRecord(
            @Valid @RequestBody CreateOutstandingRequest request,
            @RequestHeader(Actor.ID_HEADER) long actorId,
            @RequestHeader(Actor.NAME_HEADER) String actorName,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {

        Actor actor = Actor.fromHeaders(actorId, actorName, actorRole);
        OutstandingRecord record = outstandingService.createRecord(
            request.getUserId(),
            request.getUserName(),
            request.getDescription(),
            request.getOutstandingAmount(),
            request.getAttachmentUrl(),
            actor);

        return ResponseEntity.status(HttpStatus.CREATED).body(OutstandingResponse.from(record));
    }

    @GetMapping("/api/outstanding/{id}")
    public ResponseEntity<OutstandingResponse> getRecord(@PathVariable("id") long id) {
        return ResponseEntity.ok(OutstandingResponse.from(outstandingService.getRecord(id)));
    }

    @GetMapping("/api/users/{userId}/outstanding")
    public List<OutstandingResponse> recordsForUser(@PathVariable("userId") long userId) {
        return outstandingService.findByUser(userId).stream().map(OutstandingResponse::from).toList();
    }
}
