package com.flagship.pledge_ledger.entry;

import com.flagship.pledge_ledger.entry.dto.CreateEntryRequest;
import com.flagship.pledge_ledger.entry.dto.EntryResponse;
import com.flagship.pledge_ledger.entry.dto.UpdateEntryRequest;
import com.flagship.pledge_ledger.ledger.Actor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST endpoints for pledge entries. Payments on entries live in
 * {@link com.flagship.pledge_ledger.payment.PaymentController}.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class EntryController {

    private final EntryService entryService;

    @PostMapping("/api/entries")
    public ResponseEntity<EntryResponse> createEntry(
            @Valid @RequestBody CreateEntryRequest request,
            @RequestHeader(Actor.ID_HEADER) long actorId,
            @RequestHeader(Actor.NAME_HEADER) String actorName,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {

        Actor actor = Actor.fromHeaders(actorId, actorName, actorRole);
        PledgeEntry entry = entryService.createEntry(
            request.getUserId(),
            request.getUserName(),
            request.getDescription(),
            request.getOccasion(),
            request.getBoliDate(),
            request.getAmount(),
            request.getQuantity() != null ? request.getQuantity() : 1,
            actor);

        return ResponseEntity.status(HttpStatus.CREATED).body(EntryResponse.from(entry));
    }

    @GetMapping("/api/entries/{id}")
    public ResponseEntity<EntryResponse> getEntry(@PathVariable("id") long id) {
        return ResponseEntity.ok(EntryResponse.from(entryService.getEntry(id)));
    }

    @PatchMapping("/api/entries/{id}")
    public ResponseEntity<EntryResponse> updateEntry(
            @PathVariable("id") long id,
            @Valid @RequestBody UpdateEntryRequest request,
            @RequestHeader(Actor.ID_HEADER) long actorId,
            @RequestHeader(Actor.NAME_HEADER) String actorName,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {

        Actor actor = Actor.fromHeaders(actorId, actorName, actorRole);
        return ResponseEntity.ok(EntryResponse.from(entryService.updateEntry(id, request.toChanges(), actor)));
    }

    @DeleteMapping("/api/entries/{id}")
    public ResponseEntity<EntryResponse> deleteEntry(
            @PathVariable("id") long id,
            @RequestHeader(Actor.ID_HEADER) long actorId,
            @RequestHeader(Actor.NAME_HEADER) String actorName,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {

        Actor actor = Actor.fromHeaders(actorId, actorName, actorRole);
        return ResponseEntity.ok(EntryResponse.from(entryService.softDeleteEntry(id, actor)));
    }

    @PutMapping("/api/entries/{id}/restore")
    public ResponseEntity<EntryResponse> restoreEntry(
            @PathVariable("id") long id,
            @RequestHeader(Actor.ID_HEADER) long actorId,
            @RequestHeader(Actor.NAME_HEADER) String actorName,
            @RequestHeader(Actor.ROLE_HEADER) String actorRole) {

        Actor actor = Actor.fromHeaders(actorId, actorName, actorRole);
        return ResponseEntity.ok(EntryResponse.from(entryService.restoreEntry(id, actor)));
    }

    @GetMapping("/api/entries/deleted")
    public List<EntryResponse> deletedEntries() {
        return entryService.findDeleted().stream().map(EntryResponse::from).toList();
    }

    @GetMapping("/api/users/{userId}/entries")
    public List<EntryResponse> entriesForUser(@PathVariable("userId") long userId) {
        return entryService.findByUser(userId).stream().map(EntryResponse::from).toList();
    }
}
