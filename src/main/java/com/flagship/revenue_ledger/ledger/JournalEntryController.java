package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.ledger.dto.CreateJournalEntryRequest;
import com.flagship.revenue_ledger.ledger.dto.JournalEntryResponse;
import com.flagship.revenue_ledger.ledger.dto.JournalLineRequest;
import com.flagship.revenue_ledger.ledger.dto.UpdateJournalEntryRequest;
import com.flagship.revenue_ledger.ledger.dto.VoidJournalEntryRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Manual journal entries.
 *
 * Post and void are attributed to the caller named in the X-Actor-Id header.
 */
@RestController
@RequestMapping("/api/journal-entries")
@RequiredArgsConstructor
public class JournalEntryController {

    static final String ACTOR_HEADER = "X-Actor-Id";

    private final JournalEntryService journalEntryService;

    @PostMapping
    public ResponseEntity<JournalEntryResponse> createDraft(@Valid @RequestBody CreateJournalEntryRequest request) {
        JournalEntry entry = journalEntryService.createDraft(request.getOrganizationId(), request.getEntryDate(),
            request.getDescription(), request.getReference(), request.getSourceType(), request.getSourceId(),
            toDrafts(request.getLines()));
        return ResponseEntity.status(HttpStatus.CREATED).body(JournalEntryResponse.from(entry));
    }

    @GetMapping("/{id}")
    public JournalEntryResponse getEntry(@PathVariable("id") UUID id) {
        return JournalEntryResponse.from(journalEntryService.getEntry(id));
    }

    @GetMapping
    public List<JournalEntryResponse> listEntries(@RequestParam("organization_id") UUID organizationId,
                                                  @RequestParam(name = "status", required = false)
                                                  JournalEntryStatus status) {
        return journalEntryService.listEntries(organizationId, status).stream()
            .map(JournalEntryResponse::from)
            .toList();
    }

    @PutMapping("/{id}")
    public JournalEntryResponse updateDraft(@PathVariable("id") UUID id,
                                            @Valid @RequestBody UpdateJournalEntryRequest request) {
        return JournalEntryResponse.from(journalEntryService.updateDraft(id, request.getEntryDate(),
            request.getDescription(), request.getReference(), toDrafts(request.getLines())));
    }

    @PostMapping("/{id}/post")
    public JournalEntryResponse postEntry(@PathVariable("id") UUID id,
                                          @RequestHeader(ACTOR_HEADER) String actor) {
        return JournalEntryResponse.from(journalEntryService.postEntry(id, actor));
    }

    @PostMapping("/{id}/void")
    public JournalEntryResponse voidEntry(@PathVariable("id") UUID id,
                                          @RequestHeader(ACTOR_HEADER) String actor,
                                          @Valid @RequestBody VoidJournalEntryRequest request) {
        return JournalEntryResponse.from(journalEntryService.voidEntry(id, request.getReason(), actor));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteEntry(@PathVariable("id") UUID id) {
        journalEntryService.deleteEntry(id);
        return ResponseEntity.noContent().build();
    }

    private static List<JournalLineDraft> toDrafts(List<JournalLineRequest> lines) {
        return lines == null ? List.of() : lines.stream().map(JournalLineRequest::toDraft).toList();
    }
}
