package com.flagship.fiscal_ledger.journal;

import com.flagship.fiscal_ledger.journal.dto.CreateJournalEntryRequest;
import com.flagship.fiscal_ledger.journal.dto.JournalEntryResponse;
import com.flagship.fiscal_ledger.observability.CorrelationContext;
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
import java.util.UUID;

/**
 * Journal entry endpoints. The acting user comes from the {@code X-Actor-Id} header.
 */
@RestController
@RequiredArgsConstructor
public class JournalEntryController {

    private final JournalEntryService journalService;

    @PostMapping("/api/tenants/{tenantId}/journal-entries")
    public ResponseEntity<JournalEntryResponse> create(@PathVariable("tenantId") UUID tenantId,
                                                       @RequestHeader(CorrelationContext.ACTOR_ID_HEADER) UUID actor,
                                                       @Valid @RequestBody CreateJournalEntryRequest request) {
        JournalEntry entry = journalService.create(tenantId, actor, request.toDomain());
        return ResponseEntity.status(HttpStatus.CREATED).body(JournalEntryResponse.from(entry));
    }

    @GetMapping("/api/tenants/{tenantId}/periods/{periodId}/journal-entries")
    public List<JournalEntryResponse> listForPeriod(@PathVariable("tenantId") UUID tenantId,
                                                    @PathVariable("periodId") UUID periodId) {
        return journalService.listForPeriod(tenantId, periodId).stream()
            .map(JournalEntryResponse::from)
            .toList();
    }

    @GetMapping("/api/journal-entries/{entryId}")
    public JournalEntryResponse get(@PathVariable("entryId") UUID entryId) {
        return JournalEntryResponse.from(journalService.get(entryId));
    }

    @PostMapping("/api/journal-entries/{entryId}/post")
    public JournalEntryResponse post(@PathVariable("entryId") UUID entryId,
                                     @RequestHeader(CorrelationContext.ACTOR_ID_HEADER) UUID actor) {
        return JournalEntryResponse.from(journalService.post(entryId, actor));
    }
}
