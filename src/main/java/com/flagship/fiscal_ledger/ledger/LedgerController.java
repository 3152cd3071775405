package com.flagship.fiscal_ledger.ledger;

import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/tenants/{tenantId}/accounts/{accountId}")
@RequiredArgsConstructor
public class LedgerController {

    private final LedgerProjector projector;

    @GetMapping("/ledger")
    public List<LedgerEntry> ledger(@PathVariable("tenantId") UUID tenantId,
                                    @PathVariable("accountId") UUID accountId,
                                    @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                    @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return projector.project(tenantId, accountId, from, to);
    }

    @GetMapping("/ledger/summary")
    public LedgerSummary summary(@PathVariable("tenantId") UUID tenantId,
                                 @PathVariable("accountId") UUID accountId,
                                 @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                 @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return projector.summarize(tenantId, accountId, from, to);
    }
}
