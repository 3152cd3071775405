package com.flagship.fiscal_ledger.period;

import com.flagship.fiscal_ledger.period.dto.CreatePeriodFromNameRequest;
import com.flagship.fiscal_ledger.period.dto.CreatePeriodRequest;
import com.flagship.fiscal_ledger.period.dto.DocumentNumberResponse;
import com.flagship.fiscal_ledger.period.dto.FiscalPeriodResponse;
import com.flagship.fiscal_ledger.observability.CorrelationContext;
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
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST endpoints for fiscal periods and document numbering.
 *
 * Closing requires the {@code X-Actor-Id} header; the actor is recorded on the period.
 */
@RestController
@RequiredArgsConstructor
public class FiscalPeriodController {

    private final FiscalPeriodService periodService;

    @PostMapping("/api/tenants/{tenantId}/periods")
    public ResponseEntity<FiscalPeriodResponse> create(@PathVariable("tenantId") UUID tenantId,
                                                       @Valid @RequestBody CreatePeriodRequest request) {
        FiscalPeriod period = periodService.create(
            tenantId, request.getName(), request.getStartDate(), request.getEndDate());
        return ResponseEntity.status(HttpStatus.CREATED).body(FiscalPeriodResponse.from(period));
    }

    @PostMapping("/api/tenants/{tenantId}/periods/from-name")
    public ResponseEntity<FiscalPeriodResponse> createFromName(@PathVariable("tenantId") UUID tenantId,
                                                               @Valid @RequestBody CreatePeriodFromNameRequest request) {
        FiscalPeriod period = periodService.createFromName(tenantId, request.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(FiscalPeriodResponse.from(period));
    }

    @GetMapping("/api/tenants/{tenantId}/periods")
    public List<FiscalPeriodResponse> list(@PathVariable("tenantId") UUID tenantId) {
        return periodService.listForTenant(tenantId).stream()
            .map(FiscalPeriodResponse::from)
            .toList();
    }

    @GetMapping("/api/tenants/{tenantId}/periods/current")
    public FiscalPeriodResponse current(@PathVariable("tenantId") UUID tenantId) {
        return FiscalPeriodResponse.from(periodService.getCurrent(tenantId));
    }

    @PutMapping("/api/tenants/{tenantId}/periods/{periodId}/current")
    public FiscalPeriodResponse setCurrent(@PathVariable("tenantId") UUID tenantId,
                                           @PathVariable("periodId") UUID periodId) {
        return FiscalPeriodResponse.from(periodService.setAsCurrent(tenantId, periodId));
    }

    @GetMapping("/api/periods/{periodId}")
    public FiscalPeriodResponse get(@PathVariable("periodId") UUID periodId) {
        return FiscalPeriodResponse.from(periodService.get(periodId));
    }

    @PostMapping("/api/periods/{periodId}/close")
    public FiscalPeriodResponse close(@PathVariable("periodId") UUID periodId,
                                      @RequestHeader(CorrelationContext.ACTOR_ID_HEADER) UUID actor) {
        return FiscalPeriodResponse.from(periodService.close(periodId, actor));
    }

    @PostMapping("/api/periods/{periodId}/reopen")
    public FiscalPeriodResponse reopen(@PathVariable("periodId") UUID periodId) {
        return FiscalPeriodResponse.from(periodService.reopen(periodId));
    }

    @DeleteMapping("/api/periods/{periodId}")
    public ResponseEntity<Void> delete(@PathVariable("periodId") UUID periodId) {
        periodService.delete(periodId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/api/periods/{periodId}/numbers/{documentType}")
    public DocumentNumberResponse nextNumber(@PathVariable("periodId") UUID periodId,
                                             @PathVariable("documentType") String documentType) {
        DocumentType type = DocumentType.fromPath(documentType);
        return new DocumentNumberResponse(periodId, type, periodService.generateNumber(periodId, type));
    }
}
