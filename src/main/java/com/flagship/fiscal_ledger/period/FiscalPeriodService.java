package com.flagship.fiscal_ledger.period;

import com.flagship.fiscal_ledger.calendar.CalendarConverter;
import com.flagship.fiscal_ledger.calendar.PeriodBounds;
import com.flagship.fiscal_ledger.exception.ConflictException;
import com.flagship.fiscal_ledger.exception.NotFoundException;
import com.flagship.fiscal_ledger.exception.StateException;
import com.flagship.fiscal_ledger.exception.ValidationException;
import com.flagship.fiscal_ledger.observability.CorrelationContext;
import com.flagship.fiscal_ledger.observability.LedgerMetrics;
import com.flagship.fiscal_ledger.outbox.OutboxEvent;
import com.flagship.fiscal_ledger.outbox.OutboxService;
import com.flagship.fiscal_ledger.period.event.CurrentFiscalPeriodChangedEvent;
import com.flagship.fiscal_ledger.period.event.FiscalPeriodClosedEvent;
import com.flagship.fiscal_ledger.period.event.FiscalPeriodReopenedEvent;
import com.flagship.fiscal_ledger.period.event.PeriodEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Fiscal period lifecycle and per-period document numbering.
 *
 * Rules enforced here:
 * - at most one current period per tenant (tenant rows locked while switching)
 * - closed periods issue no numbers and cannot be deleted
 * - the current period cannot be deleted
 * - every issued number is unique within its period and document type
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FiscalPeriodService {

    private final FiscalPeriodRepository repository;
    private final CalendarConverter calendar;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;
    private final Clock clock;

    @Value("${ledger.period.strict-name-format:false}")
    private boolean strictNameFormat;

    /**
     * Creates an open, non-current period with explicit Gregorian boundaries.
     * Secondary-calendar boundaries are derived from them.
     */
    @Transactional
    public FiscalPeriod create(UUID tenantId, String name, LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) {
            throw new ValidationException("Period start and end dates are required");
        }
        return insert(FiscalPeriod.create(
            tenantId,
            name,
            startDate,
            endDate,
            calendar.toSecondary(startDate).toString(),
            calendar.toSecondary(endDate).toString(),
            strictNameFormat,
            Instant.now(clock)
        ));
    }

    /**
     * Creates a period whose boundaries are derived from a {@code YYYY/YY} name.
     */
    @Transactional
    public FiscalPeriod createFromName(UUID tenantId, String name) {
        PeriodBounds bounds = calendar.periodBoundsFromName(name);
        return insert(FiscalPeriod.create(
            tenantId,
            name.trim(),
            bounds.getStartGregorian(),
            bounds.getEndGregorian(),
            bounds.getStartSecondary().toString(),
            bounds.getEndSecondary().toString(),
            true,
            Instant.now(clock)
        ));
    }

    private FiscalPeriod insert(FiscalPeriod period) {
        CorrelationContext.putId(CorrelationContext.TENANT_ID_MDC_KEY, period.getTenantId());
        CorrelationContext.putId(CorrelationContext.PERIOD_ID_MDC_KEY, period.getId());
        try {
            repository.insert(period);
            metrics.recordPeriodLifecycle("created");
            log.info("Created fiscal period {} ({} to {}, secondary {} to {})",
                period.getName(), period.getStartDate(), period.getEndDate(),
                period.getStartDateSecondary(), period.getEndDateSecondary());
            return period;
        } catch (DuplicateKeyException e) {
            throw new ConflictException("Fiscal period already exists for tenant: " + period.getName(), e);
        } finally {
            CorrelationContext.clearDomainIds();
        }
    }

    @Transactional(readOnly = true)
    public FiscalPeriod get(UUID periodId) {
        return repository.findById(periodId)
            .orElseThrow(() -> NotFoundException.of("Fiscal period", periodId));
    }

    /**
     * Loads the period and holds a share lock on it for the rest of the caller's
     * transaction, so it cannot be closed until that transaction ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public FiscalPeriod getLocked(UUID periodId) {
        return repository.findByIdForShare(periodId)
            .orElseThrow(() -> NotFoundException.of("Fiscal period", periodId));
    }

    @Transactional(readOnly = true)
    public List<FiscalPeriod> listForTenant(UUID tenantId) {
        return repository.findByTenant(tenantId);
    }

    @Transactional(readOnly = true)
    public FiscalPeriod getCurrent(UUID tenantId) {
        return repository.findCurrent(tenantId)
            .orElseThrow(() -> new NotFoundException("No current fiscal period for tenant " + tenantId));
    }

    /**
     * Makes the period the tenant's current one and unsets any previous current
     * period in the same transaction.
     */
    @Transactional
    public FiscalPeriod setAsCurrent(UUID tenantId, UUID periodId) {
        CorrelationContext.putId(CorrelationContext.TENANT_ID_MDC_KEY, tenantId);
        CorrelationContext.putId(CorrelationContext.PERIOD_ID_MDC_KEY, periodId);
        try {
            repository.lockTenantPeriods(tenantId);

            FiscalPeriod target = repository.findById(periodId)
                .filter(p -> p.belongsTo(tenantId))
                .orElseThrow(() -> NotFoundException.of("Fiscal period", periodId));
            if (target.isCurrent()) {
                return target;
            }

            UUID previousId = repository.findCurrent(tenantId).map(FiscalPeriod::getId).orElse(null);
            Instant now = Instant.now(clock);
            repository.clearCurrent(tenantId, now);
            if (repository.markCurrent(periodId, tenantId, now) == 0) {
                throw NotFoundException.of("Fiscal period", periodId);
            }

            publish(CurrentFiscalPeriodChangedEvent.of(tenantId, periodId, previousId, now));
            metrics.recordPeriodLifecycle("set_current");
            log.info("Fiscal period {} is now current (previous: {})", target.getName(), previousId);
            return get(periodId);
        } finally {
            CorrelationContext.clearDomainIds();
        }
    }

    /**
     * Closes an open period. Counters freeze from this point on.
     */
    @Transactional
    public FiscalPeriod close(UUID periodId, UUID actor) {
        CorrelationContext.putId(CorrelationContext.PERIOD_ID_MDC_KEY, periodId);
        try {
            FiscalPeriod closed = get(periodId).close(actor, Instant.now(clock));
            if (repository.markClosed(periodId, actor, closed.getClosedAt()) == 0) {
                throw new StateException("Fiscal period " + closed.getName() + " is already closed");
            }

            FiscalPeriod stored = get(periodId);
            publish(FiscalPeriodClosedEvent.from(stored));
            metrics.recordPeriodLifecycle("closed");
            log.info("Closed fiscal period {} by {} (invoice={}, purchase={}, voucher={})",
                stored.getName(), actor,
                stored.getLastInvoiceNum(), stored.getLastPurchaseNum(), stored.getLastVoucherNum());
            return stored;
        } finally {
            CorrelationContext.clearDomainIds();
        }
    }

    @Transactional
    public FiscalPeriod reopen(UUID periodId) {
        CorrelationContext.putId(CorrelationContext.PERIOD_ID_MDC_KEY, periodId);
        try {
            FiscalPeriod reopened = get(periodId).reopen(Instant.now(clock));
            if (repository.markReopened(periodId, reopened.getUpdatedAt()) == 0) {
                throw new StateException("Fiscal period " + reopened.getName() + " is not closed");
            }

            publish(FiscalPeriodReopenedEvent.from(reopened));
            metrics.recordPeriodLifecycle("reopened");
            log.info("Reopened fiscal period {}", reopened.getName());
            return get(periodId);
        } finally {
            CorrelationContext.clearDomainIds();
        }
    }

    @Transactional
    public void delete(UUID periodId) {
        CorrelationContext.putId(CorrelationContext.PERIOD_ID_MDC_KEY, periodId);
        try {
            FiscalPeriod period = get(periodId);
            period.ensureDeletable();

            int deleted;
            try {
                deleted = repository.deleteIfDeletable(periodId);
            } catch (DataIntegrityViolationException e) {
                throw new StateException("Fiscal period " + period.getName() + " still has journal entries");
            }
            if (deleted == 0) {
                // Became current or closed between the read and the delete.
                get(periodId).ensureDeletable();
                throw NotFoundException.of("Fiscal period", periodId);
            }

            metrics.recordPeriodLifecycle("deleted");
            log.info("Deleted fiscal period {}", period.getName());
        } finally {
            CorrelationContext.clearDomainIds();
        }
    }

    public String generateInvoiceNumber(UUID periodId) {
        return generateNumber(periodId, DocumentType.INVOICE);
    }

    public String generatePurchaseNumber(UUID periodId) {
        return generateNumber(periodId, DocumentType.PURCHASE);
    }

    public String generateVoucherNumber(UUID periodId) {
        return generateNumber(periodId, DocumentType.VOUCHER);
    }

    /**
     * Issues the next number for a document type, e.g. {@code INV-8283-0001}.
     *
     * Runs in the caller's transaction when there is one; otherwise the increment
     * commits on its own.
     *
     * @throws NotFoundException if the period does not exist
     * @throws StateException if the period is closed
     */
    public String generateNumber(UUID periodId, DocumentType type) {
        CorrelationContext.putId(CorrelationContext.PERIOD_ID_MDC_KEY, periodId);
        long start = System.currentTimeMillis();
        try {
            IssuedNumber issued = repository.incrementCounter(periodId, type).orElse(null);
            if (issued == null) {
                FiscalPeriod period = get(periodId);
                metrics.recordDocumentNumbered(type.name(), "rejected");
                if (period.isClosed()) {
                    throw new StateException(
                        "Cannot generate " + type.getCode() + " number: fiscal period " + period.getName() + " is closed");
                }
                throw new IllegalStateException("Counter update affected no rows for open period " + periodId);
            }

            String number = issued.format();
            metrics.recordDocumentNumbered(type.name(), "issued");
            log.debug("Issued {} number {}", type, number);
            return number;
        } finally {
            metrics.recordLatency("generate_number", System.currentTimeMillis() - start);
            CorrelationContext.clearDomainIds();
        }
    }

    private void publish(PeriodEvent event) {
        outboxService.saveEvent(
            OutboxEvent.FISCAL_PERIOD_AGGREGATE,
            event.getPeriodId(),
            event.getEventType(),
            event
        );
    }
}
