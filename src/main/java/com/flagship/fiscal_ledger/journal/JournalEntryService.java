package com.flagship.fiscal_ledger.journal;

import com.flagship.fiscal_ledger.account.AccountService;
import com.flagship.fiscal_ledger.exception.ConflictException;
import com.flagship.fiscal_ledger.exception.NotFoundException;
import com.flagship.fiscal_ledger.exception.StateException;
import com.flagship.fiscal_ledger.exception.ValidationException;
import com.flagship.fiscal_ledger.journal.event.JournalEntryPostedEvent;
import com.flagship.fiscal_ledger.observability.CorrelationContext;
import com.flagship.fiscal_ledger.observability.LedgerMetrics;
import com.flagship.fiscal_ledger.outbox.OutboxEvent;
import com.flagship.fiscal_ledger.outbox.OutboxService;
import com.flagship.fiscal_ledger.period.DocumentType;
import com.flagship.fiscal_ledger.period.FiscalPeriod;
import com.flagship.fiscal_ledger.period.FiscalPeriodService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Creates and posts journal entries.
 *
 * Entries are written as DRAFT and only reach the ledger once posted. Both steps
 * require the fiscal period to be open; the period row stays share-locked until
 * the transaction commits, so a concurrent close waits for it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalEntryService {

    private final JournalEntryRepository repository;
    private final FiscalPeriodService periodService;
    private final AccountService accountService;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * Validates and stores a DRAFT entry.
     *
     * Checks run in this order: period exists and belongs to the tenant, period is
     * open, date is inside the period, every account exists, lines balance.
     *
     * @throws NotFoundException   if the period or an account is unknown to the tenant
     * @throws ValidationException if the period is closed, the date is outside it or the lines do not balance
     */
    @Transactional
    public JournalEntry create(UUID tenantId, UUID actor, JournalEntryRequest request) {
        long start = System.currentTimeMillis();
        CorrelationContext.putId(CorrelationContext.TENANT_ID_MDC_KEY, tenantId);
        try {
            if (request == null || request.getFiscalPeriodId() == null) {
                throw new ValidationException("Fiscal period is required");
            }
            if (request.getTransactionDate() == null) {
                throw new ValidationException("Transaction date is required");
            }
            CorrelationContext.putId(CorrelationContext.PERIOD_ID_MDC_KEY, request.getFiscalPeriodId());

            FiscalPeriod period = periodService.get(request.getFiscalPeriodId());
            if (!period.belongsTo(tenantId)) {
                throw NotFoundException.of("Fiscal period", request.getFiscalPeriodId());
            }
            if (period.isClosed()) {
                throw new ValidationException("Cannot create journal entry in closed fiscal period " + period.getName());
            }
            if (!period.contains(request.getTransactionDate())) {
                throw new ValidationException(String.format(
                    "Transaction date %s is outside fiscal period %s (%s to %s)",
                    request.getTransactionDate(), period.getName(), period.getStartDate(), period.getEndDate()));
            }

            List<JournalEntryRequest.Line> lines = request.getLines() != null ? request.getLines() : List.of();
            if (lines.stream().map(JournalEntryRequest.Line::getAccountId).anyMatch(Objects::isNull)) {
                throw new ValidationException("Every line needs an account");
            }
            accountService.requireAllExist(tenantId,
                lines.stream().map(JournalEntryRequest.Line::getAccountId).toList());

            // Balance is checked before a voucher number is consumed.
            JournalEntry entry = JournalEntry.draft(tenantId, actor, request, null, Instant.now(clock));

            // A close that lands after the check above is still a validation failure here.
            try {
                if (request.isAssignVoucherNumber()) {
                    entry = entry.withVoucherNumber(periodService.generateNumber(period.getId(), DocumentType.VOUCHER));
                } else {
                    requireStillOpen(periodService.getLocked(period.getId()));
                }
            } catch (StateException e) {
                throw new ValidationException(
                    "Cannot create journal entry in closed fiscal period " + period.getName(), e);
            }

            repository.insert(entry);

            CorrelationContext.putId(CorrelationContext.TENANT_ID_MDC_KEY, tenantId);
            CorrelationContext.putId(CorrelationContext.PERIOD_ID_MDC_KEY, period.getId());
            CorrelationContext.putId(CorrelationContext.ENTRY_ID_MDC_KEY, entry.getId());
            metrics.recordJournalCreated("success");
            log.info("Created draft journal entry {} on {} with {} lines (voucher={})",
                entry.getId(), entry.getTransactionDate(), entry.getLines().size(), entry.getVoucherNumber());
            return entry;
        } catch (RuntimeException e) {
            metrics.recordJournalCreated("rejected");
            throw e;
        } finally {
            metrics.recordLatency("journal_create", System.currentTimeMillis() - start);
            CorrelationContext.clearDomainIds();
        }
    }

    /**
     * Posts a DRAFT entry so it appears in the ledger.
     *
     * @throws ConflictException if the entry is already posted, including by a concurrent caller
     * @throws StateException    if its fiscal period has been closed since creation
     */
    @Transactional
    public JournalEntry post(UUID entryId, UUID actor) {
        CorrelationContext.putId(CorrelationContext.ENTRY_ID_MDC_KEY, entryId);
        try {
            JournalEntry entry = get(entryId);
            if (entry.isPosted()) {
                throw new ConflictException("Journal entry is already posted: " + entryId);
            }

            requireStillOpen(periodService.getLocked(entry.getFiscalPeriodId()));

            Instant now = Instant.now(clock);
            if (repository.markPosted(entryId, actor, now) == 0) {
                throw new ConflictException("Journal entry was posted concurrently: " + entryId);
            }

            JournalEntry posted = get(entryId);
            outboxService.saveEvent(
                OutboxEvent.JOURNAL_ENTRY_AGGREGATE,
                entryId,
                JournalEntryPostedEvent.EVENT_TYPE,
                JournalEntryPostedEvent.from(posted)
            );
            metrics.recordJournalPosted("success");
            log.info("Posted journal entry {} (debits={})", entryId, posted.getTotalDebit().toPlainString());
            return posted;
        } catch (RuntimeException e) {
            metrics.recordJournalPosted("rejected");
            throw e;
        } finally {
            CorrelationContext.clearDomainIds();
        }
    }

    @Transactional(readOnly = true)
    public JournalEntry get(UUID entryId) {
        return repository.findById(entryId)
            .orElseThrow(() -> NotFoundException.of("Journal entry", entryId));
    }

    @Transactional(readOnly = true)
    public List<JournalEntry> listForPeriod(UUID tenantId, UUID periodId) {
        FiscalPeriod period = periodService.get(periodId);
        if (!period.belongsTo(tenantId)) {
            throw NotFoundException.of("Fiscal period", periodId);
        }
        return repository.findByPeriod(tenantId, periodId);
    }

    private static void requireStillOpen(FiscalPeriod period) {
        if (period.isClosed()) {
            throw new StateException("Fiscal period " + period.getName() + " is closed");
        }
    }
}
