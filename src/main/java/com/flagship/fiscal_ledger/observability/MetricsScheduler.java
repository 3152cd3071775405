package com.flagship.fiscal_ledger.observability;

import com.flagship.fiscal_ledger.period.FiscalPeriodRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the gauges that need a query: outbox backlog and period counts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final LedgerMetrics ledgerMetrics;
    private final FiscalPeriodRepository periodRepository;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refresh() {
        outboxMetrics.refreshMetrics();
        try {
            ledgerMetrics.updatePeriodCounts(periodRepository.countByState());
        } catch (DataAccessException e) {
            log.warn("Period gauges not refreshed: {}", e.getMessage());
        }
    }
}
