package com.flagship.fiscal_ledger.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.documents.numbered: document numbers issued, by document type and outcome
 * - ledger.journal.created / ledger.journal.posted: journal lifecycle outcomes
 * - ledger.periods.lifecycle: period create/close/reopen/current/delete actions
 * - ledger.operation.latency: timer per service operation
 * - ledger.periods: gauge of open and closed periods, refreshed by {@link MetricsScheduler}
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final AtomicLong openPeriods = new AtomicLong();
    private final AtomicLong closedPeriods = new AtomicLong();

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("ledger.periods", openPeriods, AtomicLong::get).tag("state", "open").register(registry);
        Gauge.builder("ledger.periods", closedPeriods, AtomicLong::get).tag("state", "closed").register(registry);
    }

    public void updatePeriodCounts(Map<String, Long> countsByState) {
        openPeriods.set(countsByState.getOrDefault("open", 0L));
        closedPeriods.set(countsByState.getOrDefault("closed", 0L));
    }

    public void recordDocumentNumbered(String documentType, String status) {
        registry.counter("ledger.documents.numbered",
                "document_type", sanitizeTag(documentType),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordJournalCreated(String status) {
        registry.counter("ledger.journal.created",
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordJournalPosted(String status) {
        registry.counter("ledger.journal.posted",
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordPeriodLifecycle(String action) {
        registry.counter("ledger.periods.lifecycle",
                "action", sanitizeTag(action)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
