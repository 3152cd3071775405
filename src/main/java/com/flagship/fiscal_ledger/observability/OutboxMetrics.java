package com.flagship.fiscal_ledger.observability;

import com.flagship.fiscal_ledger.outbox.OutboxEvent;
import com.flagship.fiscal_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox gauges and publish counters.
 *
 * The backlog is tracked separately for period and journal events, since a stuck
 * journal topic should not hide behind a healthy period topic. Gauge values are
 * cached and refreshed by {@link MetricsScheduler}; a scrape never queries the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private static final List<String> AGGREGATES =
        List.of(OutboxEvent.FISCAL_PERIOD_AGGREGATE, OutboxEvent.JOURNAL_ENTRY_AGGREGATE);

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final Map<String, AtomicLong> backlogByAggregate = new LinkedHashMap<>();
    private final AtomicLong oldestPendingSeconds = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();

    @PostConstruct
    public void init() {
        for (String aggregate : AGGREGATES) {
            AtomicLong backlog = new AtomicLong();
            backlogByAggregate.put(aggregate, backlog);
            Gauge.builder("ledger.outbox.backlog", backlog, AtomicLong::get)
                .description("Lifecycle events not yet relayed to Kafka")
                .tag("aggregate", aggregate)
                .register(meterRegistry);
        }
        Gauge.builder("ledger.outbox.oldest.pending.seconds", oldestPendingSeconds, AtomicLong::get)
            .description("Age of the oldest event still waiting to be relayed")
            .register(meterRegistry);
        Gauge.builder("ledger.outbox.dead.lettered", deadLettered, AtomicLong::get)
            .description("Events that used up their publish attempts")
            .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            backlogByAggregate.forEach((aggregate, gauge) ->
                gauge.set(outboxRepository.countByAggregateTypeAndPublishedAtIsNull(aggregate)));

            long age = outboxRepository.findOldestUnpublishedCreatedAt()
                .map(oldest -> Duration.between(oldest, clock.instant()).getSeconds())
                .orElse(0L);
            oldestPendingSeconds.set(Math.max(0, age));

            deadLettered.set(outboxRepository.countByRetryCountGreaterThanEqual(maxRetries));
            log.debug("Outbox gauges: backlog={}, oldest={}s, deadLettered={}",
                backlogByAggregate, oldestPendingSeconds.get(), deadLettered.get());
        } catch (DataAccessException e) {
            log.warn("Outbox gauges not refreshed, keeping previous values: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("ledger.outbox.published", "event_type", eventType, "status", "success").increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("ledger.outbox.published", "event_type", eventType, "status", "failure").increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("ledger.outbox.dead_lettered.total", "event_type", eventType).increment();
    }
}
