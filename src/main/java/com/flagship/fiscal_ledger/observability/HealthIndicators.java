package com.flagship.fiscal_ledger.observability;

import com.flagship.fiscal_ledger.calendar.CalendarConverter;
import com.flagship.fiscal_ledger.calendar.SecondaryCalendarDate;
import com.flagship.fiscal_ledger.exception.ValidationException;
import com.flagship.fiscal_ledger.outbox.OutboxEvent;
import com.flagship.fiscal_ledger.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.dao.DataAccessException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Actuator health contributors specific to the ledger.
 */
public class HealthIndicators {

    /**
     * Reports the relay backlog per aggregate. A large backlog degrades health but
     * never blocks period or journal operations.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        static final long WARNING_BACKLOG = 1_000;
        static final long CRITICAL_BACKLOG = 10_000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long periods = outboxRepository.countByAggregateTypeAndPublishedAtIsNull(OutboxEvent.FISCAL_PERIOD_AGGREGATE);
                long journals = outboxRepository.countByAggregateTypeAndPublishedAtIsNull(OutboxEvent.JOURNAL_ENTRY_AGGREGATE);
                long total = periods + journals;

                Health.Builder builder;
                if (total >= CRITICAL_BACKLOG) {
                    builder = Health.down();
                } else if (total >= WARNING_BACKLOG) {
                    builder = Health.status("WARNING");
                } else {
                    builder = Health.up();
                }
                return builder
                    .withDetail("pendingPeriodEvents", periods)
                    .withDetail("pendingJournalEvents", journals)
                    .withDetail("warningThreshold", WARNING_BACKLOG)
                    .build();
            } catch (DataAccessException e) {
                return Health.down(e).build();
            }
        }
    }

    /**
     * Fails once today falls outside the month-length table. Period creation and date
     * conversion stop working at that point, so the table needs extending before then.
     */
    @Component("fiscalCalendarHealth")
    public static class FiscalCalendarHealthIndicator implements HealthIndicator {

        private final CalendarConverter calendar;

        public FiscalCalendarHealthIndicator(CalendarConverter calendar) {
            this.calendar = calendar;
        }

        @Override
        public Health health() {
            try {
                SecondaryCalendarDate today = calendar.today();
                Health.Builder builder = today.getYear() >= calendar.lastSupportedYear()
                    ? Health.status("WARNING")
                    : Health.up();
                return builder
                    .withDetail("today", today.toString())
                    .withDetail("fiscalYear", calendar.fiscalYearNameOf(today))
                    .withDetail("lastSupportedYear", calendar.lastSupportedYear())
                    .build();
            } catch (ValidationException e) {
                return Health.down()
                    .withDetail("error", e.getMessage())
                    .withDetail("supportedYears", calendar.firstSupportedYear() + "-" + calendar.lastSupportedYear())
                    .build();
            }
        }
    }

    /**
     * Kafka only carries lifecycle events out of the outbox, so a missing broker
     * degrades the service rather than taking it down.
     */
    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            var metrics = kafkaTemplate.metrics();
            if (metrics == null || metrics.isEmpty()) {
                return Health.status("DEGRADED")
                    .withDetail("reason", "producer has not connected yet")
                    .build();
            }
            return Health.up().withDetail("producerMetrics", metrics.size()).build();
        }
    }
}
