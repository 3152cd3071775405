package com.flagship.fiscal_ledger.outbox;

import com.flagship.fiscal_ledger.observability.CorrelationContext;
import com.flagship.fiscal_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Relays queued lifecycle events to Kafka.
 *
 * Period events go to {@code kafka.topic.fiscal-periods}, journal events to
 * {@code kafka.topic.journal-entries}, keyed by aggregate id. Within a batch, once an
 * event of some aggregate fails the rest of that aggregate's events wait for the next
 * poll, so a reopen is not relayed ahead of a close that is still being retried.
 * Events that use up {@code outbox.publisher.max-retries} attempts are no longer polled,
 * and once a close is dead-lettered the aggregate's later events are relayed without it.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    static final String EVENT_TYPE_HEADER = "eventType";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.fiscal-periods:fiscal-periods}")
    private String fiscalPeriodsTopic;

    @Value("${kafka.topic.journal-entries:journal-entries}")
    private String journalEntriesTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:5000}")
    private long sendTimeoutMs;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> batch;
        try {
            batch = outboxService.findUnpublishedEvents(batchSize, maxRetries);
        } catch (RuntimeException e) {
            log.error("Could not read the outbox, will retry on the next poll", e);
            return;
        }
        if (batch.isEmpty()) {
            return;
        }
        log.debug("Relaying {} outbox events", batch.size());

        Set<UUID> held = new HashSet<>();
        for (OutboxEvent event : batch) {
            if (held.contains(event.getAggregateId())) {
                continue;
            }
            if (!relay(event)) {
                held.add(event.getAggregateId());
            }
        }
    }

    /**
     * Manually triggers publishing (used by tests).
     */
    public void triggerPublish() {
        publishPendingEvents();
    }

    private boolean relay(OutboxEvent event) {
        try {
            SendResult<String, String> result = kafkaTemplate.send(recordFor(event))
                .get(sendTimeoutMs, TimeUnit.MILLISECONDS);
            log.debug("Relayed {} {} to {}-{}@{}", event.getEventType(), event.getId(),
                result.getRecordMetadata().topic(), result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "interrupted while waiting for the broker");
            return false;
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            log.error("Relay of {} {} failed: {}", event.getEventType(), event.getId(), cause.toString());
            recordFailure(event, cause.toString());
            return false;
        }
    }

    private void recordFailure(OutboxEvent event, String error) {
        outboxService.markFailed(event.getId(), error);
        outboxMetrics.recordEventPublishFailed(event.getEventType());
        if (event.getRetryCount() + 1 >= maxRetries) {
            log.warn("{} {} for {} {} gave up after {} attempts",
                event.getEventType(), event.getId(), event.getAggregateType(), event.getAggregateId(), maxRetries);
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }

    ProducerRecord<String, String> recordFor(OutboxEvent event) {
        ProducerRecord<String, String> record =
            new ProducerRecord<>(topicFor(event), event.getAggregateId().toString(), event.getPayload());
        record.headers().add(EVENT_TYPE_HEADER, event.getEventType().getBytes(StandardCharsets.UTF_8));
        if (event.getCorrelationId() != null) {
            record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
                event.getCorrelationId().getBytes(StandardCharsets.UTF_8));
        }
        return record;
    }

    String topicFor(OutboxEvent event) {
        return switch (event.getAggregateType()) {
            case OutboxEvent.FISCAL_PERIOD_AGGREGATE -> fiscalPeriodsTopic;
            case OutboxEvent.JOURNAL_ENTRY_AGGREGATE -> journalEntriesTopic;
            default -> throw new IllegalStateException("No topic for aggregate type " + event.getAggregateType());
        };
    }
}
