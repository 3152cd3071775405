package com.flagship.fiscal_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.fiscal_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Records lifecycle events next to the state change that caused them.
 *
 * {@link #saveEvent} only joins an existing transaction, so an event commits or rolls
 * back together with the period or journal update it describes. The relay side
 * ({@link #findUnpublishedEvents}, {@link #markPublished}, {@link #markFailed}) runs
 * in its own short transactions driven by {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * @throws org.springframework.transaction.IllegalTransactionStateException when called without a transaction
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, UUID aggregateId, String eventType, Object payload) {
        OutboxEvent event = new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType,
            toJson(eventType, payload), CorrelationContext.getCorrelationId(), clock.instant(),
            null, 0, null, null);
        repository.save(OutboxEventEntity.pending(event));

        log.debug("Queued {} for {} {}", eventType, aggregateType, aggregateId);
        return event;
    }

    /**
     * Oldest pending events below the retry ceiling. Rows are locked with SKIP LOCKED
     * for the duration of this call only.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit, int maxRetries) {
        return repository.findUnpublishedEventsForUpdate(limit, maxRetries).stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> entity.published(clock.instant()));
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String error) {
        repository.findById(eventId).ifPresentOrElse(
            entity -> {
                entity.failed(error);
                log.warn("Relay of {} {} failed (attempt {}): {}",
                    entity.getEventType(), eventId, entity.getRetryCount(), error);
            },
            () -> log.warn("Relay failure reported for unknown outbox event {}", eventId));
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId).stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String toJson(String eventType, Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + eventType + " payload", e);
        }
    }
}
