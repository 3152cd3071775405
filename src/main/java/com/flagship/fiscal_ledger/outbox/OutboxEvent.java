package com.flagship.fiscal_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A period or journal lifecycle fact queued for Kafka.
 */
@Value
public class OutboxEvent {

    public static final String FISCAL_PERIOD_AGGREGATE = "FiscalPeriod";
    public static final String JOURNAL_ENTRY_AGGREGATE = "JournalEntry";

    UUID id;
    String aggregateType;
    UUID aggregateId;           // record key on the topic
    String eventType;
    String payload;
    String correlationId;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;        // null until read back from the table

    public boolean isPublished() {
        return publishedAt != null;
    }
}
