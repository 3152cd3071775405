package com.flagship.fiscal_ledger.period.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of fiscal period lifecycle events.
 */
public interface PeriodEvent {

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    UUID getPeriodId();

    UUID getTenantId();

    Instant getOccurredAt();

    String getEventType();
}
