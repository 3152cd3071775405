package com.flagship.fiscal_ledger.period.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a tenant's current period changes.
 * {@code previousPeriodId} is null when the tenant had no current period.
 */
@Value
public class CurrentFiscalPeriodChangedEvent implements PeriodEvent {
    UUID eventId;
    UUID periodId;
    UUID tenantId;
    UUID previousPeriodId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CurrentFiscalPeriodChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CurrentFiscalPeriodChangedEvent of(UUID tenantId, UUID periodId, UUID previousPeriodId,
                                                     Instant at) {
        return new CurrentFiscalPeriodChangedEvent(UUID.randomUUID(), periodId, tenantId, previousPeriodId, at);
    }
}
