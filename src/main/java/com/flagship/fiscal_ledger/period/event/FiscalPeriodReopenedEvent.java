package com.flagship.fiscal_ledger.period.event;

import com.flagship.fiscal_ledger.period.FiscalPeriod;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class FiscalPeriodReopenedEvent implements PeriodEvent {
    UUID eventId;
    UUID periodId;
    UUID tenantId;
    String name;
    Instant occurredAt;

    public static final String EVENT_TYPE = "FiscalPeriodReopened";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static FiscalPeriodReopenedEvent from(FiscalPeriod period) {
        return new FiscalPeriodReopenedEvent(
            UUID.randomUUID(),
            period.getId(),
            period.getTenantId(),
            period.getName(),
            period.getUpdatedAt()
        );
    }
}
