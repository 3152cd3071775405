package com.flagship.fiscal_ledger.period.event;

import com.flagship.fiscal_ledger.period.FiscalPeriod;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a period is closed. Carries the final counter values so
 * consumers can reconcile issued document ranges.
 */
@Value
public class FiscalPeriodClosedEvent implements PeriodEvent {
    UUID eventId;
    UUID periodId;
    UUID tenantId;
    String name;
    UUID closedBy;
    long lastInvoiceNum;
    long lastPurchaseNum;
    long lastVoucherNum;
    Instant occurredAt;

    public static final String EVENT_TYPE = "FiscalPeriodClosed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static FiscalPeriodClosedEvent from(FiscalPeriod period) {
        return new FiscalPeriodClosedEvent(
            UUID.randomUUID(),
            period.getId(),
            period.getTenantId(),
            period.getName(),
            period.getClosedBy(),
            period.getLastInvoiceNum(),
            period.getLastPurchaseNum(),
            period.getLastVoucherNum(),
            period.getClosedAt()
        );
    }
}
