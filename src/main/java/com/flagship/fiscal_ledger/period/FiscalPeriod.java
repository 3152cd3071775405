package com.flagship.fiscal_ledger.period;

import com.flagship.fiscal_ledger.calendar.CalendarConverter;
import com.flagship.fiscal_ledger.exception.StateException;
import com.flagship.fiscal_ledger.exception.ValidationException;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A fiscal period: a named accounting window with boundaries in both calendars,
 * lifecycle flags and three document counters.
 *
 * Lifecycle:
 * - created open and not current
 * - may be promoted to current (at most one per tenant, enforced by the store)
 * - counters advance only while open
 * - closed: counters frozen, closing actor and time recorded
 * - reopened: closing metadata cleared
 * - deletable only while neither current nor closed
 *
 * Instances are immutable; transitions return a new instance. Counter values here
 * are a snapshot; the authoritative values live in the store and only move through
 * its atomic increment.
 */
@Value
public class FiscalPeriod {
    UUID id;
    UUID tenantId;
    String name;
    LocalDate startDate;
    LocalDate endDate;
    String startDateSecondary;
    String endDateSecondary;
    boolean current;
    boolean closed;
    Instant closedAt;
    UUID closedBy;
    String invoicePrefix;
    String purchasePrefix;
    String voucherPrefix;
    long lastInvoiceNum;
    long lastPurchaseNum;
    long lastVoucherNum;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new open, non-current period with zeroed counters.
     *
     * @param strictName when true the name must be {@code YYYY/YY}; otherwise short
     *                   names are used verbatim as the year code
     */
    public static FiscalPeriod create(UUID tenantId, String name,
                                      LocalDate startDate, LocalDate endDate,
                                      String startDateSecondary, String endDateSecondary,
                                      boolean strictName, Instant now) {
        if (tenantId == null) {
            throw new ValidationException("Tenant is required");
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException("Period name is required");
        }
        if (startDate == null || endDate == null) {
            throw new ValidationException("Period start and end dates are required");
        }
        if (!endDate.isAfter(startDate)) {
            throw new ValidationException(
                String.format("Period end %s must be after start %s", endDate, startDate));
        }

        String yearCode = yearCode(name, strictName);
        return new FiscalPeriod(
            UUID.randomUUID(),
            tenantId,
            name,
            startDate,
            endDate,
            startDateSecondary,
            endDateSecondary,
            false,
            false,
            null,
            null,
            DocumentType.INVOICE.prefixFor(yearCode),
            DocumentType.PURCHASE.prefixFor(yearCode),
            DocumentType.VOUCHER.prefixFor(yearCode),
            0,
            0,
            0,
            now,
            now
        );
    }

    /**
     * {@code "2082/83" -> "8283"}: drops the century digits and the separator.
     * Names shorter than seven characters are used as-is unless strict.
     */
    static String yearCode(String name, boolean strict) {
        if (strict) {
            CalendarConverter.parseStartYear(name);
        }
        if (name.length() < 7) {
            return name;
        }
        return name.substring(2, 4) + name.substring(5, 7);
    }

    public FiscalPeriod close(UUID actor, Instant at) {
        if (closed) {
            throw new StateException("Fiscal period " + name + " is already closed");
        }
        if (actor == null) {
            throw new ValidationException("Closing actor is required");
        }
        return new FiscalPeriod(id, tenantId, name, startDate, endDate, startDateSecondary, endDateSecondary,
            current, true, at, actor, invoicePrefix, purchasePrefix, voucherPrefix,
            lastInvoiceNum, lastPurchaseNum, lastVoucherNum, createdAt, at);
    }

    public FiscalPeriod reopen(Instant at) {
        if (!closed) {
            throw new StateException("Fiscal period " + name + " is not closed");
        }
        return new FiscalPeriod(id, tenantId, name, startDate, endDate, startDateSecondary, endDateSecondary,
            current, false, null, null, invoicePrefix, purchasePrefix, voucherPrefix,
            lastInvoiceNum, lastPurchaseNum, lastVoucherNum, createdAt, at);
    }

    public void ensureDeletable() {
        if (current) {
            throw new StateException("Cannot delete the current fiscal period " + name);
        }
        if (closed) {
            throw new StateException("Cannot delete closed fiscal period " + name);
        }
    }

    /**
     * Inclusive on both ends.
     */
    public boolean contains(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    public boolean belongsTo(UUID tenant) {
        return tenantId.equals(tenant);
    }

    public String prefixFor(DocumentType type) {
        return switch (type) {
            case INVOICE -> invoicePrefix;
            case PURCHASE -> purchasePrefix;
            case VOUCHER -> voucherPrefix;
        };
    }
}
