package com.flagship.fiscal_ledger.period.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fiscal_ledger.period.FiscalPeriod;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class FiscalPeriodResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("tenant_id")
    UUID tenantId;

    @JsonProperty("name")
    String name;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("start_date_secondary")
    String startDateSecondary;

    @JsonProperty("end_date_secondary")
    String endDateSecondary;

    @JsonProperty("is_current")
    boolean current;

    @JsonProperty("is_closed")
    boolean closed;

    @JsonProperty("closed_at")
    Instant closedAt;

    @JsonProperty("closed_by")
    UUID closedBy;

    @JsonProperty("invoice_prefix")
    String invoicePrefix;

    @JsonProperty("purchase_prefix")
    String purchasePrefix;

    @JsonProperty("voucher_prefix")
    String voucherPrefix;

    @JsonProperty("last_invoice_num")
    long lastInvoiceNum;

    @JsonProperty("last_purchase_num")
    long lastPurchaseNum;

    @JsonProperty("last_voucher_num")
    long lastVoucherNum;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static FiscalPeriodResponse from(FiscalPeriod period) {
        return FiscalPeriodResponse.builder()
            .id(period.getId())
            .tenantId(period.getTenantId())
            .name(period.getName())
            .startDate(period.getStartDate())
            .endDate(period.getEndDate())
            .startDateSecondary(period.getStartDateSecondary())
            .endDateSecondary(period.getEndDateSecondary())
            .current(period.isCurrent())
            .closed(period.isClosed())
            .closedAt(period.getClosedAt())
            .closedBy(period.getClosedBy())
            .invoicePrefix(period.getInvoicePrefix())
            .purchasePrefix(period.getPurchasePrefix())
            .voucherPrefix(period.getVoucherPrefix())
            .lastInvoiceNum(period.getLastInvoiceNum())
            .lastPurchaseNum(period.getLastPurchaseNum())
            .lastVoucherNum(period.getLastVoucherNum())
            .createdAt(period.getCreatedAt())
            .updatedAt(period.getUpdatedAt())
            .build();
    }
}
