package com.flagship.fiscal_ledger.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fiscal_ledger.journal.JournalEntry;
import com.flagship.fiscal_ledger.journal.JournalLine;
import com.flagship.fiscal_ledger.journal.JournalStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class JournalEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("tenant_id")
    UUID tenantId;

    @JsonProperty("fiscal_period_id")
    UUID fiscalPeriodId;

    @JsonProperty("transaction_date")
    LocalDate transactionDate;

    @JsonProperty("voucher_number")
    String voucherNumber;

    @JsonProperty("description")
    String description;

    @JsonProperty("reference_id")
    UUID referenceId;

    @JsonProperty("reference_type")
    String referenceType;

    @JsonProperty("status")
    JournalStatus status;

    @JsonProperty("total_debit")
    BigDecimal totalDebit;

    @JsonProperty("total_credit")
    BigDecimal totalCredit;

    @JsonProperty("lines")
    List<LineResponse> lines;

    @JsonProperty("created_by")
    UUID createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("posted_at")
    Instant postedAt;

    @JsonProperty("posted_by")
    UUID postedBy;

    @Value
    public static class LineResponse {
        @JsonProperty("line_number")
        int lineNumber;

        @JsonProperty("account_id")
        UUID accountId;

        @JsonProperty("debit")
        BigDecimal debit;

        @JsonProperty("credit")
        BigDecimal credit;

        @JsonProperty("description")
        String description;

        static LineResponse from(JournalLine line) {
            return new LineResponse(line.getLineNumber(), line.getAccountId(), line.getDebit(), line.getCredit(),
                line.getDescription());
        }
    }

    public static JournalEntryResponse from(JournalEntry entry) {
        return JournalEntryResponse.builder()
            .id(entry.getId())
            .tenantId(entry.getTenantId())
            .fiscalPeriodId(entry.getFiscalPeriodId())
            .transactionDate(entry.getTransactionDate())
            .voucherNumber(entry.getVoucherNumber())
            .description(entry.getDescription())
            .referenceId(entry.getReference() != null ? entry.getReference().getId() : null)
            .referenceType(entry.getReference() != null ? entry.getReference().getType().name() : null)
            .status(entry.getStatus())
            .totalDebit(entry.getTotalDebit())
            .totalCredit(entry.getTotalCredit())
            .lines(entry.getLines().stream().map(LineResponse::from).toList())
            .createdBy(entry.getCreatedBy())
            .createdAt(entry.getCreatedAt())
            .postedAt(entry.getPostedAt())
            .postedBy(entry.getPostedBy())
            .build();
    }
}
