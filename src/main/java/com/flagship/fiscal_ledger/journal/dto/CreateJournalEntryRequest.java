package com.flagship.fiscal_ledger.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fiscal_ledger.journal.JournalEntryRequest;
import com.flagship.fiscal_ledger.journal.JournalReference;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Request body for creating a draft journal entry. Balance is checked by the
 * service, not here.
 */
@Value
public class CreateJournalEntryRequest {

    @NotNull(message = "Fiscal period ID is required")
    @JsonProperty("fiscal_period_id")
    UUID fiscalPeriodId;

    @NotNull(message = "Transaction date is required")
    @JsonProperty("transaction_date")
    LocalDate transactionDate;

    @JsonProperty("description")
    String description;

    @JsonProperty("reference_id")
    UUID referenceId;

    @JsonProperty("reference_type")
    JournalReference.Type referenceType;

    @JsonProperty("assign_voucher_number")
    boolean assignVoucherNumber;

    @NotEmpty(message = "At least one line is required")
    @Valid
    @JsonProperty("lines")
    List<LineRequest> lines;

    @Value
    public static class LineRequest {

        @NotNull(message = "Account ID is required")
        @JsonProperty("account_id")
        UUID accountId;

        @DecimalMin(value = "0", message = "Debit must not be negative")
        @JsonProperty("debit")
        BigDecimal debit;

        @DecimalMin(value = "0", message = "Credit must not be negative")
        @JsonProperty("credit")
        BigDecimal credit;

        @JsonProperty("description")
        String description;
    }

    public JournalEntryRequest toDomain() {
        return JournalEntryRequest.builder()
            .fiscalPeriodId(fiscalPeriodId)
            .transactionDate(transactionDate)
            .description(description)
            .reference(JournalReference.ofNullable(referenceId, referenceType))
            .assignVoucherNumber(assignVoucherNumber)
            .lines(lines.stream()
                .map(l -> new JournalEntryRequest.Line(l.getAccountId(), l.getDebit(), l.getCredit(), l.getDescription()))
                .toList())
            .build();
    }
}
