package com.flagship.fiscal_ledger.journal;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Input for creating a draft journal entry.
 */
@Value
@Builder
public class JournalEntryRequest {
    UUID fiscalPeriodId;
    LocalDate transactionDate;
    String description;
    JournalReference reference;
    boolean assignVoucherNumber;
    @Singular
    List<Line> lines;

    @Value
    public static class Line {
        UUID accountId;
        BigDecimal debit;
        BigDecimal credit;
        String description;

        public static Line debit(UUID accountId, BigDecimal amount) {
            return new Line(accountId, amount, BigDecimal.ZERO, null);
        }

        public static Line credit(UUID accountId, BigDecimal amount) {
            return new Line(accountId, BigDecimal.ZERO, amount, null);
        }
    }
}
