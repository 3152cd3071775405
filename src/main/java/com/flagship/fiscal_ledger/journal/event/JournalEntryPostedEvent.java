package com.flagship.fiscal_ledger.journal.event;

import com.flagship.fiscal_ledger.journal.JournalEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Published when a journal entry is posted and becomes visible in the ledger.
 */
@Value
public class JournalEntryPostedEvent {
    UUID eventId;
    UUID entryId;
    UUID tenantId;
    UUID fiscalPeriodId;
    String voucherNumber;
    LocalDate transactionDate;
    BigDecimal totalAmount;
    int lineCount;
    UUID postedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JournalEntryPosted";

    public static JournalEntryPostedEvent from(JournalEntry entry) {
        return new JournalEntryPostedEvent(
            UUID.randomUUID(),
            entry.getId(),
            entry.getTenantId(),
            entry.getFiscalPeriodId(),
            entry.getVoucherNumber(),
            entry.getTransactionDate(),
            entry.getTotalDebit(),
            entry.getLines().size(),
            entry.getPostedBy(),
            entry.getPostedAt()
        );
    }
}
