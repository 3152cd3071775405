package com.flagship.fiscal_ledger.journal;

import com.flagship.fiscal_ledger.exception.ValidationException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A dated, balanced set of debit and credit lines inside one fiscal period.
 *
 * Invariants checked by {@link #validateBalance()}:
 * 1. At least two lines
 * 2. No negative amounts and no line without any amount
 * 3. Total debits equal total credits within {@link #BALANCE_TOLERANCE}
 *
 * Lines keep the order they were given in.
 */
@Value
public class JournalEntry {

    public static final BigDecimal BALANCE_TOLERANCE = new BigDecimal("0.0001");

    UUID id;
    UUID tenantId;
    UUID fiscalPeriodId;
    LocalDate transactionDate;
    String voucherNumber;
    String description;
    JournalReference reference;
    JournalStatus status;
    List<JournalLine> lines;
    UUID createdBy;
    Instant createdAt;
    Instant postedAt;
    UUID postedBy;

    /**
     * Builds a validated DRAFT entry from a request.
     *
     * @throws ValidationException if the lines do not form a balanced entry
     */
    public static JournalEntry draft(UUID tenantId, UUID createdBy, JournalEntryRequest request,
                                     String voucherNumber, Instant now) {
        UUID id = UUID.randomUUID();
        List<JournalLine> lines = new ArrayList<>();
        if (request.getLines() != null) {
            int lineNumber = 1;
            for (JournalEntryRequest.Line line : request.getLines()) {
                lines.add(JournalLine.of(id, lineNumber++, line.getAccountId(),
                    line.getDebit(), line.getCredit(), line.getDescription()));
            }
        }

        JournalEntry entry = new JournalEntry(
            id,
            tenantId,
            request.getFiscalPeriodId(),
            request.getTransactionDate(),
            voucherNumber,
            request.getDescription(),
            request.getReference(),
            JournalStatus.DRAFT,
            List.copyOf(lines),
            createdBy,
            now,
            null,
            null
        );
        entry.validateBalance();
        return entry;
    }

    public JournalEntry withVoucherNumber(String number) {
        return new JournalEntry(id, tenantId, fiscalPeriodId, transactionDate, number, description, reference,
            status, lines, createdBy, createdAt, postedAt, postedBy);
    }

    public void validateBalance() {
        if (lines == null || lines.size() < 2) {
            throw new ValidationException("Journal entry must have at least 2 lines");
        }
        for (JournalLine line : lines) {
            if (line.getDebit().signum() < 0 || line.getCredit().signum() < 0) {
                throw new ValidationException("Debit and credit amounts must be non-negative");
            }
            if (line.isZero()) {
                throw new ValidationException("Line " + line.getLineNumber() + " has neither a debit nor a credit");
            }
        }

        BigDecimal debits = getTotalDebit();
        BigDecimal credits = getTotalCredit();
        if (debits.subtract(credits).abs().compareTo(BALANCE_TOLERANCE) > 0) {
            throw new ValidationException(String.format(
                "Journal entry is unbalanced: debits=%s, credits=%s",
                debits.toPlainString(), credits.toPlainString()));
        }
    }

    public BigDecimal getTotalDebit() {
        return lines.stream().map(JournalLine::getDebit).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getTotalCredit() {
        return lines.stream().map(JournalLine::getCredit).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean isPosted() {
        return status == JournalStatus.POSTED;
    }
}
