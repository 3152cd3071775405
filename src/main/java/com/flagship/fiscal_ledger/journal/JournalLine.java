package com.flagship.fiscal_ledger.journal;

import com.flagship.fiscal_ledger.exception.ValidationException;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One side of a journal entry against a single account.
 * Missing amounts are stored as zero.
 */
@Value
public class JournalLine {

    static final int AMOUNT_SCALE = 4;

    UUID id;
    UUID entryId;
    int lineNumber;
    UUID accountId;
    BigDecimal debit;
    BigDecimal credit;
    String description;

    static JournalLine of(UUID entryId, int lineNumber, UUID accountId,
                          BigDecimal debit, BigDecimal credit, String description) {
        if (accountId == null) {
            throw new ValidationException("Line " + lineNumber + " has no account");
        }
        return new JournalLine(
            UUID.randomUUID(),
            entryId,
            lineNumber,
            accountId,
            normalize(debit, lineNumber),
            normalize(credit, lineNumber),
            description
        );
    }

    public boolean isZero() {
        return debit.signum() == 0 && credit.signum() == 0;
    }

    private static BigDecimal normalize(BigDecimal amount, int lineNumber) {
        if (amount == null) {
            return BigDecimal.ZERO.setScale(AMOUNT_SCALE);
        }
        if (amount.stripTrailingZeros().scale() > AMOUNT_SCALE) {
            throw new ValidationException(
                "Line " + lineNumber + " amount " + amount.toPlainString() + " has more than 4 decimal places");
        }
        return amount.setScale(AMOUNT_SCALE);
    }
}
