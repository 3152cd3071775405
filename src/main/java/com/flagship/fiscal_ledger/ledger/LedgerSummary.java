package com.flagship.fiscal_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fiscal_ledger.account.AccountType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Totals over a ledger projection.
 *
 * {@code closingBalance} keeps the projection's debit-minus-credit sign;
 * {@code naturalBalance} flips it for credit-normal accounts so a healthy
 * liability or revenue account reads positive.
 */
@Value
public class LedgerSummary {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("account_type")
    AccountType accountType;

    @JsonProperty("from")
    LocalDate from;

    @JsonProperty("to")
    LocalDate to;

    @JsonProperty("entry_count")
    int entryCount;

    @JsonProperty("total_debit")
    BigDecimal totalDebit;

    @JsonProperty("total_credit")
    BigDecimal totalCredit;

    @JsonProperty("closing_balance")
    BigDecimal closingBalance;

    @JsonProperty("natural_balance")
    BigDecimal naturalBalance;

    static LedgerSummary of(UUID accountId, AccountType type, LocalDate from, LocalDate to,
                            List<LedgerEntry> entries) {
        BigDecimal debit = BigDecimal.ZERO;
        BigDecimal credit = BigDecimal.ZERO;
        for (LedgerEntry entry : entries) {
            debit = debit.add(entry.getDebit());
            credit = credit.add(entry.getCredit());
        }
        BigDecimal closing = debit.subtract(credit);
        return new LedgerSummary(accountId, type, from, to, entries.size(), debit, credit, closing,
            type.isDebitNormal() ? closing : closing.negate());
    }
}
