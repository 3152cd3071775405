package com.flagship.fiscal_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One posted journal line as seen from its account, with the balance after it.
 */
@Value
public class LedgerEntry {

    @JsonProperty("line_id")
    UUID lineId;

    @JsonProperty("journal_entry_id")
    UUID journalEntryId;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("transaction_date")
    LocalDate transactionDate;

    @JsonProperty("voucher_number")
    String voucherNumber;

    @JsonProperty("description")
    String description;

    @JsonProperty("line_description")
    String lineDescription;

    @JsonProperty("debit")
    BigDecimal debit;

    @JsonProperty("credit")
    BigDecimal credit;

    @JsonProperty("running_balance")
    BigDecimal runningBalance;

    LedgerEntry withRunningBalance(BigDecimal balance) {
        return new LedgerEntry(lineId, journalEntryId, accountId, transactionDate, voucherNumber, description,
            lineDescription, debit, credit, balance);
    }
}
