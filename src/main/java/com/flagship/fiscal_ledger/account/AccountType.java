package com.flagship.fiscal_ledger.account;

/**
 * Chart-of-accounts classification.
 */
public enum AccountType {
    ASSET(true),
    LIABILITY(false),
    EQUITY(false),
    REVENUE(false),
    EXPENSE(true);

    private final boolean debitNormal;

    AccountType(boolean debitNormal) {
        this.debitNormal = debitNormal;
    }

    /**
     * True when debits increase the account (assets and expenses).
     */
    public boolean isDebitNormal() {
        return debitNormal;
    }
}
