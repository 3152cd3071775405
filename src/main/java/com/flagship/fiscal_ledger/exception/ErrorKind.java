package com.flagship.fiscal_ledger.exception;

/**
 * Classification of business-rule failures.
 * Every {@link LedgerException} carries exactly one kind.
 */
public enum ErrorKind {
    /**
     * Malformed or out-of-range input: bad calendar date, unbalanced entry,
     * negative amount, transaction date outside the period.
     */
    VALIDATION,

    /**
     * The operation collides with existing state: duplicate code, double posting.
     */
    CONFLICT,

    /**
     * The operation is forbidden by the lifecycle state of the target.
     */
    STATE,

    /**
     * A referenced period, entry or account does not exist.
     */
    NOT_FOUND
}
