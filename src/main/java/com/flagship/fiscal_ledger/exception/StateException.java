package com.flagship.fiscal_ledger.exception;

/**
 * Raised when the lifecycle state of a fiscal period or journal entry
 * forbids the requested operation.
 */
public class StateException extends LedgerException {

    public StateException(String message) {
        super(ErrorKind.STATE, message);
    }
}
