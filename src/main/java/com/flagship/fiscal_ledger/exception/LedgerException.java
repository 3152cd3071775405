package com.flagship.fiscal_ledger.exception;

import lombok.Getter;

/**
 * Base type for business-rule violations raised by the ledger core.
 *
 * These are never retried: they describe a request that cannot succeed
 * against the current state, not a transient infrastructure failure.
 */
@Getter
public abstract class LedgerException extends RuntimeException {

    private final ErrorKind kind;

    protected LedgerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected LedgerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
