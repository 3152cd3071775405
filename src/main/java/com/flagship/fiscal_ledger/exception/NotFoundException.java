package com.flagship.fiscal_ledger.exception;

import java.util.UUID;

public class NotFoundException extends LedgerException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public static NotFoundException of(String what, UUID id) {
        return new NotFoundException(what + " not found: " + id);
    }
}
