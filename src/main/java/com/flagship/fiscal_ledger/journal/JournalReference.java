package com.flagship.fiscal_ledger.journal;

import com.flagship.fiscal_ledger.exception.ValidationException;
import lombok.Value;

import java.util.UUID;

/**
 * Link from a journal entry to the business document that caused it.
 */
@Value
public class JournalReference {
    UUID id;
    Type type;

    public enum Type {
        INVOICE,
        PURCHASE,
        PAYMENT,
        MANUAL
    }

    /**
     * Null when neither part is given; both parts are required otherwise.
     */
    public static JournalReference ofNullable(UUID id, Type type) {
        if (id == null && type == null) {
            return null;
        }
        if (id == null || type == null) {
            throw new ValidationException("Reference requires both id and type");
        }
        return new JournalReference(id, type);
    }
}
