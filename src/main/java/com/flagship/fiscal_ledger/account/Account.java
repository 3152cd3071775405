package com.flagship.fiscal_ledger.account;

import com.flagship.fiscal_ledger.exception.ValidationException;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger account. Codes are unique per tenant.
 */
@Value
public class Account {
    UUID id;
    UUID tenantId;
    String code;
    String name;
    AccountType type;
    UUID parentId;
    String description;
    boolean active;
    Instant createdAt;
    Instant updatedAt;

    public static Account create(UUID tenantId, String code, String name, AccountType type,
                                 UUID parentId, String description) {
        if (tenantId == null) {
            throw new ValidationException("Tenant is required");
        }
        if (code == null || code.isBlank()) {
            throw new ValidationException("Account code is required");
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException("Account name is required");
        }
        if (type == null) {
            throw new ValidationException("Account type is required");
        }
        return new Account(UUID.randomUUID(), tenantId, code.trim(), name.trim(), type, parentId,
            description, true, null, null);
    }

    public Account withDetails(String newName, String newDescription, boolean newActive) {
        if (newName == null || newName.isBlank()) {
            throw new ValidationException("Account name is required");
        }
        return new Account(id, tenantId, code, newName.trim(), type, parentId, newDescription, newActive,
            createdAt, updatedAt);
    }
}
