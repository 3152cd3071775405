package com.flagship.fiscal_ledger.account;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for accounts.
 *
 * No setters: code, type, tenant and parent are fixed at creation; only the
 * descriptive fields change through {@link #updateFromDomain(Account)}.
 */
@Entity
@Table(
    name = "accounts",
    uniqueConstraints = @UniqueConstraint(name = "uq_accounts_tenant_code", columnNames = {"tenant_id", "code"}),
    indexes = @Index(name = "idx_accounts_tenant", columnList = "tenant_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(nullable = false, updatable = false, length = 50)
    private String code;

    @Column(nullable = false, length = 200)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_type", nullable = false, updatable = false, length = 20)
    private AccountType type;

    @Column(name = "parent_id", updatable = false)
    private UUID parentId;

    @Column(name = "description")
    private String description;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static AccountEntity fromDomain(Account account) {
        return new AccountEntity(
            account.getId(),
            account.getTenantId(),
            account.getCode(),
            account.getName(),
            account.getType(),
            account.getParentId(),
            account.getDescription(),
            account.isActive(),
            null, // set by @PrePersist
            null
        );
    }

    public Account toDomain() {
        return new Account(id, tenantId, code, name, type, parentId, description, active, createdAt, updatedAt);
    }

    void updateFromDomain(Account account) {
        this.name = account.getName();
        this.description = account.getDescription();
        this.active = account.isActive();
    }
}
