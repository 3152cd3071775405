package com.flagship.fiscal_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fiscal_ledger.account.Account;
import com.flagship.fiscal_ledger.account.AccountType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("tenant_id")
    UUID tenantId;

    @JsonProperty("code")
    String code;

    @JsonProperty("name")
    String name;

    @JsonProperty("type")
    AccountType type;

    @JsonProperty("parent_id")
    UUID parentId;

    @JsonProperty("description")
    String description;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .id(account.getId())
            .tenantId(account.getTenantId())
            .code(account.getCode())
            .name(account.getName())
            .type(account.getType())
            .parentId(account.getParentId())
            .description(account.getDescription())
            .active(account.isActive())
            .createdAt(account.getCreatedAt())
            .build();
    }
}
