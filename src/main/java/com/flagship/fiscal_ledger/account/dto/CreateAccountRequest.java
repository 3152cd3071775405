package com.flagship.fiscal_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fiscal_ledger.account.AccountType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

@Value
public class CreateAccountRequest {

    @NotBlank(message = "Code is required")
    @Size(max = 50, message = "Code must be at most 50 characters")
    @JsonProperty("code")
    String code;

    @NotBlank(message = "Name is required")
    @Size(max = 200, message = "Name must be at most 200 characters")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Type is required")
    @JsonProperty("type")
    AccountType type;

    @JsonProperty("parent_id")
    UUID parentId;

    @JsonProperty("description")
    String description;
}
