package com.flagship.fiscal_ledger.period.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

@Value
public class CreatePeriodFromNameRequest {

    @NotBlank(message = "Name is required")
    @Pattern(regexp = "^\\d{4}/\\d{2}$", message = "Name must look like YYYY/YY")
    @JsonProperty("name")
    String name;

    @JsonCreator
    public CreatePeriodFromNameRequest(@JsonProperty("name") String name) {
        this.name = name;
    }
}
