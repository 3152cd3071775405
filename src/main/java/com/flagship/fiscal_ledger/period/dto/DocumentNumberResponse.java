package com.flagship.fiscal_ledger.period.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.fiscal_ledger.period.DocumentType;
import lombok.Value;

import java.util.UUID;

@Value
public class DocumentNumberResponse {

    @JsonProperty("period_id")
    UUID periodId;

    @JsonProperty("document_type")
    DocumentType documentType;

    @JsonProperty("number")
    String number;
}
