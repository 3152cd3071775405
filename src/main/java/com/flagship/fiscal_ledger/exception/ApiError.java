package com.flagship.fiscal_ledger.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned for every rejected request. {@code kind} is absent
 * only for unexpected server errors.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    String error;
    ErrorKind kind;
    String message;
    Map<String, String> details;
    String correlationId;
    Instant timestamp;
}
