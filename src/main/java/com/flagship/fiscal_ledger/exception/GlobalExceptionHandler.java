package com.flagship.fiscal_ledger.exception;

import com.flagship.fiscal_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps ledger failures to HTTP responses.
 *
 * Each {@link ErrorKind} has a fixed status; the body always carries the
 * kind and a human-readable reason. Binding and parsing failures raised by
 * Spring MVC before a service is reached are reported as {@link ErrorKind#VALIDATION}.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ApiError> handleLedgerException(LedgerException e) {
        log.warn("Request rejected: kind={}, reason={}", e.getKind(), e.getMessage());
        return respond(statusFor(e.getKind()), titleFor(e.getKind()), e.getKind(), e.getMessage(), null);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return invalid("Missing Required Header", "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleBindingFailure(MethodArgumentNotValidException e) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(fieldError.getField(),
                fieldError.getDefaultMessage() != null ? fieldError.getDefaultMessage() : "Invalid value");
        }
        log.warn("Request body rejected on fields {}", fields.keySet());
        return invalid("Validation Failed", "Request validation failed", fields);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid parameter {}: {}", e.getName(), e.getValue());
        return invalid("Invalid Request", "Invalid value for parameter '" + e.getName() + "'", null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return invalid("Invalid Request", "Request body is missing or malformed", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", null,
            "An unexpected error occurred", null);
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case CONFLICT, STATE -> HttpStatus.CONFLICT;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
        };
    }

    private static String titleFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> "Invalid Request";
            case CONFLICT -> "Conflict";
            case STATE -> "Invalid State";
            case NOT_FOUND -> "Not Found";
        };
    }

    private static ResponseEntity<ApiError> invalid(String title, String message, Map<String, String> details) {
        return respond(HttpStatus.BAD_REQUEST, title, ErrorKind.VALIDATION, message, details);
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String title, ErrorKind kind,
                                                    String message, Map<String, String> details) {
        ApiError body = ApiError.builder()
            .error(title)
            .kind(kind)
            .message(message)
            .details(details)
            .correlationId(CorrelationContext.getCorrelationId())
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }
}
