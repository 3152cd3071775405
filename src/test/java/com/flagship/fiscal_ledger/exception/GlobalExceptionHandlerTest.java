package com.flagship.fiscal_ledger.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("Each error kind maps to a fixed status")
    void statusMapping() {
        assertEquals(HttpStatus.BAD_REQUEST, GlobalExceptionHandler.statusFor(ErrorKind.VALIDATION));
        assertEquals(HttpStatus.CONFLICT, GlobalExceptionHandler.statusFor(ErrorKind.CONFLICT));
        assertEquals(HttpStatus.CONFLICT, GlobalExceptionHandler.statusFor(ErrorKind.STATE));
        assertEquals(HttpStatus.NOT_FOUND, GlobalExceptionHandler.statusFor(ErrorKind.NOT_FOUND));
    }

    @Test
    @DisplayName("Body carries the kind and the reason")
    void body() {
        UUID periodId = UUID.randomUUID();

        ResponseEntity<ApiError> response = handler.handleLedgerException(NotFoundException.of("Fiscal period", periodId));

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertNotNull(response.getBody());
        assertEquals(ErrorKind.NOT_FOUND, response.getBody().getKind());
        assertTrue(response.getBody().getMessage().contains(periodId.toString()));
        assertNotNull(response.getBody().getTimestamp());
    }

    @Test
    @DisplayName("State errors are distinguishable from conflicts by kind")
    void stateVersusConflict() {
        ResponseEntity<ApiError> state = handler.handleLedgerException(new StateException("closed"));
        ResponseEntity<ApiError> conflict = handler.handleLedgerException(new ConflictException("posted"));

        assertEquals(state.getStatusCode(), conflict.getStatusCode());
        assertEquals(ErrorKind.STATE, state.getBody().getKind());
        assertEquals(ErrorKind.CONFLICT, conflict.getBody().getKind());
    }
}
