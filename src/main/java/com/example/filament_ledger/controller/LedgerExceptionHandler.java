package com.example.filament_ledger.controller;

import com.example.filament_ledger.dto.web.ErrorResponse;
import com.example.filament_ledger.ledger.LedgerError;
import com.example.filament_ledger.ledger.LedgerException;
import com.example.filament_ledger.service.transfer.ImportFailedException;
import com.example.filament_ledger.service.transfer.SchemaInvalidException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

/**
 * Maps ledger error codes to HTTP statuses with a uniform {@link ErrorResponse} body.
 */
@RestControllerAdvice
public class LedgerExceptionHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(LedgerExceptionHandler.class);

    @ExceptionHandler(SchemaInvalidException.class)
    public ResponseEntity<ErrorResponse> handleSchema(SchemaInvalidException ex) {
        ErrorResponse body = new ErrorResponse(ex.getError().name(), ex.getMessage(), ex.getViolations(), null, null);
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler(ImportFailedException.class)
    public ResponseEntity<ErrorResponse> handleImportFailed(ImportFailedException ex) {
        ErrorResponse body = new ErrorResponse(ex.getError().name(), ex.getMessage(), null, ex.getWritten(), ex.getTotal());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorResponse> handleLedger(LedgerException ex) {
        HttpStatus status = statusOf(ex.getError());
        if (status.is5xxServerError()) {
            LOGGER.error("Ledger operation failed code={}", ex.getError(), ex);
        }
        return ResponseEntity.status(status).body(ErrorResponse.of(ex.getError().name(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        List<String> violations = ex.getBindingResult().getAllErrors().stream()
                .map(e -> e instanceof FieldError fe
                        ? fe.getField() + ": " + fe.getDefaultMessage()
                        : e.getDefaultMessage())
                .toList();
        ErrorResponse body = new ErrorResponse(LedgerError.INVALID_INPUT.name(), "Request validation failed", violations, null, null);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception ex) {
        return ResponseEntity.badRequest().body(ErrorResponse.of(LedgerError.INVALID_INPUT.name(), "Malformed request: " + ex.getMessage()));
    }

    static HttpStatus statusOf(LedgerError error) {
        return switch (error) {
            case INVALID_INPUT, INVALID_AMOUNT -> HttpStatus.BAD_REQUEST;
            case UNKNOWN_SPOOL -> HttpStatus.NOT_FOUND;
            case SCHEMA_INVALID -> HttpStatus.UNPROCESSABLE_ENTITY;
            case WRITE_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
