package com.example.filament_ledger.ledger;

import java.util.UUID;

/**
 * Rejection of a ledger operation. The message is the human-readable reason shown to the user.
 */
public class LedgerException extends RuntimeException {
    private final LedgerError error;

    public LedgerException(LedgerError error, String message) {
        super(message);
        this.error = error;
    }

    public LedgerException(LedgerError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public LedgerError getError() {
        return error;
    }

    public static LedgerException invalidInput(String message) {
        return new LedgerException(LedgerError.INVALID_INPUT, message);
    }

    public static LedgerException invalidAmount(String message) {
        return new LedgerException(LedgerError.INVALID_AMOUNT, message);
    }

    public static LedgerException unknownSpool(UUID spoolId) {
        return new LedgerException(LedgerError.UNKNOWN_SPOOL, "No spool with id " + spoolId);
    }
}
