package com.example.filament_ledger.ledger;

/**
 * Failure categories reported by ledger operations.
 */
public enum LedgerError {
    /** Non-positive or out-of-range numeric argument. */
    INVALID_INPUT,
    /** Usage or stock revision that would violate the mass invariant. */
    INVALID_AMOUNT,
    /** Reference to a spool identity that does not exist. */
    UNKNOWN_SPOOL,
    /** Import document failed structural validation. */
    SCHEMA_INVALID,
    /** The persistence collaborator reported an error mid-operation. */
    WRITE_FAILED
}
