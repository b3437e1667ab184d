package com.example.filament_ledger.service.transfer;

import com.example.filament_ledger.ledger.LedgerError;
import com.example.filament_ledger.ledger.LedgerException;

import java.util.List;

/**
 * Import document rejected before any write.
 */
public class SchemaInvalidException extends LedgerException {
    private final List<String> violations;

    public SchemaInvalidException(List<String> violations) {
        super(LedgerError.SCHEMA_INVALID, "Import document is invalid: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public SchemaInvalidException(String violation, Throwable cause) {
        super(LedgerError.SCHEMA_INVALID, "Import document is invalid: " + violation, cause);
        this.violations = List.of(violation);
    }

    public List<String> getViolations() {
        return violations;
    }
}
