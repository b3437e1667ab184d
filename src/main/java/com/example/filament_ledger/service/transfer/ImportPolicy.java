package com.example.filament_ledger.service.transfer;

import com.example.filament_ledger.ledger.LedgerException;

import java.util.Locale;

public enum ImportPolicy {
    /** Keep existing data, add only unseen entities. */
    MERGE,
    /** Discard existing spools and colors, adopt the document wholesale. */
    REPLACE;

    public static ImportPolicy fromValue(String value) {
        if (value == null || value.isBlank()) {
            return MERGE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw LedgerException.invalidInput("Unknown import policy '" + value + "', expected merge or replace");
        }
    }
}
