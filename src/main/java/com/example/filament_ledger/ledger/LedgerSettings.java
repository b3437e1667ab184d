package com.example.filament_ledger.ledger;

/**
 * The single user settings record, passed explicitly to whatever needs it.
 */
public record LedgerSettings(
        double defaultDiameterMm,
        double lowStockThreshold,
        String currency,
        Language language
) {
}
