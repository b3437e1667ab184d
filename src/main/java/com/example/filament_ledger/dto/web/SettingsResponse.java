package com.example.filament_ledger.dto.web;

import com.example.filament_ledger.ledger.LedgerSettings;

public record SettingsResponse(double defaultDiameterMm, double lowStockThreshold, String currency, String language) {
    public static SettingsResponse from(LedgerSettings s) {
        return new SettingsResponse(s.defaultDiameterMm(), s.lowStockThreshold(), s.currency(), s.language().code());
    }
}
