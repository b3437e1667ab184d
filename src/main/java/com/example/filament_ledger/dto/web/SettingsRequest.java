package com.example.filament_ledger.dto.web;

import com.example.filament_ledger.ledger.Language;
import com.example.filament_ledger.ledger.LedgerSettings;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record SettingsRequest(
        @NotNull Double defaultDiameterMm,
        @NotNull @DecimalMin("0") @DecimalMax("100") Double lowStockThreshold,
        @NotBlank @Size(max = 8) String currency,
        String language
) {
    public LedgerSettings toSettings() {
        return new LedgerSettings(defaultDiameterMm, lowStockThreshold, currency.trim(), Language.fromCode(language));
    }
}
