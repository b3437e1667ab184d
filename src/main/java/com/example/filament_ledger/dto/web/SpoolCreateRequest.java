package com.example.filament_ledger.dto.web;

import com.example.filament_ledger.ledger.SpoolDraft;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.Instant;

public record SpoolCreateRequest(
        @Size(max = 120) String brand,
        @Size(max = 60) String material,
        @Size(max = 120) String colorName,
        String colorHex,
        Double diameterMm,
        @NotNull @Positive Double initialMassGrams,
        @PositiveOrZero Double tareMassGrams,
        @Positive Double densityOverride,
        Integer minTempC,
        Integer maxTempC,
        Integer bedTempC,
        @PositiveOrZero @Digits(integer = 15, fraction = 4) BigDecimal price,
        Instant acquiredAt,
        @Size(max = 2000) String notes
) {
    public SpoolDraft toDraft() {
        return new SpoolDraft(brand, material, colorName, colorHex, diameterMm, initialMassGrams, tareMassGrams,
                densityOverride, minTempC, maxTempC, bedTempC, price, acquiredAt, notes);
    }
}
