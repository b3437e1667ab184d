package com.example.filament_ledger.dto.web;

import com.example.filament_ledger.ledger.SpoolDetails;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Partial update; absent fields keep their value. {@code initialMassGrams} restates the stock and
 * keeps what was already consumed.
 */
public record SpoolUpdateRequest(
        @Size(max = 120) String brand,
        @Size(max = 60) String material,
        @Size(max = 120) String colorName,
        String colorHex,
        Double diameterMm,
        @Positive Double initialMassGrams,
        @PositiveOrZero Double tareMassGrams,
        @Positive Double densityOverride,
        Integer minTempC,
        Integer maxTempC,
        Integer bedTempC,
        @PositiveOrZero @Digits(integer = 15, fraction = 4) BigDecimal price,
        Instant acquiredAt,
        @Size(max = 2000) String notes
) {
    public SpoolDetails toDetails() {
        return new SpoolDetails(brand, material, colorName, colorHex, diameterMm, tareMassGrams, densityOverride,
                minTempC, maxTempC, bedTempC, price, acquiredAt, notes);
    }
}
