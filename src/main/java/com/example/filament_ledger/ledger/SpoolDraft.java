package com.example.filament_ledger.ledger;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Input for creating a spool. {@code diameterMm} and {@code acquiredAt} fall back to the settings
 * default and the current time when {@code null}.
 */
public record SpoolDraft(
        String brand,
        String material,
        String colorName,
        String colorHex,
        Double diameterMm,
        double initialMassGrams,
        Double tareMassGrams,
        Double densityOverride,
        Integer minTempC,
        Integer maxTempC,
        Integer bedTempC,
        BigDecimal price,
        Instant acquiredAt,
        String notes
) {
}
