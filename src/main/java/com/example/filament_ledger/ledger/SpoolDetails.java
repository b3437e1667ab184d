package com.example.filament_ledger.ledger;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Descriptive spool attributes for an edit. {@code null} leaves the current value in place.
 */
public record SpoolDetails(
        String brand,
        String material,
        String colorName,
        String colorHex,
        Double diameterMm,
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
