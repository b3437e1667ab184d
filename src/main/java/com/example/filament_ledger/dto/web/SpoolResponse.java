package com.example.filament_ledger.dto.web;

import com.example.filament_ledger.ledger.Spool;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

public record SpoolResponse(
        UUID id,
        String brand,
        String material,
        String colorName,
        String colorHex,
        double diameterMm,
        double initialMassGrams,
        double remainingMassGrams,
        double consumedMassGrams,
        double remainingPercentage,
        double remainingLengthMeters,
        boolean lowStock,
        Double tareMassGrams,
        Double densityOverride,
        Integer minTempC,
        Integer maxTempC,
        Integer bedTempC,
        BigDecimal price,
        Instant acquiredAt,
        long daysSinceAcquired,
        boolean archived,
        String notes
) {
    public static SpoolResponse from(Spool s, double lowStockThreshold, Clock clock) {
        return new SpoolResponse(
                s.id(),
                s.brand(),
                s.material(),
                s.colorName(),
                s.colorHex(),
                s.diameterMm(),
                s.initialMassGrams(),
                s.remainingMassGrams(),
                s.consumedMassGrams(),
                s.remainingPercentage(),
                s.remainingLengthMeters(),
                s.isLowStock(lowStockThreshold),
                s.tareMassGrams(),
                s.densityOverride(),
                s.minTempC(),
                s.maxTempC(),
                s.bedTempC(),
                s.price(),
                s.acquiredAt(),
                s.daysSinceAcquired(clock),
                s.archived(),
                s.notes()
        );
    }
}
