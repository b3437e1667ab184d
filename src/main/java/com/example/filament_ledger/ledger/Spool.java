package com.example.filament_ledger.ledger;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable snapshot of a filament spool. State changes go through {@link SpoolLedger}, which
 * returns new snapshots.
 *
 * @param id                 stable identity, also the import merge key
 * @param brand              free text, may be empty
 * @param material           material type as entered, e.g. {@code PLA}
 * @param colorName          display name of the filament color
 * @param colorHex           {@code #RRGGBB}
 * @param diameterMm         nominal strand diameter
 * @param initialMassGrams   net mass when the spool was stocked
 * @param remainingMassGrams net mass left, always within {@code [0, initialMassGrams]}
 * @param tareMassGrams      empty reel mass, {@code null} when unknown
 * @param densityOverride    g/cm³ overriding the material table, {@code null} when unset
 * @param price              purchase price, exact decimal
 * @param acquiredAt         purchase instant
 * @param archived           hidden from the active inventory
 */
public record Spool(
        UUID id,
        String brand,
        String material,
        String colorName,
        String colorHex,
        double diameterMm,
        double initialMassGrams,
        double remainingMassGrams,
        Double tareMassGrams,
        Double densityOverride,
        Integer minTempC,
        Integer maxTempC,
        Integer bedTempC,
        BigDecimal price,
        Instant acquiredAt,
        boolean archived,
        String notes
) {

    public double consumedMassGrams() {
        return initialMassGrams - remainingMassGrams;
    }

    /**
     * Remaining mass as a percentage of the initial mass; 0 when the initial mass is not positive.
     */
    public double remainingPercentage() {
        if (initialMassGrams <= 0) {
            return 0;
        }
        return remainingMassGrams / initialMassGrams * 100;
    }

    public boolean isLowStock(double lowStockThresholdPercent) {
        return remainingPercentage() < lowStockThresholdPercent;
    }

    public double effectiveDensity() {
        if (densityOverride != null && densityOverride > 0) {
            return densityOverride;
        }
        return UnitConversion.densityForMaterial(material);
    }

    public double remainingLengthMeters() {
        if (remainingMassGrams <= 0) {
            return 0;
        }
        return UnitConversion.massToLength(remainingMassGrams, diameterMm, effectiveDensity());
    }

    public long daysSinceAcquired(Clock clock) {
        if (acquiredAt == null) {
            return 0;
        }
        return Math.max(0, Duration.between(acquiredAt, clock.instant()).toDays());
    }

    Spool withQuantities(double initial, double remaining, boolean archivedFlag) {
        return new Spool(id, brand, material, colorName, colorHex, diameterMm, initial, remaining,
                tareMassGrams, densityOverride, minTempC, maxTempC, bedTempC, price, acquiredAt, archivedFlag, notes);
    }

    /**
     * Copy with the descriptive attributes replaced. Quantities, identity and archival are kept.
     */
    public Spool withDetails(SpoolDetails details) {
        return new Spool(id,
                details.brand() != null ? details.brand() : brand,
                details.material() != null ? details.material() : material,
                details.colorName() != null ? details.colorName() : colorName,
                details.colorHex() != null ? details.colorHex() : colorHex,
                details.diameterMm() != null ? details.diameterMm() : diameterMm,
                initialMassGrams,
                remainingMassGrams,
                details.tareMassGrams() != null ? details.tareMassGrams() : tareMassGrams,
                details.densityOverride() != null ? details.densityOverride() : densityOverride,
                details.minTempC() != null ? details.minTempC() : minTempC,
                details.maxTempC() != null ? details.maxTempC() : maxTempC,
                details.bedTempC() != null ? details.bedTempC() : bedTempC,
                details.price() != null ? details.price() : price,
                details.acquiredAt() != null ? details.acquiredAt() : acquiredAt,
                archived,
                details.notes() != null ? details.notes() : notes);
    }
}
