package com.example.filament_ledger.ledger;

import java.util.Locale;
import java.util.Map;

/**
 * Conversions between filament length, mass and gross/net spool weight.
 *
 * <p>Length↔mass uses the cylinder volume of the filament strand:
 * {@code mass (g) = length (cm) * π * (diameter (mm) / 20)² (cm²) * density (g/cm³)}.
 */
public final class UnitConversion {
    public static final double DENSITY_PLA = 1.24;
    public static final double DENSITY_PETG = 1.27;
    public static final double DENSITY_ABS = 1.04;
    public static final double DENSITY_TPU = 1.20;

    private static final Map<String, Double> DENSITIES = Map.of(
            "PLA", DENSITY_PLA,
            "PETG", DENSITY_PETG,
            "ABS", DENSITY_ABS,
            "TPU", DENSITY_TPU
    );

    private UnitConversion() {
    }

    public static double lengthToMass(double lengthMeters, double diameterMm, double densityGPerCm3) {
        requirePositive(lengthMeters, "lengthMeters");
        requirePositive(diameterMm, "diameterMm");
        requirePositive(densityGPerCm3, "density");
        double lengthCm = lengthMeters * 100;
        return lengthCm * crossSectionCm2(diameterMm) * densityGPerCm3;
    }

    public static double massToLength(double massGrams, double diameterMm, double densityGPerCm3) {
        requirePositive(massGrams, "massGrams");
        requirePositive(diameterMm, "diameterMm");
        requirePositive(densityGPerCm3, "density");
        double lengthCm = massGrams / (crossSectionCm2(diameterMm) * densityGPerCm3);
        return lengthCm / 100;
    }

    /**
     * Net filament mass from a gross reading. A tare larger than the reading is operator error and
     * yields zero rather than a failure.
     */
    public static double netMass(double grossMass, double tareMass) {
        return Math.max(0, grossMass - tareMass);
    }

    /**
     * Density for a material name. Only PLA, PETG, ABS and TPU are tabulated; any other material is
     * approximated with the PLA density.
     */
    public static double densityForMaterial(String materialName) {
        if (materialName == null) {
            return DENSITY_PLA;
        }
        return DENSITIES.getOrDefault(materialName.trim().toUpperCase(Locale.ROOT), DENSITY_PLA);
    }

    /**
     * Grams consumed since the last known remaining mass, judged from a gross weigh-in.
     */
    public static double usedSinceWeighIn(double previousRemaining, double grossMass, double tareMass) {
        return Math.max(0, previousRemaining - netMass(grossMass, tareMass));
    }

    private static double crossSectionCm2(double diameterMm) {
        double radiusCm = diameterMm / 20;
        return Math.PI * radiusCm * radiusCm;
    }

    private static void requirePositive(double value, String name) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw LedgerException.invalidInput(name + " must be greater than zero, got " + value);
        }
    }
}
