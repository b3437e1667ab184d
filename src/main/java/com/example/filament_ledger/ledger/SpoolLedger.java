package com.example.filament_ledger.ledger;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Quantity transitions for a single spool.
 *
 * <p>Every method is a pure function of its arguments: it either returns a new {@link Spool} that
 * satisfies {@code 0 <= remaining <= initial}, or throws {@link LedgerException} and the caller's
 * snapshot stays as it was. Persisting the result is the caller's job.
 */
@Component
public class SpoolLedger {
    public static final List<Double> STANDARD_DIAMETERS_MM = List.of(1.75, 2.85, 3.0);
    private static final double DIAMETER_TOLERANCE = 1e-6;

    private final Clock clock;
    private final IdGenerator idGenerator;

    public SpoolLedger(Clock clock, IdGenerator idGenerator) {
        this.clock = clock;
        this.idGenerator = idGenerator;
    }

    /**
     * Creates a fresh, full, active spool with a new identity.
     *
     * @param draft    user input
     * @param settings supplies the default diameter
     * @return spool with {@code remaining == initial}
     * @throws LedgerException INVALID_INPUT when the initial mass is not positive or the diameter is
     *                         not a standard one
     */
    public Spool create(SpoolDraft draft, LedgerSettings settings) {
        if (draft == null) {
            throw LedgerException.invalidInput("Spool details are required");
        }
        if (!(draft.initialMassGrams() > 0)) {
            throw LedgerException.invalidInput("Initial mass must be greater than zero, got " + draft.initialMassGrams());
        }
        double diameter = draft.diameterMm() != null ? draft.diameterMm() : settings.defaultDiameterMm();
        if (!isStandardDiameter(diameter)) {
            throw LedgerException.invalidInput("Diameter " + diameter + " mm is not one of " + STANDARD_DIAMETERS_MM);
        }
        validateOptionalMasses(draft.tareMassGrams(), draft.densityOverride());
        String colorHex = draft.colorHex() == null ? HexColor.DEFAULT_SPOOL_COLOR : HexColor.normalize(draft.colorHex());
        if (colorHex == null) {
            throw LedgerException.invalidInput("Color must be a 6-digit hex value, got " + draft.colorHex());
        }
        return new Spool(
                idGenerator.next(),
                trimToEmpty(draft.brand()),
                trimToEmpty(draft.material()),
                trimToEmpty(draft.colorName()),
                colorHex,
                diameter,
                draft.initialMassGrams(),
                draft.initialMassGrams(),
                draft.tareMassGrams(),
                draft.densityOverride(),
                draft.minTempC(),
                draft.maxTempC(),
                draft.bedTempC(),
                draft.price(),
                draft.acquiredAt() != null ? draft.acquiredAt() : clock.instant(),
                false,
                blankToNull(draft.notes()));
    }

    /**
     * Subtracts consumed filament. Reaching zero archives the spool in the same transition.
     */
    public Spool applyConsumption(Spool spool, double massGrams) {
        if (!(massGrams > 0)) {
            throw LedgerException.invalidAmount("Consumed mass must be greater than zero, got " + massGrams);
        }
        double remaining = Math.max(0, spool.remainingMassGrams() - massGrams);
        boolean archived = remaining == 0 || spool.archived();
        return spool.withQuantities(spool.initialMassGrams(), remaining, archived);
    }

    /**
     * Restates the initial stock while keeping the amount already consumed. A restatement that leaves
     * nothing archives the spool.
     */
    public Spool reviseStock(Spool spool, double newInitialMass) {
        if (!(newInitialMass > 0)) {
            throw LedgerException.invalidAmount("Initial mass must be greater than zero, got " + newInitialMass);
        }
        double consumedSoFar = spool.initialMassGrams() - spool.remainingMassGrams();
        double remaining = Math.min(Math.max(0, newInitialMass - consumedSoFar), newInitialMass);
        boolean archived = remaining == 0 || spool.archived();
        return spool.withQuantities(newInitialMass, remaining, archived);
    }

    /**
     * Manual correction of the remaining mass, e.g. after weighing. Zero archives the spool.
     */
    public Spool correctRemaining(Spool spool, double newRemaining) {
        if (newRemaining < 0 || newRemaining > spool.initialMassGrams() || Double.isNaN(newRemaining)) {
            throw LedgerException.invalidAmount("Remaining mass must be between 0 and "
                    + spool.initialMassGrams() + " g, got " + newRemaining);
        }
        boolean archived = newRemaining == 0 || spool.archived();
        return spool.withQuantities(spool.initialMassGrams(), newRemaining, archived);
    }

    public Spool archive(Spool spool) {
        return spool.withQuantities(spool.initialMassGrams(), spool.remainingMassGrams(), true);
    }

    public Spool restore(Spool spool) {
        return spool.withQuantities(spool.initialMassGrams(), spool.remainingMassGrams(), false);
    }

    /**
     * Applies descriptive edits. Quantities are not touched here; see {@link #reviseStock}.
     */
    public Spool edit(Spool spool, SpoolDetails details) {
        if (details.diameterMm() != null && !isStandardDiameter(details.diameterMm())) {
            throw LedgerException.invalidInput("Diameter " + details.diameterMm() + " mm is not one of " + STANDARD_DIAMETERS_MM);
        }
        validateOptionalMasses(details.tareMassGrams(), details.densityOverride());
        SpoolDetails normalized = details;
        if (details.colorHex() != null) {
            String hex = HexColor.normalize(details.colorHex());
            if (hex == null) {
                throw LedgerException.invalidInput("Color must be a 6-digit hex value, got " + details.colorHex());
            }
            normalized = new SpoolDetails(details.brand(), details.material(), details.colorName(), hex,
                    details.diameterMm(), details.tareMassGrams(), details.densityOverride(), details.minTempC(),
                    details.maxTempC(), details.bedTempC(), details.price(), details.acquiredAt(), details.notes());
        }
        return spool.withDetails(normalized);
    }

    /**
     * Checks a spool that arrives with its identity and quantities already set (import). Returns the
     * same snapshot when it satisfies the creation precondition.
     */
    public Spool admit(Spool spool) {
        if (spool.id() == null) {
            throw LedgerException.invalidInput("Spool identity is missing");
        }
        if (!(spool.initialMassGrams() > 0)) {
            throw LedgerException.invalidInput("Spool " + spool.id() + ": initial mass must be greater than zero");
        }
        if (spool.remainingMassGrams() < 0 || spool.remainingMassGrams() > spool.initialMassGrams()) {
            throw LedgerException.invalidAmount("Spool " + spool.id() + ": remaining mass "
                    + spool.remainingMassGrams() + " is outside [0, " + spool.initialMassGrams() + "]");
        }
        if (!(spool.diameterMm() > 0)) {
            throw LedgerException.invalidInput("Spool " + spool.id() + ": diameter must be greater than zero");
        }
        return spool;
    }

    public static boolean isStandardDiameter(double diameterMm) {
        return STANDARD_DIAMETERS_MM.stream().anyMatch(d -> Math.abs(d - diameterMm) < DIAMETER_TOLERANCE);
    }

    private static void validateOptionalMasses(Double tare, Double density) {
        if (tare != null && tare < 0) {
            throw LedgerException.invalidInput("Tare mass cannot be negative, got " + tare);
        }
        if (density != null && !(density > 0)) {
            throw LedgerException.invalidInput("Density must be greater than zero, got " + density);
        }
    }

    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
