package com.example.filament_ledger.service.recognition;

/**
 * Pre-filled values for a new spool. Never written to the ledger directly; the user confirms them
 * through the normal create call.
 */
public record SpoolSuggestion(
        String brand,
        String material,
        String colorName,
        String colorHex,
        Double initialMassGrams,
        Double diameterMm,
        String notes,
        Double confidence
) {

    public static SpoolSuggestion none() {
        return new SpoolSuggestion(null, null, null, null, null, null, null, null);
    }

    public boolean hasAnyData() {
        return brand != null || material != null || colorName != null || colorHex != null
                || initialMassGrams != null || diameterMm != null || notes != null;
    }
}
