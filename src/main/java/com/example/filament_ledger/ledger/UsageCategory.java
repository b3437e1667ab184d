package com.example.filament_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum UsageCategory {
    PRINT("print"),
    FAILED_PRINT("failed_print"),
    CALIBRATION("calibration"),
    MANUAL_ADJUSTMENT("manual_adjustment");

    private final String wireValue;

    UsageCategory(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Resolves the textual form used in exports and the database. Unknown or missing values map to
     * {@link #PRINT}, matching what the mobile app writes for legacy records.
     */
    @JsonCreator
    public static UsageCategory fromWire(String value) {
        if (value == null) {
            return PRINT;
        }
        return Arrays.stream(values())
                .filter(c -> c.wireValue.equalsIgnoreCase(value.trim()) || c.name().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElse(PRINT);
    }
}
