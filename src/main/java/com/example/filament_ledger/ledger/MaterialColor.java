package com.example.filament_ledger.ledger;

import java.util.Locale;

/**
 * Chart color bound to a material name. Material names compare case-insensitively.
 */
public record MaterialColor(String material, String colorHex) {

    public String key() {
        return keyOf(material);
    }

    public static String keyOf(String material) {
        return material == null ? "" : material.trim().toLowerCase(Locale.ROOT);
    }
}
