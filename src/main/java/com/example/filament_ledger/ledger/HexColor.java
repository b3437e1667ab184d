package com.example.filament_ledger.ledger;

import java.util.Locale;
import java.util.regex.Pattern;

public final class HexColor {
    public static final String DEFAULT_SPOOL_COLOR = "#CCCCCC";

    private static final Pattern HEX = Pattern.compile("^#?[0-9A-Fa-f]{6}$");

    private HexColor() {
    }

    public static boolean isValid(String value) {
        return value != null && HEX.matcher(value.trim()).matches();
    }

    /**
     * Canonical {@code #RRGGBB} form, or {@code null} when the value is not a 6-digit hex color.
     */
    public static String normalize(String value) {
        if (!isValid(value)) {
            return null;
        }
        String trimmed = value.trim().toUpperCase(Locale.ROOT);
        return trimmed.startsWith("#") ? trimmed : "#" + trimmed;
    }
}
