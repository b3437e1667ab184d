package com.example.filament_ledger.service.recognition;

/**
 * Fields as the recognition service returns them, before any interpretation.
 *
 * @param weight          free text such as {@code 1kg} or {@code 1000}
 * @param temperatureInfo printed temperature ranges, kept as text
 */
public record RecognitionResult(
        String brand,
        String material,
        String colorName,
        String colorHex,
        String weight,
        Double diameter,
        String temperatureInfo,
        Double confidence
) {
}
