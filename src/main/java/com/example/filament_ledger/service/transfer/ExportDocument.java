package com.example.filament_ledger.service.transfer;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Portable inventory snapshot. Field names match the mobile app's export files so either side can
 * read the other's output. Instants travel as ISO-8601 UTC text and prices as decimal strings.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record ExportDocument(
        String version,
        Instant exportDate,
        List<SpoolDocument> filaments,
        List<MaterialColorDocument> materialColorConfigs,
        SettingsDocument appSettings
) {

    public record SpoolDocument(
            UUID id,
            String brand,
            String material,
            String colorName,
            String colorHex,
            Double diameter,
            Double initialWeight,
            Double remainingWeight,
            Double emptySpoolWeight,
            Double density,
            Integer minTemp,
            Integer maxTemp,
            Integer bedTemp,
            @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal price,
            Instant purchaseDate,
            @JsonProperty("isArchived") boolean archived,
            String notes,
            List<UsageDocument> logs
    ) {
    }

    public record UsageDocument(
            UUID id,
            Double amount,
            Instant date,
            String note,
            String type
    ) {
    }

    public record MaterialColorDocument(String material, String colorHex) {
    }

    public record SettingsDocument(
            Double defaultDiameter,
            Double lowStockThreshold,
            String currency,
            String language
    ) {
    }
}
