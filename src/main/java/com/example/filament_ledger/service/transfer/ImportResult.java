package com.example.filament_ledger.service.transfer;

/**
 * Counts of a committed import.
 */
public record ImportResult(
        ImportPolicy policy,
        ImportState state,
        int spoolsCreated,
        int spoolsSkipped,
        int usageRecordsCreated,
        int usageRecordsSkipped,
        int colorsCreated,
        int colorsSkipped,
        boolean settingsUpdated,
        int written
) {
}
