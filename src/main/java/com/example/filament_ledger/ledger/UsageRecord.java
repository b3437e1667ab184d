package com.example.filament_ledger.ledger;

import java.time.Instant;
import java.util.UUID;

/**
 * One consumption event against a spool. Never mutated after creation.
 */
public record UsageRecord(
        UUID id,
        UUID spoolId,
        double massGrams,
        Instant recordedAt,
        String label,
        UsageCategory category
) {
}
