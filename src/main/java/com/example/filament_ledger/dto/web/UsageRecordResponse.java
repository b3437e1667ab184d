package com.example.filament_ledger.dto.web;

import com.example.filament_ledger.ledger.UsageCategory;
import com.example.filament_ledger.ledger.UsageRecord;

import java.time.Instant;
import java.util.UUID;

public record UsageRecordResponse(
        UUID id,
        UUID spoolId,
        double massGrams,
        Instant recordedAt,
        String label,
        UsageCategory category
) {
    public static UsageRecordResponse from(UsageRecord r) {
        return new UsageRecordResponse(r.id(), r.spoolId(), r.massGrams(), r.recordedAt(), r.label(), r.category());
    }
}
