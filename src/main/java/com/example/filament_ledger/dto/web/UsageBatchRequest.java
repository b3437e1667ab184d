package com.example.filament_ledger.dto.web;

import com.example.filament_ledger.ledger.UsageCategory;
import com.example.filament_ledger.service.UsageRecorder.UsageEntry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Entries are checked one by one by the recorder, so a bad spool id or amount rejects only that
 * entry instead of the whole request.
 */
public record UsageBatchRequest(@NotEmpty @Size(max = 100) List<@Valid Entry> entries) {

    public List<UsageEntry> toEntries() {
        return entries.stream()
                .map(e -> new UsageEntry(e.spoolId(), e.massGrams() == null ? 0 : e.massGrams(), e.label(),
                        e.category(), e.recordedAt()))
                .toList();
    }

    public record Entry(
            UUID spoolId,
            Double massGrams,
            @Size(max = 200) String label,
            UsageCategory category,
            Instant recordedAt
    ) {
    }
}
