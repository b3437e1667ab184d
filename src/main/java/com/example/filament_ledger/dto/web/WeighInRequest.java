package com.example.filament_ledger.dto.web;

import com.example.filament_ledger.ledger.UsageCategory;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public record WeighInRequest(
        @NotNull UUID spoolId,
        @NotNull @PositiveOrZero Double grossMassGrams,
        @Size(max = 200) String label,
        UsageCategory category
) {
}
