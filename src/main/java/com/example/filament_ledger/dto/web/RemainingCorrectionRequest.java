package com.example.filament_ledger.dto.web;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record RemainingCorrectionRequest(@NotNull @PositiveOrZero Double remainingMassGrams) {
}
